package com.prestige.store.model;

/** ストアのテーブル名。TableGateway へ渡す識別子はここに集約する。 */
public final class StoreTables {

  public static final String WATCHES = "watches";
  public static final String INQUIRIES = "inquiries";
  public static final String SELL_SUBMISSIONS = "sell_submissions";
  public static final String ADMIN_USERS = "admin_users";
  public static final String SETTINGS = "settings";

  private StoreTables() {}
}
