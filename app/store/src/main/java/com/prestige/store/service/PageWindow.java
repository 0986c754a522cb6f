package com.prestige.store.service;

/** 管理一覧のページ指定。limit は 1..100、既定 50。 */
public record PageWindow(int limit, int offset) {

  public static final int DEFAULT_LIMIT = 50;
  public static final int MAX_LIMIT = 100;

  public PageWindow {
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
  }

  public static PageWindow of(Integer limit, Integer offset) {
    return new PageWindow(limit == null ? DEFAULT_LIMIT : limit, offset == null ? 0 : offset);
  }
}
