package com.prestige.store.notification.whatsapp;

import java.util.regex.Pattern;

/** 送信先電話番号の正規化。米国番号を前提とした E.164 形式へ揃える。 */
public final class PhoneNumbers {

  private static final Pattern NON_DIGITS = Pattern.compile("\\D");
  private static final Pattern US_NUMBER = Pattern.compile("^\\+1\\d{10}$");

  private PhoneNumbers() {}

  public static String normalize(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("phone number is required");
    }
    String digits = NON_DIGITS.matcher(raw).replaceAll("");
    if (digits.isEmpty()) {
      throw new IllegalArgumentException("phone number is invalid");
    }
    // 市外局番から始まる 10 桁は国番号 1 を補う
    if (digits.length() == 10 && !digits.startsWith("1")) {
      digits = "1" + digits;
    }
    return "+" + digits;
  }

  public static boolean isValidUsNumber(String raw) {
    if (raw == null || NON_DIGITS.matcher(raw).replaceAll("").isEmpty()) {
      return false;
    }
    return US_NUMBER.matcher(normalize(raw)).matches();
  }
}
