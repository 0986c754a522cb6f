package com.prestige.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }

  /** ヘッダ値が空なら新しい ID を払い出す。 */
  public static String orNew(String candidate) {
    if (candidate == null || candidate.isBlank()) {
      return newTraceId();
    }
    return candidate.trim();
  }
}
