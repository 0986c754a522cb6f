/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC の時刻型と Instant を相互変換する
 * なぜ: ドライバごとに返る時刻型 (Timestamp / OffsetDateTime 等) の差を呼び出し側へ漏らさないため
 */
package com.prestige.common;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  /** JDBC から読んだ時刻値を Instant へ揃える。時刻型でなければ null。 */
  public static Instant toInstant(Object value) {
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Timestamp timestamp) {
      return timestamp.toInstant();
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return zonedDateTime.toInstant();
    }
    if (value instanceof LocalDateTime localDateTime) {
      // タイムゾーン無しの列は UTC として扱う
      return localDateTime.toInstant(ZoneOffset.UTC);
    }
    return null;
  }

  public static boolean isTemporal(Object value) {
    return toInstant(value) != null;
  }
}
