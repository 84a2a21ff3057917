/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant/LocalDate/LocalTime を SQL 型へ明示変換する
 * なぜ: PostgreSQL JDBC の型推論に頼らず、日付と時刻を常に明示型でバインドするため
 */
package com.flighthelp.common;

import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // 便の日付はタイムゾーンを持たない暦日として扱う
  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }

  public static Time toSqlTime(LocalTime time) {
    return time == null ? null : Time.valueOf(time);
  }

  public static LocalTime toLocalTime(Time time) {
    return time == null ? null : time.toLocalTime();
  }
}
