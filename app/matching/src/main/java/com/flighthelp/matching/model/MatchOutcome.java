package com.flighthelp.matching.model;

/**
 * マッチング操作の明示的な結果。
 *
 * <p>NOT_FOUND / CONFLICT / INVALID / FORBIDDEN は呼び出し側が扱うべき正常な結果であり、例外では表現しない。
 * ストレージ障害だけは DataAccessException として別経路で伝播する。
 */
public record MatchOutcome<T>(OutcomeStatus status, T value, String message) {

  public static <T> MatchOutcome<T> ok(T value) {
    return new MatchOutcome<>(OutcomeStatus.OK, value, null);
  }

  public static <T> MatchOutcome<T> notFound(String message) {
    return new MatchOutcome<>(OutcomeStatus.NOT_FOUND, null, message);
  }

  public static <T> MatchOutcome<T> conflict(String message) {
    return new MatchOutcome<>(OutcomeStatus.CONFLICT, null, message);
  }

  public static <T> MatchOutcome<T> invalid(String message) {
    return new MatchOutcome<>(OutcomeStatus.INVALID, null, message);
  }

  public static <T> MatchOutcome<T> forbidden(String message) {
    return new MatchOutcome<>(OutcomeStatus.FORBIDDEN, null, message);
  }

  public boolean isOk() {
    return status == OutcomeStatus.OK;
  }
}
