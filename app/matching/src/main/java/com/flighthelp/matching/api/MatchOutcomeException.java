package com.flighthelp.matching.api;

import com.flighthelp.matching.model.MatchOutcome;
import com.flighthelp.matching.model.OutcomeStatus;

/** OK 以外の MatchOutcome を HTTP 応答へ変換するために Controller から送出する。 */
public class MatchOutcomeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final OutcomeStatus status;

  public MatchOutcomeException(OutcomeStatus status, String message) {
    super(message);
    this.status = status;
  }

  public OutcomeStatus status() {
    return status;
  }

  /** OK なら値を返し、それ以外は例外へ変換する。 */
  public static <T> T unwrap(MatchOutcome<T> outcome) {
    if (outcome.isOk()) {
      return outcome.value();
    }
    throw new MatchOutcomeException(outcome.status(), outcome.message());
  }
}
