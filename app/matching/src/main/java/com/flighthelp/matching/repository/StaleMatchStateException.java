package com.flighthelp.matching.repository;

/** 条件付き更新が競合により 0 件だったことを表す。トランザクションのロールバックに使う。 */
public class StaleMatchStateException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public StaleMatchStateException(String message) {
    super(message);
  }

  public StaleMatchStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
