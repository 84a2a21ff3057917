/*
 * どこで: Matching ドメインモデル
 * 何を: 同行(flight companion)と送迎(pickup)の 2 系統を定義する
 * なぜ: URL の domain 入力と金額上限を列挙型で固定するため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;

public enum ServiceDomain {
  FLIGHT_COMPANION("flight-companion", new BigDecimal("500")),
  PICKUP("pickup", new BigDecimal("200"));

  private final String value;
  private final BigDecimal maxAmount;

  ServiceDomain(String value, BigDecimal maxAmount) {
    this.value = value;
    this.maxAmount = maxAmount;
  }

  public String value() {
    return value;
  }

  public BigDecimal maxAmount() {
    return maxAmount;
  }

  /** 金額が 0 以上かつ domain ごとの上限以下なら true。 */
  public boolean isAmountWithinBounds(BigDecimal amount) {
    return amount != null && amount.signum() >= 0 && amount.compareTo(maxAmount) <= 0;
  }

  /**
   * 役割: URL で受け取った domain 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   * 前提: domain は null でないことを呼び出し側で保証する。
   */
  public static ServiceDomain fromValue(String domain) {
    for (ServiceDomain serviceDomain : values()) {
      if (serviceDomain.value.equalsIgnoreCase(domain)) {
        return serviceDomain;
      }
    }
    throw new IllegalArgumentException("unsupported domain: " + domain);
  }
}
