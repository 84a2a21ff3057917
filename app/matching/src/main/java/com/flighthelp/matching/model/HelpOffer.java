/*
 * どこで: Matching ドメインモデル
 * 何を: 助ける側(offer)の共通形状を定義する
 * なぜ: スコアリングとランキングを domain 非依存に書くため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

public interface HelpOffer {

  long id();

  String helperId();

  ServiceDomain domain();

  /** helper が求める金額 (flight: requestedAmount, pickup: baseRate)。 */
  BigDecimal price();

  boolean available();

  /** これまでに完了した支援回数 (flight: helpedCount, pickup: totalPickups)。 */
  int completedCount();

  /** 0.00 - 5.00。評価が無い場合は 0。 */
  BigDecimal averageRating();

  long version();

  Instant createdAt();

  String itinerarySummary();
}
