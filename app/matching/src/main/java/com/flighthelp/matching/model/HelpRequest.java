/*
 * どこで: Matching ドメインモデル
 * 何を: 助けを求める側(request)の共通形状を定義する
 * なぜ: 2 系統の request をマッチング処理で同じように扱うため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

public interface HelpRequest {

  long id();

  String requesterId();

  ServiceDomain domain();

  BigDecimal offeredAmount();

  boolean active();

  boolean matched();

  /** 未マッチの間は null。 */
  Long matchedOfferId();

  Instant matchedAt();

  long version();

  Instant createdAt();

  /** ログと通知に載せる旅程の要約。 */
  String itinerarySummary();
}
