/*
 * どこで: Matching ドメインモデル
 * 何を: ランキング済み候補 1 件を domain 非依存の形で表現する
 * なぜ: API 応答へ offer 固有型を漏らさないため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;

public record RankedMatch(
    long offerId, String helperId, double score, BigDecimal price, String reason) {

  public static RankedMatch from(ScoredOffer<?> scored) {
    return new RankedMatch(
        scored.offer().id(),
        scored.offer().helperId(),
        scored.score(),
        scored.offer().price(),
        scored.reason());
  }
}
