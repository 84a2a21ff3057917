/*
 * どこで: Matching ドメインモデル
 * 何を: 同行の申し出(flight_companion_offers)のスナップショットを表す
 * なぜ: 1 便 1 依頼の提供者をスコアリングへ渡すため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

public record FlightCompanionOffer(
    long id,
    String helperId,
    FlightItinerary itinerary,
    String airline,
    String availableServices,
    String languages,
    BigDecimal requestedAmount,
    boolean available,
    String additionalInfo,
    int helpedCount,
    BigDecimal averageRating,
    long version,
    Instant createdAt)
    implements HelpOffer {

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.FLIGHT_COMPANION;
  }

  @Override
  public BigDecimal price() {
    return requestedAmount;
  }

  @Override
  public int completedCount() {
    return helpedCount;
  }

  @Override
  public String itinerarySummary() {
    return itinerary.summary();
  }
}
