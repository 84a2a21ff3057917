/*
 * どこで: Matching ドメインモデル
 * 何を: 送迎の申し出(pickup_offers)のスナップショットを表す
 * なぜ: 残席数を持つ複数依頼対応の提供者を表現するため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PickupOffer(
    long id,
    String helperId,
    PickupItinerary itinerary,
    String vehicleType,
    int maxPassengers,
    int remainingSeats,
    boolean canHandleLuggage,
    String serviceArea,
    BigDecimal baseRate,
    String languages,
    String additionalServices,
    boolean available,
    int totalPickups,
    BigDecimal averageRating,
    long version,
    Instant createdAt)
    implements HelpOffer {

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.PICKUP;
  }

  @Override
  public BigDecimal price() {
    return baseRate;
  }

  @Override
  public int completedCount() {
    return totalPickups;
  }

  @Override
  public String itinerarySummary() {
    return itinerary.summary();
  }
}
