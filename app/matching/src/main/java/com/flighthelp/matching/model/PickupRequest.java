/*
 * どこで: Matching ドメインモデル
 * 何を: 送迎依頼(pickup_requests)のスナップショットを表す
 * なぜ: 人数/荷物の条件を持ったままマッチングへ渡すため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PickupRequest(
    long id,
    String requesterId,
    PickupItinerary itinerary,
    String flightNumber,
    String destinationAddress,
    String passengerName,
    String passengerPhone,
    int passengerCount,
    boolean hasLuggage,
    BigDecimal offeredAmount,
    String specialRequests,
    boolean active,
    boolean matched,
    Long matchedOfferId,
    Instant matchedAt,
    long version,
    Instant createdAt)
    implements HelpRequest {

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.PICKUP;
  }

  @Override
  public String itinerarySummary() {
    return itinerary.summary();
  }
}
