/*
 * どこで: Matching ドメインモデル
 * 何を: 同行依頼(flight_companion_requests)のスナップショットを表す
 * なぜ: Repository と Service 間で受け渡す構造を固定するため
 */
package com.flighthelp.matching.model;

import java.math.BigDecimal;
import java.time.Instant;

public record FlightCompanionRequest(
    long id,
    String requesterId,
    FlightItinerary itinerary,
    String airline,
    String travelerName,
    String travelerAge,
    String specialNeeds,
    BigDecimal offeredAmount,
    String additionalNotes,
    boolean active,
    boolean matched,
    Long matchedOfferId,
    Instant matchedAt,
    long version,
    Instant createdAt)
    implements HelpRequest {

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.FLIGHT_COMPANION;
  }

  @Override
  public String itinerarySummary() {
    return itinerary.summary();
  }
}
