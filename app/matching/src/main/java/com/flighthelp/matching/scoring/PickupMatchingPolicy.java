/*
 * どこで: Matching スコアリング層
 * 何を: 送迎系統の照合ルールを提供する
 * なぜ: 到着時刻の許容幅と、人数/荷物/残席の条件を一箇所で判定するため
 */
package com.flighthelp.matching.scoring;

import com.flighthelp.matching.config.MatchingProperties;
import com.flighthelp.matching.model.PickupOffer;
import com.flighthelp.matching.model.PickupRequest;
import com.flighthelp.matching.model.ServiceDomain;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PickupMatchingPolicy implements MatchingPolicy<PickupRequest, PickupOffer> {

  private final MatchingProperties properties;

  @Override
  public ServiceDomain domain() {
    return ServiceDomain.PICKUP;
  }

  @Override
  public boolean isItineraryCompatible(PickupRequest request, PickupOffer offer) {
    return request
        .itinerary()
        .compatibleWith(offer.itinerary(), properties.pickupTimeTolerance());
  }

  @Override
  public Optional<String> intrinsicViolation(PickupRequest request, PickupOffer offer) {
    if (offer.maxPassengers() < request.passengerCount()) {
      return Optional.of(
          "vehicle seats "
              + offer.maxPassengers()
              + " below passenger count "
              + request.passengerCount());
    }
    if (request.hasLuggage() && !offer.canHandleLuggage()) {
      return Optional.of("offer cannot handle luggage");
    }
    return Optional.empty();
  }

  @Override
  public boolean hasCapacityFor(PickupRequest request, PickupOffer offer) {
    return offer.available() && offer.remainingSeats() >= request.passengerCount();
  }

  @Override
  public OptionalDouble capabilityFit(PickupRequest request, PickupOffer offer) {
    return OptionalDouble.empty();
  }

  @Override
  public String recommendationReason(PickupOffer offer) {
    return Reasons.describe(offer, "pickups completed", "Available for pickup");
  }
}
