/*
 * どこで: Matching サービス層
 * 何を: request/offer の登録と request の取り下げを行う
 * なぜ: 金額上限や人数などの入力条件を domain ごとに一箇所で検証するため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.api.request.FlightCompanionOfferBody;
import com.flighthelp.matching.api.request.FlightCompanionRequestBody;
import com.flighthelp.matching.api.request.PickupOfferBody;
import com.flighthelp.matching.api.request.PickupRequestBody;
import com.flighthelp.matching.model.FlightCompanionOffer;
import com.flighthelp.matching.model.FlightCompanionRequest;
import com.flighthelp.matching.model.FlightItinerary;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.MatchOutcome;
import com.flighthelp.matching.model.PickupItinerary;
import com.flighthelp.matching.model.PickupOffer;
import com.flighthelp.matching.model.PickupRequest;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.repository.FlightCompanionRepository;
import com.flighthelp.matching.repository.HelpMatchRepository;
import com.flighthelp.matching.repository.PickupRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HelpPostingService {

  private static final Logger logger = LoggerFactory.getLogger(HelpPostingService.class);
  private static final int DEFAULT_MAX_PASSENGERS = 4;

  private final FlightCompanionRepository flightCompanionRepository;
  private final PickupRepository pickupRepository;
  private final MatchingDomains domains;
  private final Clock clock;

  public MatchOutcome<FlightCompanionRequest> postFlightCompanionRequest(
      String requesterId, FlightCompanionRequestBody body) {
    final Optional<String> invalid =
        validate(ServiceDomain.FLIGHT_COMPANION, requesterId, body.offeredAmount());
    if (invalid.isPresent()) {
      return MatchOutcome.invalid(invalid.get());
    }
    final FlightCompanionRequest created =
        flightCompanionRepository.insertRequest(
            new FlightCompanionRequest(
                0L,
                requesterId,
                new FlightItinerary(
                    body.flightNumber(),
                    body.flightDate(),
                    body.departureAirport(),
                    body.arrivalAirport()),
                body.airline(),
                body.travelerName(),
                body.travelerAge(),
                body.specialNeeds(),
                body.offeredAmount(),
                body.additionalNotes(),
                true,
                false,
                null,
                null,
                0L,
                now()));
    logger.info(
        "request posted domain={} requestId={} requesterId={} itinerary={}",
        created.domain().value(),
        created.id(),
        requesterId,
        created.itinerarySummary());
    return MatchOutcome.ok(created);
  }

  public MatchOutcome<FlightCompanionOffer> postFlightCompanionOffer(
      String helperId, FlightCompanionOfferBody body) {
    final Optional<String> invalid =
        validate(ServiceDomain.FLIGHT_COMPANION, helperId, body.requestedAmount());
    if (invalid.isPresent()) {
      return MatchOutcome.invalid(invalid.get());
    }
    final FlightCompanionOffer created =
        flightCompanionRepository.insertOffer(
            new FlightCompanionOffer(
                0L,
                helperId,
                new FlightItinerary(
                    body.flightNumber(),
                    body.flightDate(),
                    body.departureAirport(),
                    body.arrivalAirport()),
                body.airline(),
                body.availableServices(),
                body.languages(),
                body.requestedAmount(),
                true,
                body.additionalInfo(),
                0,
                BigDecimal.ZERO,
                0L,
                now()));
    logger.info(
        "offer posted domain={} offerId={} helperId={}",
        created.domain().value(),
        created.id(),
        helperId);
    return MatchOutcome.ok(created);
  }

  public MatchOutcome<PickupRequest> postPickupRequest(String requesterId, PickupRequestBody body) {
    final Optional<String> invalid =
        validate(ServiceDomain.PICKUP, requesterId, body.offeredAmount());
    if (invalid.isPresent()) {
      return MatchOutcome.invalid(invalid.get());
    }
    if (body.passengerCount() == null || body.passengerCount() < 1) {
      return MatchOutcome.invalid("passenger_count must be at least 1");
    }
    final PickupRequest created =
        pickupRepository.insertRequest(
            new PickupRequest(
                0L,
                requesterId,
                new PickupItinerary(body.airport(), body.arrivalDate(), body.arrivalTime()),
                body.flightNumber(),
                body.destinationAddress(),
                body.passengerName(),
                body.passengerPhone(),
                body.passengerCount(),
                body.hasLuggage() == null || body.hasLuggage(),
                body.offeredAmount(),
                body.specialRequests(),
                true,
                false,
                null,
                null,
                0L,
                now()));
    logger.info(
        "request posted domain={} requestId={} requesterId={} itinerary={}",
        created.domain().value(),
        created.id(),
        requesterId,
        created.itinerarySummary());
    return MatchOutcome.ok(created);
  }

  public MatchOutcome<PickupOffer> postPickupOffer(String helperId, PickupOfferBody body) {
    final Optional<String> invalid = validate(ServiceDomain.PICKUP, helperId, body.baseRate());
    if (invalid.isPresent()) {
      return MatchOutcome.invalid(invalid.get());
    }
    final int maxPassengers =
        body.maxPassengers() == null ? DEFAULT_MAX_PASSENGERS : body.maxPassengers();
    if (maxPassengers < 1) {
      return MatchOutcome.invalid("max_passengers must be at least 1");
    }
    final PickupOffer created =
        pickupRepository.insertOffer(
            new PickupOffer(
                0L,
                helperId,
                new PickupItinerary(body.airport(), body.availableDate(), body.availableTime()),
                body.vehicleType(),
                maxPassengers,
                maxPassengers,
                body.canHandleLuggage() == null || body.canHandleLuggage(),
                body.serviceArea(),
                body.baseRate(),
                body.languages(),
                body.additionalServices(),
                true,
                0,
                BigDecimal.ZERO,
                0L,
                now()));
    logger.info(
        "offer posted domain={} offerId={} helperId={}",
        created.domain().value(),
        created.id(),
        helperId);
    return MatchOutcome.ok(created);
  }

  /**
   * 役割: request の所有者が依頼を取り下げる。
   * 動作: 既に無効なら OK を返す。確定済みの request は先に取消が必要なため CONFLICT を返す。
   * 前提: 取り下げはマッチ関連の項目を変更しない。
   */
  public MatchOutcome<Long> withdrawRequest(ServiceDomain domain, long requestId, String ownerId) {
    if (requestId <= 0) {
      return MatchOutcome.invalid("request_id must be positive");
    }
    if (ownerId == null || ownerId.isBlank()) {
      return MatchOutcome.invalid("X-User-Id is required");
    }
    final HelpMatchRepository<?, ?> repository = domains.get(domain).repository();
    final Optional<? extends HelpRequest> found = repository.findRequestById(requestId);
    if (found.isEmpty()) {
      return MatchOutcome.notFound("request not found: " + requestId);
    }
    if (!ownerId.equals(found.get().requesterId())) {
      return MatchOutcome.forbidden("only the requester can withdraw a request");
    }
    if (!found.get().active()) {
      return MatchOutcome.ok(requestId);
    }
    if (found.get().matched()) {
      return MatchOutcome.conflict("matched request must be cancelled before withdrawal");
    }
    if (!repository.deactivateRequest(requestId)) {
      // 読み取り後に確定か取り下げが先行した
      final boolean nowInactive =
          repository.findRequestById(requestId).map(request -> !request.active()).orElse(false);
      return nowInactive
          ? MatchOutcome.ok(requestId)
          : MatchOutcome.conflict("request changed concurrently");
    }
    logger.info(
        "request withdrawn domain={} requestId={} ownerId={}", domain.value(), requestId, ownerId);
    return MatchOutcome.ok(requestId);
  }

  private Optional<String> validate(ServiceDomain domain, String ownerId, BigDecimal amount) {
    if (ownerId == null || ownerId.isBlank()) {
      return Optional.of("X-User-Id is required");
    }
    if (!domain.isAmountWithinBounds(amount)) {
      return Optional.of("amount must be between 0 and " + domain.maxAmount().toPlainString());
    }
    return Optional.empty();
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }
}
