/*
 * どこで: Matching サービス層
 * 何を: マッチの確定と取消の状態遷移を制御する
 * なぜ: 同時確定でも 1 offer の過剰割当を起こさず、再送には同じ結果を返すため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.MatchConfirmation;
import com.flighthelp.matching.model.MatchConfirmedNotice;
import com.flighthelp.matching.model.MatchOutcome;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.repository.StaleMatchStateException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchConfirmationService {

  private static final Logger logger = LoggerFactory.getLogger(MatchConfirmationService.class);

  private final MatchingDomains domains;
  private final MatchNotifier notifier;
  private final MatchingMetrics metrics;
  private final Clock clock;

  /**
   * 役割: request と offer を結び付けて確定する。
   * 動作: 既に同じ offer で確定済みなら保存済みの結果をそのまま返す。別 offer で確定済み、offer の空き無し、
   * 並行確定に負けた場合は CONFLICT。
   * 前提: 通知はコミット後に行い、通知の失敗は確定結果へ影響させない。
   */
  public MatchOutcome<MatchConfirmation> confirm(
      ServiceDomain domain, long requestId, long offerId) {
    if (requestId <= 0 || offerId <= 0) {
      return recordConfirm(domain, MatchOutcome.invalid("request_id and offer_id must be positive"));
    }
    return recordConfirm(domain, confirmIn(domains.get(domain), requestId, offerId));
  }

  /**
   * 役割: 確定済みのマッチを取り消し、offer 側の空きを戻す。
   * 動作: requester 以外は FORBIDDEN、未確定なら CONFLICT を返す。
   * 前提: 取消も監査記録に残す。
   */
  public MatchOutcome<MatchConfirmation> cancel(
      ServiceDomain domain, long requestId, String actorId) {
    if (requestId <= 0) {
      return recordCancel(domain, MatchOutcome.invalid("request_id must be positive"));
    }
    if (actorId == null || actorId.isBlank()) {
      return recordCancel(domain, MatchOutcome.invalid("X-User-Id is required"));
    }
    return recordCancel(domain, cancelIn(domains.get(domain), requestId, actorId));
  }

  private <R extends HelpRequest, O extends HelpOffer> MatchOutcome<MatchConfirmation> confirmIn(
      DomainBinding<R, O> binding, long requestId, long offerId) {
    final Optional<R> found = binding.repository().findRequestById(requestId);
    if (found.isEmpty() || !found.get().active()) {
      return MatchOutcome.notFound("request not found: " + requestId);
    }
    final R request = found.get();
    if (request.matched()) {
      return alreadyMatched(binding, request, offerId);
    }
    final Optional<O> foundOffer = binding.repository().findOfferById(offerId);
    if (foundOffer.isEmpty()) {
      return MatchOutcome.notFound("offer not found: " + offerId);
    }
    final O offer = foundOffer.get();
    if (Objects.equals(request.requesterId(), offer.helperId())) {
      return MatchOutcome.invalid("requester cannot accept their own offer");
    }
    if (!binding.policy().isItineraryCompatible(request, offer)) {
      return MatchOutcome.invalid("offer itinerary does not match the request");
    }
    final Optional<String> violation = binding.policy().intrinsicViolation(request, offer);
    if (violation.isPresent()) {
      return MatchOutcome.invalid(violation.get());
    }
    if (!binding.policy().hasCapacityFor(request, offer)) {
      return MatchOutcome.conflict("offer is no longer available: " + offerId);
    }

    final Instant matchedAt = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    try {
      binding.repository().bindMatch(request, offer, matchedAt);
    } catch (StaleMatchStateException ex) {
      logger.info(
          "match bind lost a race domain={} requestId={} offerId={} reason={}",
          binding.domain().value(),
          requestId,
          offerId,
          ex.getMessage());
      return binding
          .repository()
          .findRequestById(requestId)
          .filter(current -> current.matched() && Objects.equals(current.matchedOfferId(), offerId))
          .map(current -> MatchOutcome.ok(toConfirmation(current, offer)))
          .orElseGet(() -> MatchOutcome.conflict("request or offer changed concurrently"));
    }

    logger.info(
        "match confirmed domain={} requestId={} offerId={} requesterId={} helperId={}",
        binding.domain().value(),
        requestId,
        offerId,
        request.requesterId(),
        offer.helperId());
    final MatchConfirmation confirmation =
        new MatchConfirmation(
            binding.domain(),
            requestId,
            offerId,
            request.requesterId(),
            offer.helperId(),
            matchedAt);
    notifyQuietly(request, offer, confirmation);
    return MatchOutcome.ok(confirmation);
  }

  private <R extends HelpRequest, O extends HelpOffer>
      MatchOutcome<MatchConfirmation> alreadyMatched(
          DomainBinding<R, O> binding, R request, long offerId) {
    if (!Objects.equals(request.matchedOfferId(), offerId)) {
      return MatchOutcome.conflict("request already matched to another offer");
    }
    final String helperId =
        binding.repository().findOfferById(offerId).map(HelpOffer::helperId).orElse(null);
    return MatchOutcome.ok(
        new MatchConfirmation(
            binding.domain(),
            request.id(),
            offerId,
            request.requesterId(),
            helperId,
            request.matchedAt()));
  }

  private <R extends HelpRequest, O extends HelpOffer> MatchOutcome<MatchConfirmation> cancelIn(
      DomainBinding<R, O> binding, long requestId, String actorId) {
    final Optional<R> found = binding.repository().findRequestById(requestId);
    if (found.isEmpty()) {
      return MatchOutcome.notFound("request not found: " + requestId);
    }
    final R request = found.get();
    if (!actorId.equals(request.requesterId())) {
      return MatchOutcome.forbidden("only the requester can cancel a match");
    }
    if (!request.matched() || request.matchedOfferId() == null) {
      return MatchOutcome.conflict("request is not matched: " + requestId);
    }
    final Optional<O> offer = binding.repository().findOfferById(request.matchedOfferId());
    if (offer.isEmpty()) {
      return MatchOutcome.notFound("offer not found: " + request.matchedOfferId());
    }
    try {
      binding.repository().releaseMatch(request, offer.get(), actorId, Instant.now(clock));
    } catch (StaleMatchStateException ex) {
      return MatchOutcome.conflict("request changed concurrently");
    }
    logger.info(
        "match cancelled domain={} requestId={} offerId={} actorId={}",
        binding.domain().value(),
        requestId,
        offer.get().id(),
        actorId);
    return MatchOutcome.ok(toConfirmation(request, offer.get()));
  }

  private MatchConfirmation toConfirmation(HelpRequest request, HelpOffer offer) {
    return new MatchConfirmation(
        request.domain(),
        request.id(),
        offer.id(),
        request.requesterId(),
        offer.helperId(),
        request.matchedAt());
  }

  private void notifyQuietly(
      HelpRequest request, HelpOffer offer, MatchConfirmation confirmation) {
    try {
      notifier.notifyMatchConfirmed(
          new MatchConfirmedNotice(
              confirmation.domain(),
              confirmation.requestId(),
              confirmation.offerId(),
              confirmation.requesterId(),
              confirmation.helperId(),
              request.itinerarySummary(),
              offer.price(),
              confirmation.matchedAt()));
    } catch (RuntimeException ex) {
      metrics.recordNotificationFailure(confirmation.domain());
      logger.warn(
          "match notification failed domain={} requestId={} offerId={}",
          confirmation.domain().value(),
          confirmation.requestId(),
          confirmation.offerId(),
          ex);
    }
  }

  private <T> MatchOutcome<T> recordConfirm(ServiceDomain domain, MatchOutcome<T> outcome) {
    metrics.recordConfirmation(domain, outcome.status().name().toLowerCase(Locale.ROOT));
    return outcome;
  }

  private <T> MatchOutcome<T> recordCancel(ServiceDomain domain, MatchOutcome<T> outcome) {
    metrics.recordCancellation(domain, outcome.status().name().toLowerCase(Locale.ROOT));
    return outcome;
  }
}
