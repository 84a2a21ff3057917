/*
 * どこで: Matching API
 * 何を: request/offer の登録と request の取り下げエンドポイントを公開する
 * なぜ: マッチングの対象となるレコードを作成/終了する入口を提供するため
 */
package com.flighthelp.matching.api;

import com.flighthelp.matching.api.request.FlightCompanionOfferBody;
import com.flighthelp.matching.api.request.FlightCompanionRequestBody;
import com.flighthelp.matching.api.request.PickupOfferBody;
import com.flighthelp.matching.api.request.PickupRequestBody;
import com.flighthelp.matching.api.response.PostedOfferResponse;
import com.flighthelp.matching.api.response.PostedRequestResponse;
import com.flighthelp.matching.api.response.RequestWithdrawalResponse;
import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.service.HelpPostingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HelpPostingController {

  private static final String HEADER_USER_ID = MatchingController.HEADER_USER_ID;

  private final HelpPostingService helpPostingService;

  @PostMapping("/v1/flight-companion/requests")
  public ResponseEntity<PostedRequestResponse> postFlightCompanionRequest(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody FlightCompanionRequestBody body) {
    return created(
        MatchOutcomeException.unwrap(helpPostingService.postFlightCompanionRequest(userId, body)));
  }

  @PostMapping("/v1/flight-companion/offers")
  public ResponseEntity<PostedOfferResponse> postFlightCompanionOffer(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody FlightCompanionOfferBody body) {
    return created(
        MatchOutcomeException.unwrap(helpPostingService.postFlightCompanionOffer(userId, body)));
  }

  @PostMapping("/v1/pickup/requests")
  public ResponseEntity<PostedRequestResponse> postPickupRequest(
      @RequestHeader(HEADER_USER_ID) String userId, @Valid @RequestBody PickupRequestBody body) {
    return created(MatchOutcomeException.unwrap(helpPostingService.postPickupRequest(userId, body)));
  }

  @PostMapping("/v1/pickup/offers")
  public ResponseEntity<PostedOfferResponse> postPickupOffer(
      @RequestHeader(HEADER_USER_ID) String userId, @Valid @RequestBody PickupOfferBody body) {
    return created(MatchOutcomeException.unwrap(helpPostingService.postPickupOffer(userId, body)));
  }

  @DeleteMapping("/v1/{domain}/requests/{requestId}")
  public ResponseEntity<RequestWithdrawalResponse> withdrawRequest(
      @PathVariable("domain") String domain,
      @PathVariable("requestId") long requestId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    final ServiceDomain serviceDomain = ServiceDomain.fromValue(domain);
    MatchOutcomeException.unwrap(
        helpPostingService.withdrawRequest(serviceDomain, requestId, userId));
    return ResponseEntity.ok(
        new RequestWithdrawalResponse(serviceDomain.value(), requestId, "WITHDRAWN"));
  }

  private ResponseEntity<PostedRequestResponse> created(HelpRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new PostedRequestResponse(
                request.domain().value(),
                request.id(),
                request.requesterId(),
                request.itinerarySummary(),
                request.offeredAmount(),
                "OPEN",
                request.createdAt().toString()));
  }

  private ResponseEntity<PostedOfferResponse> created(HelpOffer offer) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new PostedOfferResponse(
                offer.domain().value(),
                offer.id(),
                offer.helperId(),
                offer.itinerarySummary(),
                offer.price(),
                "AVAILABLE",
                offer.createdAt().toString()));
  }
}
