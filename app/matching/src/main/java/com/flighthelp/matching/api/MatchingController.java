/*
 * どこで: Matching API
 * 何を: 候補一覧/マッチ確定/マッチ取消エンドポイントを公開する
 * なぜ: requester が候補を選び、1 対 1 (送迎は残席の範囲) で確定する入口を提供するため
 */
package com.flighthelp.matching.api;

import com.flighthelp.matching.api.request.ConfirmMatchRequest;
import com.flighthelp.matching.api.response.MatchConfirmationResponse;
import com.flighthelp.matching.api.response.MatchListResponse;
import com.flighthelp.matching.api.response.RankedMatchResponse;
import com.flighthelp.matching.model.MatchConfirmation;
import com.flighthelp.matching.model.RankedMatch;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.service.MatchConfirmationService;
import com.flighthelp.matching.service.MatchFinderService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/{domain}")
@RequiredArgsConstructor
public class MatchingController {

  static final String HEADER_USER_ID = "X-User-Id";

  private final MatchFinderService matchFinderService;
  private final MatchConfirmationService matchConfirmationService;

  @GetMapping("/requests/{requestId}/matches")
  public ResponseEntity<MatchListResponse> findMatches(
      @PathVariable("domain") String domain,
      @PathVariable("requestId") long requestId,
      @RequestParam(name = "max_results", defaultValue = "10") int maxResults) {
    final ServiceDomain serviceDomain = ServiceDomain.fromValue(domain);
    final List<RankedMatch> matches =
        MatchOutcomeException.unwrap(
            matchFinderService.findMatches(serviceDomain, requestId, maxResults));
    return ResponseEntity.ok(
        new MatchListResponse(
            serviceDomain.value(),
            requestId,
            matches.stream()
                .map(
                    match ->
                        new RankedMatchResponse(
                            match.offerId(),
                            match.helperId(),
                            match.score(),
                            match.price(),
                            match.reason()))
                .toList()));
  }

  @PutMapping("/matches")
  public ResponseEntity<MatchConfirmationResponse> confirmMatch(
      @PathVariable("domain") String domain,
      @Valid @RequestBody ConfirmMatchRequest request) {
    final MatchConfirmation confirmation =
        MatchOutcomeException.unwrap(
            matchConfirmationService.confirm(
                ServiceDomain.fromValue(domain), request.requestId(), request.offerId()));
    return ResponseEntity.ok(toResponse(confirmation, "MATCHED"));
  }

  @DeleteMapping("/requests/{requestId}/match")
  public ResponseEntity<MatchConfirmationResponse> cancelMatch(
      @PathVariable("domain") String domain,
      @PathVariable("requestId") long requestId,
      @RequestHeader(HEADER_USER_ID) String userId) {
    final MatchConfirmation cancelled =
        MatchOutcomeException.unwrap(
            matchConfirmationService.cancel(ServiceDomain.fromValue(domain), requestId, userId));
    return ResponseEntity.ok(toResponse(cancelled, "CANCELLED"));
  }

  private MatchConfirmationResponse toResponse(MatchConfirmation confirmation, String status) {
    return new MatchConfirmationResponse(
        confirmation.domain().value(),
        confirmation.requestId(),
        confirmation.offerId(),
        confirmation.requesterId(),
        confirmation.helperId(),
        confirmation.matchedAt() == null ? null : confirmation.matchedAt().toString(),
        status);
  }
}
