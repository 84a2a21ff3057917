/*
 * どこで: Matching サービス層
 * 何を: 1 件の request に対する候補 offer を絞り込み、スコア順に返す
 * なぜ: 旅程インデックスで候補を限定し、全件走査なしで推薦一覧を作るため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.config.MatchingProperties;
import com.flighthelp.matching.model.HelpOffer;
import com.flighthelp.matching.model.HelpRequest;
import com.flighthelp.matching.model.MatchOutcome;
import com.flighthelp.matching.model.RankedMatch;
import com.flighthelp.matching.model.ServiceDomain;
import com.flighthelp.matching.scoring.CompatibilityScorer;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MatchFinderService {

  private static final Logger logger = LoggerFactory.getLogger(MatchFinderService.class);

  private final MatchingDomains domains;
  private final CompatibilityScorer scorer;
  private final MatchingProperties properties;
  private final MatchingMetrics metrics;

  /**
   * 役割: request に適合する offer を最大 maxResults 件、スコア降順で返す。
   * 動作: request が存在しない/無効/マッチ済みなら NOT_FOUND、件数指定が範囲外なら INVALID を返す。
   * 前提: 読み取りのみで状態は変更しない。
   */
  public MatchOutcome<List<RankedMatch>> findMatches(
      ServiceDomain domain, long requestId, int maxResults) {
    if (requestId <= 0) {
      return MatchOutcome.invalid("request_id must be positive");
    }
    if (maxResults < 1 || maxResults > properties.maxResultsLimit()) {
      return MatchOutcome.invalid(
          "max_results must be between 1 and " + properties.maxResultsLimit());
    }
    return rank(domains.get(domain), requestId, maxResults);
  }

  private <R extends HelpRequest, O extends HelpOffer> MatchOutcome<List<RankedMatch>> rank(
      DomainBinding<R, O> binding, long requestId, int maxResults) {
    final long startedAt = System.nanoTime();
    final Optional<R> request = binding.repository().findActiveUnmatchedRequest(requestId);
    if (request.isEmpty()) {
      return MatchOutcome.notFound("open request not found: " + requestId);
    }
    final List<O> candidates = binding.repository().findAvailableOffersFor(request.get());
    final List<RankedMatch> ranked =
        candidates.stream()
            .map(offer -> scorer.score(binding.policy(), request.get(), offer))
            .flatMap(Optional::stream)
            .sorted(CompatibilityScorer.RANKING)
            .limit(maxResults)
            .map(RankedMatch::from)
            .toList();
    metrics.recordFind(
        binding.domain(), candidates.size(), Duration.ofNanos(System.nanoTime() - startedAt));
    logger.debug(
        "ranked matches domain={} requestId={} candidates={} returned={}",
        binding.domain().value(),
        requestId,
        candidates.size(),
        ranked.size());
    return MatchOutcome.ok(ranked);
  }
}
