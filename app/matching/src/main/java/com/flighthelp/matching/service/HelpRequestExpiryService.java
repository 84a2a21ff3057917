/*
 * どこで: Matching 期限切れサービス
 * 何を: 便/到着日が過ぎた未マッチの request を無効化する
 * なぜ: 過去の依頼が候補検索や確定の対象に残り続けないようにするため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.model.ServiceDomain;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HelpRequestExpiryService {

  private static final Logger logger = LoggerFactory.getLogger(HelpRequestExpiryService.class);

  private final MatchingDomains domains;
  private final MatchingMetrics metrics;
  private final Clock clock;

  public Map<ServiceDomain, Integer> expire() {
    // 「今日」は Clock のタイムゾーンで決める
    final LocalDate today = LocalDate.now(clock);
    final Map<ServiceDomain, Integer> deactivated = new EnumMap<>(ServiceDomain.class);
    for (DomainBinding<?, ?> binding : domains.all()) {
      try {
        final int count = binding.repository().deactivateRequestsBefore(today);
        metrics.recordExpired(binding.domain(), count);
        deactivated.put(binding.domain(), count);
      } catch (RuntimeException ex) {
        // 1 domain の失敗で他の domain の処理を止めない。次回実行で再試行される
        logger.warn("matching expiry failed domain={}", binding.domain().value(), ex);
      }
    }
    logger.info("matching expiry deactivated requests={} before={}", deactivated, today);
    return deactivated;
  }
}
