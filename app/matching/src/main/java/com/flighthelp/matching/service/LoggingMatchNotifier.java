/*
 * どこで: Matching サービス層
 * 何を: NATS 無効時にマッチ成立をログへ出力する
 * なぜ: ローカルやテストで NATS なしでも確定処理を動かせるようにするため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.model.MatchConfirmedNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LoggingMatchNotifier implements MatchNotifier {

  private static final Logger logger = LoggerFactory.getLogger(LoggingMatchNotifier.class);

  @Override
  public void notifyMatchConfirmed(MatchConfirmedNotice notice) {
    logger.info(
        "match confirmed notification domain={} requestId={} offerId={} requesterId={}"
            + " helperId={} itinerary={}",
        notice.domain().value(),
        notice.requestId(),
        notice.offerId(),
        notice.requesterId(),
        notice.helperId(),
        notice.itinerary());
  }
}
