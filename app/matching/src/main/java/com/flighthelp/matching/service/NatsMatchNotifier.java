/*
 * どこで: Matching サービス層
 * 何を: マッチ成立イベントを JetStream へ非同期 publish する
 * なぜ: 通知サービスへ配送を委ね、確定 API の応答を通知の成否から切り離すため
 */
package com.flighthelp.matching.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flighthelp.common.TraceIds;
import com.flighthelp.common.event.MatchConfirmedEventPayload;
import com.flighthelp.matching.config.MatchingNatsProperties;
import com.flighthelp.matching.model.MatchConfirmedNotice;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsMatchNotifier implements MatchNotifier {

  static final String EVENT_TYPE = "MATCH_CONFIRMED";

  private static final Logger logger = LoggerFactory.getLogger(NatsMatchNotifier.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final MatchingNatsProperties properties;
  private final MatchingMetrics metrics;
  private final Clock clock;

  public NatsMatchNotifier(
      JetStream jetStream,
      ObjectMapper objectMapper,
      MatchingNatsProperties properties,
      MatchingMetrics metrics,
      Clock clock) {
    this.jetStream = jetStream;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * 役割: 通知 payload を組み立てて publish する。
   * 動作: ack は待たず、失敗は非同期にログとメトリクスへ記録する。
   * 前提: Nats-Msg-Id にイベント ID を載せ、JetStream 側で重複排除させる。
   */
  @Override
  public void notifyMatchConfirmed(MatchConfirmedNotice notice) {
    final String eventId = UUID.randomUUID().toString();
    final MatchConfirmedEventPayload payload =
        new MatchConfirmedEventPayload(
            eventId,
            EVENT_TYPE,
            Instant.now(clock).toString(),
            notice.domain().value(),
            notice.requestId(),
            notice.offerId(),
            notice.requesterId(),
            notice.helperId(),
            notice.itinerary(),
            notice.amount() == null ? null : notice.amount().toPlainString(),
            TraceIds.currentOrNew());
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize match confirmed event", ex);
    }
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", eventId);
    headers.add("event_type", EVENT_TYPE);
    jetStream
        .publishAsync(properties.subject(), headers, body)
        .whenComplete(
            (ack, ex) -> {
              if (ex != null) {
                metrics.recordNotificationFailure(notice.domain());
                logger.warn(
                    "match confirmed publish failed eventId={} requestId={} offerId={}",
                    eventId,
                    notice.requestId(),
                    notice.offerId(),
                    ex);
              }
            });
  }
}
