package com.flighthelp.matching.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flighthelp.matching.config.MatchingNatsProperties;
import com.flighthelp.matching.model.MatchConfirmedNotice;
import com.flighthelp.matching.model.ServiceDomain;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class NatsMatchNotifierTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  private final JetStream jetStream = Mockito.mock(JetStream.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final NatsMatchNotifier notifier =
      new NatsMatchNotifier(
          jetStream,
          objectMapper,
          new MatchingNatsProperties("matching.events.match-confirmed"),
          new MatchingMetrics(registry),
          Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void publishesSnakeCasePayloadWithDedupHeader() throws Exception {
    when(jetStream.publishAsync(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.completedFuture(Mockito.mock(PublishAck.class)));

    notifier.notifyMatchConfirmed(notice());

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publishAsync(eq("matching.events.match-confirmed"), headers.capture(), body.capture());
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("event_type").asText()).isEqualTo("MATCH_CONFIRMED");
    assertThat(json.get("domain").asText()).isEqualTo("pickup");
    assertThat(json.get("request_id").asLong()).isEqualTo(1L);
    assertThat(json.get("helper_id").asText()).isEqualTo("user-b");
    assertThat(json.get("occurred_at").asText()).isEqualTo(NOW.toString());
    assertThat(headers.getValue().getFirst("Nats-Msg-Id"))
        .isEqualTo(json.get("event_id").asText());
  }

  @Test
  void countsAsynchronousPublishFailures() {
    when(jetStream.publishAsync(any(String.class), any(Headers.class), any(byte[].class)))
        .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("no ack")));

    notifier.notifyMatchConfirmed(notice());

    assertThat(
            registry
                .get("matching.notify.error.total")
                .tag("domain", "pickup")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void propagatesSynchronousPublishErrors() {
    when(jetStream.publishAsync(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IllegalStateException("connection closed"));

    assertThatThrownBy(() -> notifier.notifyMatchConfirmed(notice()))
        .isInstanceOf(IllegalStateException.class);
  }

  private MatchConfirmedNotice notice() {
    return new MatchConfirmedNotice(
        ServiceDomain.PICKUP,
        1L,
        20L,
        "user-a",
        "user-b",
        "AKL 2026-04-10 14:00",
        new BigDecimal("60"),
        NOW);
  }
}
