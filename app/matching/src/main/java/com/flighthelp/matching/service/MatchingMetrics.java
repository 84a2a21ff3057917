/*
 * どこで: Matching サービス層
 * 何を: 検索/確定/通知/期限切れのメトリクス記録を集約する
 * なぜ: 確定の競合率や通知失敗を運用で継続監視できるようにするため
 */
package com.flighthelp.matching.service;

import com.flighthelp.matching.model.ServiceDomain;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MatchingMetrics {

  static final String METRIC_CONFIRM_TOTAL = "matching.confirm.total";
  static final String METRIC_CANCEL_TOTAL = "matching.cancel.total";
  static final String METRIC_FIND_DURATION = "matching.find.duration";
  static final String METRIC_FIND_CANDIDATES = "matching.find.candidates";
  static final String METRIC_NOTIFY_ERROR_TOTAL = "matching.notify.error.total";
  static final String METRIC_EXPIRED_TOTAL = "matching.expiry.deactivated.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<ServiceDomain, Timer> findTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<ServiceDomain, DistributionSummary> candidateSummaries =
      new ConcurrentHashMap<>();

  public MatchingMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordConfirmation(ServiceDomain domain, String result) {
    counter(METRIC_CONFIRM_TOTAL, "Match confirmation attempts", domain, result).increment();
  }

  public void recordCancellation(ServiceDomain domain, String result) {
    counter(METRIC_CANCEL_TOTAL, "Match cancellation attempts", domain, result).increment();
  }

  public void recordFind(ServiceDomain domain, int candidateCount, Duration elapsed) {
    findTimers
        .computeIfAbsent(
            domain,
            key ->
                Timer.builder(METRIC_FIND_DURATION)
                    .description("Latency of a ranked match query")
                    .tags(Tags.of("domain", key.value()))
                    .register(meterRegistry))
        .record(elapsed);
    candidateSummaries
        .computeIfAbsent(
            domain,
            key ->
                DistributionSummary.builder(METRIC_FIND_CANDIDATES)
                    .description("Offers read from the itinerary index per query")
                    .tags(Tags.of("domain", key.value()))
                    .register(meterRegistry))
        .record(Math.max(candidateCount, 0));
  }

  public void recordNotificationFailure(ServiceDomain domain) {
    counter(METRIC_NOTIFY_ERROR_TOTAL, "Match notifications that failed", domain, "error")
        .increment();
  }

  public void recordExpired(ServiceDomain domain, int count) {
    if (count <= 0) {
      return;
    }
    counter(METRIC_EXPIRED_TOTAL, "Requests deactivated by expiry", domain, "deactivated")
        .increment(count);
  }

  private Counter counter(String name, String description, ServiceDomain domain, String result) {
    final String key = name + ":" + domain.value() + ":" + result;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of("domain", domain.value(), "result", result))
                .register(meterRegistry));
  }
}
