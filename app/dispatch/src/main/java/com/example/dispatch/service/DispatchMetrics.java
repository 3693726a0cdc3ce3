/*
 * Where: Dispatch service layer
 * What: Application metrics for dispatch attempts, request outcomes and the outbox
 * Why: Delivery success rate and publish lag are observed from Prometheus directly
 */
package com.example.dispatch.service;

import com.example.dispatch.model.Channel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class DispatchMetrics {

  private static final String METRIC_DISPATCH_ATTEMPTS = "dispatch.attempts.total";
  private static final String METRIC_GATEWAY_LATENCY = "dispatch.gateway.latency";
  private static final String METRIC_REQUEST_OUTCOMES = "dispatch.requests.total";
  private static final String METRIC_OUTBOX_PUBLISH_DELAY = "dispatch.outbox.publish.delay";
  private static final String METRIC_OUTBOX_FAILED_CURRENT = "dispatch.outbox.failed.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger outboxFailedCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<Channel, Timer> gatewayTimers = new ConcurrentHashMap<>();
  private final Timer outboxPublishDelayTimer;

  public DispatchMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_OUTBOX_FAILED_CURRENT, outboxFailedCurrent, AtomicInteger::get)
        .description("Current number of outbox events in FAILED status")
        .register(meterRegistry);
    this.outboxPublishDelayTimer =
        Timer.builder(METRIC_OUTBOX_PUBLISH_DELAY)
            .description("Delay from event occurrence to JetStream acknowledgement")
            .register(meterRegistry);
  }

  /** result is one of sent, transient_failure, permanent_failure. */
  public void recordAttempt(Channel channel, String result) {
    counters
        .computeIfAbsent(
            METRIC_DISPATCH_ATTEMPTS + ":" + channel + ":" + result,
            ignored ->
                Counter.builder(METRIC_DISPATCH_ATTEMPTS)
                    .description("Gateway dispatch attempts by outcome")
                    .tags(Tags.of("channel", channel.name(), "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordGatewayLatency(Channel channel, Duration latency) {
    gatewayTimers
        .computeIfAbsent(
            channel,
            ignored ->
                Timer.builder(METRIC_GATEWAY_LATENCY)
                    .description("Gateway send latency")
                    .tags(Tags.of("channel", channel.name()))
                    .register(meterRegistry))
        .record(latency);
  }

  public void recordRequestOutcome(String status) {
    counters
        .computeIfAbsent(
            METRIC_REQUEST_OUTCOMES + ":" + status,
            ignored ->
                Counter.builder(METRIC_REQUEST_OUTCOMES)
                    .description("Notification requests reaching a terminal status")
                    .tags(Tags.of("status", status))
                    .register(meterRegistry))
        .increment();
  }

  public void recordOutboxPublishDelay(Instant occurredAt, Instant publishedAt) {
    if (occurredAt == null || publishedAt == null || publishedAt.isBefore(occurredAt)) {
      return;
    }
    outboxPublishDelayTimer.record(Duration.between(occurredAt, publishedAt));
  }

  public void updateOutboxFailedCurrent(int failedCount) {
    outboxFailedCurrent.set(Math.max(failedCount, 0));
  }
}
