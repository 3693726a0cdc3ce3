/*
 * Where: Dispatch outbox publisher
 * What: Claims outbox_events rows and publishes them to JetStream as JSON
 * Why: A row is PUBLISHED only after the PubAck, so delivery is at least once
 */
package com.example.dispatch.service;

import com.example.common.event.DispatchEventPayload;
import com.example.dispatch.config.DispatchNatsProperties;
import com.example.dispatch.config.DispatchOutboxProperties;
import com.example.dispatch.model.OutboxEventRecord;
import com.example.dispatch.model.OutboxStatus;
import com.example.dispatch.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(
    name = {"dispatch.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class DispatchOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(DispatchOutboxPublisher.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_AGGREGATE_KEY = "aggregate_key";
  private static final String HEADER_CORRELATION_ID = "correlation_id";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final OutboxEventRepository outboxEventRepository;
  private final DispatchOutboxProperties properties;
  private final DispatchNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final DispatchMetrics metrics;
  private final Clock clock;

  public void publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final String lockedBy = resolveLockedBy();
    final Instant leaseUntil = now.plus(properties.lease());
    final List<OutboxEventRecord> pending =
        outboxEventRepository.claimPending(properties.batchSize(), now, leaseUntil, lockedBy);
    for (OutboxEventRecord record : pending) {
      try {
        final DispatchEventPayload payload = parsePayload(record);
        final PublishAck ack =
            jetStream.publish(
                natsProperties.subjectFor(record.eventType()),
                buildHeaders(record, payload),
                record.payloadJson().getBytes(StandardCharsets.UTF_8));
        if (ack == null) {
          throw new IllegalStateException("puback is missing");
        }
        final int updated = outboxEventRepository.markPublished(record.eventId(), lockedBy, now);
        if (updated == 0) {
          logger.warn("outbox publish succeeded but lock was lost eventId={}", record.eventId());
        } else {
          recordPublishDelay(payload, now);
        }
      } catch (JetStreamApiException | IOException | RuntimeException ex) {
        handleFailure(record, ex, now, lockedBy);
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countByStatus(OutboxStatus.FAILED));
  }

  private DispatchEventPayload parsePayload(OutboxEventRecord record) {
    try {
      return objectMapper.readValue(record.payloadJson(), DispatchEventPayload.class);
    } catch (JsonProcessingException ex) {
      throw new OutboxPayloadParseException("outbox payload parse failure", ex);
    }
  }

  private void recordPublishDelay(DispatchEventPayload payload, Instant publishedAt) {
    if (payload.occurredAt() == null) {
      return;
    }
    try {
      metrics.recordOutboxPublishDelay(Instant.parse(payload.occurredAt()), publishedAt);
    } catch (DateTimeParseException ex) {
      logger.debug("outbox occurred_at unparsable eventId={}", payload.eventId(), ex);
    }
  }

  private Headers buildHeaders(OutboxEventRecord record, DispatchEventPayload payload) {
    final Headers headers = new Headers();
    // event_id doubles as the JetStream dedup key
    headers.add(HEADER_MESSAGE_ID, record.eventId().toString());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_AGGREGATE_KEY, record.aggregateKey());
    if (payload.correlationId() != null) {
      headers.add(HEADER_CORRELATION_ID, payload.correlationId());
    }
    if (payload.traceId() != null) {
      headers.add(HEADER_TRACE_ID, payload.traceId());
    }
    return headers;
  }

  private void handleFailure(OutboxEventRecord record, Exception ex, Instant now, String lockedBy) {
    final boolean nonRetryable = ex instanceof OutboxPayloadParseException;
    final int nextAttempt = nonRetryable ? properties.maxAttempts() : record.attemptCount() + 1;
    final boolean failed = nonRetryable || nextAttempt >= properties.maxAttempts();
    final Instant nextRetryAt = failed ? null : now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        outboxEventRepository.markFailure(
            record.eventId(),
            lockedBy,
            nextAttempt,
            failed ? OutboxStatus.FAILED : OutboxStatus.PENDING,
            nextRetryAt,
            truncateError(ex.getMessage()));
    if (updated == 0) {
      logger.warn(
          "outbox retry skipped because lock was lost eventId={} attempt={}",
          record.eventId(),
          nextAttempt);
    }
    if (failed && nonRetryable) {
      logger.error("outbox payload unreadable, moved to FAILED eventId={}", record.eventId(), ex);
    } else if (failed) {
      logger.warn("outbox publish moved to FAILED eventId={}", record.eventId(), ex);
    } else {
      logger.warn(
          "outbox publish retry scheduled eventId={} attempt={}", record.eventId(), nextAttempt, ex);
    }
  }

  private Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitter =
        properties.backoffJitterMin()
            + ThreadLocalRandom.current().nextDouble()
                * (properties.backoffJitterMax() - properties.backoffJitterMin());
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(properties.backoffMin().toMillis(), backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }

  private static final class OutboxPayloadParseException extends RuntimeException {
    private OutboxPayloadParseException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
