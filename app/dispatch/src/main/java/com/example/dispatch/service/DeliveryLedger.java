/*
 * Where: Dispatch service layer
 * What: Persists sent notification logs, their attempts and the events they raise
 * Why: Status and attempt history only move forward; racing writers lose the CAS
 */
package com.example.dispatch.service;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DeliveryAttempt;
import com.example.dispatch.model.DeliveryLogTransition;
import com.example.dispatch.model.DeliveryLogTransitions;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.RenderedMessage;
import com.example.dispatch.model.SentNotificationLog;
import com.example.dispatch.repository.SentNotificationLogRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DeliveryLedger {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryLedger.class);
  static final int QUERY_LIMIT = 500;

  private final SentNotificationLogRepository logRepository;
  private final EventOutbox eventOutbox;
  private final Clock clock;

  /**
   * Returns the log for (request, channel, address), creating it in QUEUED_FOR_DISPATCH on first
   * call. {@code firstAttemptAt} is when the first gateway call becomes due.
   */
  @Transactional
  public SentNotificationLog open(
      UUID requestId,
      String notificationType,
      String recipientId,
      Channel channel,
      String address,
      RenderedMessage message,
      Instant firstAttemptAt,
      String correlationId) {
    final Instant now = Instant.now(clock);
    final SentNotificationLog candidate =
        new SentNotificationLog(
            UUID.randomUUID(),
            requestId,
            notificationType,
            recipientId,
            channel,
            address,
            message.subject(),
            message.body(),
            DeliveryStatus.QUEUED_FOR_DISPATCH,
            0,
            firstAttemptAt,
            null,
            null,
            now,
            now);
    if (logRepository.insertIfAbsent(candidate) == 1) {
      eventOutbox.append(DeliveryLogTransitions.readyToDispatch(candidate, correlationId));
      return candidate;
    }
    return logRepository
        .findByDispatchKey(requestId, channel, address)
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "delivery log missing after conflict key="
                        + SentNotificationLog.dispatchKey(requestId, channel, address)));
  }

  /**
   * Writes a transition computed from {@code previous}. Returns false when another writer already
   * moved the log, in which case nothing is written.
   */
  @Transactional
  public boolean apply(SentNotificationLog previous, DeliveryLogTransition transition) {
    final int updated =
        logRepository.update(transition.log(), previous.status(), previous.attemptCount());
    if (updated == 0) {
      logger.warn(
          "delivery log changed concurrently logId={} expectedStatus={} expectedAttempts={}",
          previous.logId(),
          previous.status(),
          previous.attemptCount());
      return false;
    }
    final DeliveryAttempt attempt = transition.attempt();
    if (attempt != null) {
      logRepository.insertAttempt(attempt);
    }
    eventOutbox.appendAll(transition.events());
    return true;
  }

  public Optional<SentNotificationLog> find(UUID logId) {
    return logRepository.findById(logId);
  }

  public List<SentNotificationLog> findByRequestId(UUID requestId) {
    return logRepository.findByRequestId(requestId);
  }

  public List<DeliveryAttempt> attemptsByRequestId(UUID requestId) {
    return logRepository.findAttemptsByRequestId(requestId);
  }

  public List<DeliveryAttempt> attempts(UUID logId) {
    return logRepository.findAttempts(logId);
  }

  public List<SentNotificationLog> findByAddress(String address) {
    return logRepository.findByAddress(address, QUERY_LIMIT);
  }

  /** FAILED logs whose last change is at least {@code age} old. */
  public List<SentNotificationLog> findFailedOlderThan(Duration age) {
    return logRepository.findFailedUpdatedBefore(Instant.now(clock).minus(age), QUERY_LIMIT);
  }

  public List<SentNotificationLog> findDueForRetry(Instant now, int limit) {
    return logRepository.findDueForRetry(now, limit);
  }

  public long countSuccessfulSends(String recipientId, String type, Instant from, Instant to) {
    return logRepository.countSuccessfulSends(recipientId, type, from, to);
  }
}
