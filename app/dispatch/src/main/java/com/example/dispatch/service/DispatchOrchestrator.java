/*
 * Where: Dispatch service layer
 * What: Sends one message per (request, channel, address) under a lease, with bounded retries
 * Why: Retries must never duplicate a log, and only one worker may call the gateway at a time
 */
package com.example.dispatch.service;

import com.example.dispatch.config.DispatchDeliveryProperties;
import com.example.dispatch.config.DispatchExecutorConfig;
import com.example.dispatch.gateway.ChannelGateway;
import com.example.dispatch.gateway.ChannelGatewayRegistry;
import com.example.dispatch.gateway.GatewayReceipt;
import com.example.dispatch.gateway.PermanentGatewayException;
import com.example.dispatch.gateway.TransientGatewayException;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DeliveryLogTransition;
import com.example.dispatch.model.DeliveryLogTransitions;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.Recipient;
import com.example.dispatch.model.RenderedMessage;
import com.example.dispatch.model.SentNotificationLog;
import com.example.dispatch.repository.ConcurrencyConflictException;
import com.example.dispatch.repository.DispatchLeaseRepository;
import com.example.dispatch.repository.NotificationRequestRepository;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Service
public class DispatchOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(DispatchOrchestrator.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final DeliveryLedger ledger;
  private final DispatchLeaseRepository leaseRepository;
  private final NotificationRequestRepository requestRepository;
  private final ChannelGatewayRegistry gatewayRegistry;
  private final DispatchDeliveryProperties properties;
  private final DispatchMetrics metrics;
  private final ApplicationEventPublisher eventPublisher;
  private final Executor gatewayExecutor;
  private final Clock clock;

  public DispatchOrchestrator(
      DeliveryLedger ledger,
      DispatchLeaseRepository leaseRepository,
      NotificationRequestRepository requestRepository,
      ChannelGatewayRegistry gatewayRegistry,
      DispatchDeliveryProperties properties,
      DispatchMetrics metrics,
      ApplicationEventPublisher eventPublisher,
      @Qualifier(DispatchExecutorConfig.GATEWAY_EXECUTOR) Executor gatewayExecutor,
      Clock clock) {
    this.ledger = ledger;
    this.leaseRepository = leaseRepository;
    this.requestRepository = requestRepository;
    this.gatewayRegistry = gatewayRegistry;
    this.properties = properties;
    this.metrics = metrics;
    this.eventPublisher = eventPublisher;
    this.gatewayExecutor = gatewayExecutor;
    this.clock = clock;
  }

  /**
   * Opens (or reuses) the log for this target and makes the first attempt when it is due.
   * Returns the log as this caller last saw it.
   */
  public SentNotificationLog dispatch(
      NotificationRequest request, Recipient recipient, Channel channel, RenderedMessage message) {
    final String address = recipient.addressFor(channel);
    if (address == null) {
      throw new IllegalArgumentException(
          "recipient " + recipient.id() + " has no address for " + channel);
    }
    final SentNotificationLog log =
        ledger.open(
            request.requestId(),
            request.type(),
            recipient.id(),
            channel,
            address,
            message,
            Instant.now(clock),
            request.correlationId());
    return attempt(log, request.correlationId());
  }

  /** Makes the next gateway call for a queued log if it is due and the lease can be taken. */
  public SentNotificationLog attempt(SentNotificationLog log, String correlationId) {
    if (!isDue(log, Instant.now(clock))) {
      return log;
    }
    final String leaseKey = log.dispatchKey();
    final String holder = resolveLockedBy() + ":" + UUID.randomUUID();
    final Instant leaseNow = Instant.now(clock);
    if (!leaseRepository.tryAcquire(leaseKey, holder, leaseNow, leaseNow.plus(properties.lease()))) {
      logger.debug("dispatch lease held elsewhere key={}", leaseKey);
      return ledger.find(log.logId()).orElse(log);
    }
    try {
      // re-read under the lease; a previous holder may have moved the log
      final SentNotificationLog current = ledger.find(log.logId()).orElse(log);
      if (!isDue(current, Instant.now(clock))) {
        return current;
      }
      if (requestRepository.isCancelRequested(current.requestId())) {
        return cancelQueued(current, correlationId);
      }
      return callAndRecord(current, correlationId);
    } finally {
      leaseRepository.release(leaseKey, holder);
    }
  }

  /** Retries every queued log whose retry (or deferred first attempt) time has passed. */
  public int retryDue() {
    final Instant now = Instant.now(clock);
    final List<SentNotificationLog> due = ledger.findDueForRetry(now, properties.batchSize());
    int attempted = 0;
    for (SentNotificationLog log : due) {
      try {
        attempt(log, correlationIdOf(log));
        attempted++;
      } catch (RuntimeException ex) {
        logger.warn("dispatch retry failed logId={} key={}", log.logId(), log.dispatchKey(), ex);
      }
    }
    return attempted;
  }

  /** Delivery receipt from the provider. Repeated receipts are ignored. */
  public SentNotificationLog confirmDelivery(UUID logId) {
    final SentNotificationLog log = loadLog(logId);
    if (log.status() == DeliveryStatus.DELIVERED || log.status() == DeliveryStatus.READ) {
      return log;
    }
    return applyReceipt(
        log, DeliveryLogTransitions.confirmDelivery(log, correlationIdOf(log), Instant.now(clock)));
  }

  /** Read receipt from the provider. Repeated receipts are ignored. */
  public SentNotificationLog markRead(UUID logId) {
    final SentNotificationLog log = loadLog(logId);
    if (log.status() == DeliveryStatus.READ) {
      return log;
    }
    return applyReceipt(
        log, DeliveryLogTransitions.markRead(log, correlationIdOf(log), Instant.now(clock)));
  }

  /**
   * Fails queued logs of the request that nobody is sending right now. Logs whose lease is held
   * are left to finish their in-flight attempt; the request's cancel marker stops them from
   * queueing again. Returns the number of canceled logs.
   */
  public int cancelRetries(UUID requestId, String correlationId) {
    int canceled = 0;
    for (SentNotificationLog log : ledger.findByRequestId(requestId)) {
      if (log.status() != DeliveryStatus.QUEUED_FOR_DISPATCH) {
        continue;
      }
      final String holder = resolveLockedBy() + ":cancel:" + UUID.randomUUID();
      final Instant now = Instant.now(clock);
      if (!leaseRepository.tryAcquire(log.dispatchKey(), holder, now, now.plus(properties.lease()))) {
        logger.info("dispatch cancel skipped, attempt in flight key={}", log.dispatchKey());
        continue;
      }
      try {
        final SentNotificationLog current = ledger.find(log.logId()).orElse(log);
        if (current.status() != DeliveryStatus.QUEUED_FOR_DISPATCH) {
          continue;
        }
        if (ledger.apply(current, DeliveryLogTransitions.cancel(current, correlationId, now))) {
          canceled++;
        }
      } finally {
        leaseRepository.release(log.dispatchKey(), holder);
      }
    }
    logger.info("dispatch retries canceled requestId={} count={}", requestId, canceled);
    return canceled;
  }

  private SentNotificationLog callAndRecord(SentNotificationLog log, String correlationId) {
    final Channel channel = log.channel();
    final Instant started = Instant.now(clock);
    DeliveryLogTransition transition;
    try {
      final ChannelGateway gateway = gatewayRegistry.gatewayFor(channel);
      final GatewayReceipt receipt = send(gateway, log);
      metrics.recordGatewayLatency(channel, Duration.between(started, Instant.now(clock)));
      metrics.recordAttempt(channel, "sent");
      transition =
          DeliveryLogTransitions.recordSuccess(
              log,
              receipt.providerMessageId(),
              gateway.supportsDeliveryReceipts(),
              correlationId,
              Instant.now(clock));
      logger.info(
          "dispatch sent logId={} channel={} attempt={} providerMessageId={}",
          log.logId(),
          channel,
          log.attemptCount() + 1,
          receipt.providerMessageId());
    } catch (PermanentGatewayException ex) {
      metrics.recordAttempt(channel, "permanent_failure");
      transition =
          DeliveryLogTransitions.recordPermanentFailure(
              log, truncateError(ex.getMessage()), correlationId, Instant.now(clock));
      logger.warn("dispatch failed permanently logId={} channel={}", log.logId(), channel, ex);
    } catch (TransientGatewayException ex) {
      metrics.recordAttempt(channel, "transient_failure");
      final Instant now = Instant.now(clock);
      final int nextAttempt = log.attemptCount() + 1;
      if (requestRepository.isCancelRequested(log.requestId())) {
        // cancel arrived while this attempt held the lease
        transition =
            DeliveryLogTransitions.recordCanceledAfterAttempt(
                log, truncateError(ex.getMessage()), correlationId, now);
        logger.info(
            "dispatch retry dropped, request canceled logId={} channel={} attempt={}",
            log.logId(),
            channel,
            nextAttempt);
      } else {
        transition =
            DeliveryLogTransitions.recordTransientFailure(
                log,
                truncateError(ex.getMessage()),
                now.plus(computeBackoffDuration(nextAttempt)),
                properties.maxAttempts(),
                correlationId,
                now);
        logTransientOutcome(log, transition, nextAttempt, ex);
      }
    }
    if (!ledger.apply(log, transition)) {
      return ledger.find(log.logId()).orElse(log);
    }
    if (transition.log().status() != DeliveryStatus.QUEUED_FOR_DISPATCH) {
      eventPublisher.publishEvent(new DeliverySettledEvent(log.requestId()));
    }
    return transition.log();
  }

  private void logTransientOutcome(
      SentNotificationLog log, DeliveryLogTransition transition, int nextAttempt, Exception ex) {
    final Channel channel = log.channel();
    if (transition.log().status() == DeliveryStatus.FAILED) {
      logger.warn(
          "dispatch retries exhausted logId={} channel={} attempts={}",
          log.logId(),
          channel,
          nextAttempt,
          ex);
    } else {
      logger.warn(
          "dispatch retry scheduled logId={} channel={} attempt={} nextRetryAt={}",
          log.logId(),
          channel,
          nextAttempt,
          transition.log().nextRetryAt(),
          ex);
    }
  }

  private SentNotificationLog cancelQueued(SentNotificationLog log, String correlationId) {
    final DeliveryLogTransition transition =
        DeliveryLogTransitions.cancel(log, correlationId, Instant.now(clock));
    if (!ledger.apply(log, transition)) {
      return ledger.find(log.logId()).orElse(log);
    }
    logger.info("dispatch canceled before attempt logId={} key={}", log.logId(), log.dispatchKey());
    eventPublisher.publishEvent(new DeliverySettledEvent(log.requestId()));
    return transition.log();
  }

  /** Bounded gateway call; timeouts, a saturated pool and unexpected errors count as transient. */
  private GatewayReceipt send(ChannelGateway gateway, SentNotificationLog log) {
    final RenderedMessage message = log.message();
    final CompletableFuture<GatewayReceipt> future;
    try {
      future =
          CompletableFuture.supplyAsync(() -> gateway.send(message, log.address()), gatewayExecutor);
    } catch (RejectedExecutionException ex) {
      throw new TransientGatewayException("gateway pool saturated", ex);
    }
    try {
      return future.get(properties.gatewayTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new TransientGatewayException(
          "gateway timed out after " + properties.gatewayTimeout(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TransientGatewayException("gateway call interrupted", ex);
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof PermanentGatewayException permanent) {
        throw permanent;
      }
      if (cause instanceof TransientGatewayException transientFailure) {
        throw transientFailure;
      }
      throw new TransientGatewayException("gateway call failed: " + cause, cause);
    }
  }

  private SentNotificationLog applyReceipt(
      SentNotificationLog log, DeliveryLogTransition transition) {
    if (!ledger.apply(log, transition)) {
      throw new ConcurrencyConflictException("delivery " + log.logId() + " changed concurrently");
    }
    eventPublisher.publishEvent(new DeliverySettledEvent(log.requestId()));
    return transition.log();
  }

  private SentNotificationLog loadLog(UUID logId) {
    return ledger
        .find(logId)
        .orElseThrow(() -> new NotificationNotFoundException("delivery " + logId + " not found"));
  }

  private String correlationIdOf(SentNotificationLog log) {
    return requestRepository
        .findById(log.requestId())
        .map(NotificationRequest::correlationId)
        .orElse(null);
  }

  private static boolean isDue(SentNotificationLog log, Instant now) {
    return log.status() == DeliveryStatus.QUEUED_FOR_DISPATCH
        && (log.nextRetryAt() == null || !log.nextRetryAt().isAfter(now));
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  String resolveLockedBy() {
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
}
