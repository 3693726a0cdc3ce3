/*
 * Where: Dispatch service layer
 * What: Owns the notification request aggregate from creation to a terminal status
 * Why: Every state change is saved with a version check and its event in one transaction
 */
package com.example.dispatch.service;

import com.example.dispatch.config.DispatchExecutorConfig;
import com.example.dispatch.config.DispatchIdempotencyProperties;
import com.example.dispatch.config.DispatchRequestProperties;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.CreateNotificationCommand;
import com.example.dispatch.model.CreateNotificationCommand.RecipientInput;
import com.example.dispatch.model.CreateResult;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.InvalidStateTransitionException;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.NotificationRequestTransitions;
import com.example.dispatch.model.NotificationTemplate;
import com.example.dispatch.model.PolicyContext;
import com.example.dispatch.model.PolicyDecision;
import com.example.dispatch.model.PolicyOutcome;
import com.example.dispatch.model.Recipient;
import com.example.dispatch.model.RecipientOutcome;
import com.example.dispatch.model.RenderedMessage;
import com.example.dispatch.model.RequestStatus;
import com.example.dispatch.model.RequestTransition;
import com.example.dispatch.model.Reservation;
import com.example.dispatch.model.SentNotificationLog;
import com.example.dispatch.model.UserNotificationPreferences;
import com.example.dispatch.repository.ConcurrencyConflictException;
import com.example.dispatch.repository.IdempotencyStore;
import com.example.dispatch.repository.NotificationRequestRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class RequestLifecycleManager {

  private static final Logger logger = LoggerFactory.getLogger(RequestLifecycleManager.class);
  private static final String MDC_CORRELATION_ID = "correlation_id";
  private static final String MDC_NOTIFICATION_ID = "notification_id";

  private final NotificationRequestRepository requestRepository;
  private final IdempotencyStore idempotencyStore;
  private final TemplateEngine templateEngine;
  private final PolicyEvaluator policyEvaluator;
  private final PreferenceService preferenceService;
  private final DeliveryLedger ledger;
  private final DispatchOrchestrator orchestrator;
  private final EventOutbox eventOutbox;
  private final TransactionTemplate transactionTemplate;
  private final Executor fanoutExecutor;
  private final DispatchIdempotencyProperties idempotencyProperties;
  private final DispatchRequestProperties requestProperties;
  private final DispatchMetrics metrics;
  private final Clock clock;

  public RequestLifecycleManager(
      NotificationRequestRepository requestRepository,
      IdempotencyStore idempotencyStore,
      TemplateEngine templateEngine,
      PolicyEvaluator policyEvaluator,
      PreferenceService preferenceService,
      DeliveryLedger ledger,
      DispatchOrchestrator orchestrator,
      EventOutbox eventOutbox,
      PlatformTransactionManager transactionManager,
      @Qualifier(DispatchExecutorConfig.FANOUT_EXECUTOR) Executor fanoutExecutor,
      DispatchIdempotencyProperties idempotencyProperties,
      DispatchRequestProperties requestProperties,
      DispatchMetrics metrics,
      Clock clock) {
    this.requestRepository = requestRepository;
    this.idempotencyStore = idempotencyStore;
    this.templateEngine = templateEngine;
    this.policyEvaluator = policyEvaluator;
    this.preferenceService = preferenceService;
    this.ledger = ledger;
    this.orchestrator = orchestrator;
    this.eventOutbox = eventOutbox;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.fanoutExecutor = fanoutExecutor;
    this.idempotencyProperties = idempotencyProperties;
    this.requestProperties = requestProperties;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Creates a PENDING request, or returns the request already created under the same dedup key.
   * Only the first creation raises NotificationRequestedEvent.
   */
  public CreateResult create(CreateNotificationCommand command) {
    validate(command);
    final UUID candidateId = UUID.randomUUID();
    final CreateResult result =
        transactionTemplate.execute(
            status -> {
              final Reservation reservation =
                  idempotencyStore.reserve(
                      command.dedupKey(), candidateId, idempotencyProperties.ttl());
              if (!reservation.acquired()) {
                final NotificationRequest existing =
                    requestRepository
                        .findById(reservation.existingRef())
                        .orElseThrow(
                            () ->
                                new IllegalStateException(
                                    "dedup key "
                                        + command.dedupKey()
                                        + " points at missing request "
                                        + reservation.existingRef()));
                return new CreateResult(existing, false);
              }
              final Instant now = Instant.now(clock);
              final NotificationRequest request =
                  NotificationRequestTransitions.newRequest(
                      candidateId, command, pinActiveTemplates(command), now);
              requestRepository.insert(request);
              eventOutbox.append(NotificationRequestTransitions.requested(request));
              return new CreateResult(request, true);
            });
    if (result.created()) {
      logger.info(
          "notification request created requestId={} type={} correlationId={} recipients={}",
          result.request().requestId(),
          result.request().type(),
          result.request().correlationId(),
          result.request().recipients().size());
    } else {
      logger.info(
          "notification request deduplicated requestId={} dedupKey={}",
          result.request().requestId(),
          command.dedupKey());
    }
    return result;
  }

  public NotificationRequest get(UUID requestId) {
    return requestRepository
        .findById(requestId)
        .orElseThrow(
            () -> new NotificationNotFoundException("notification " + requestId + " not found"));
  }

  /**
   * Evaluates policy, renders messages and fans out dispatch for a PENDING request. Requests in
   * any other status are returned unchanged.
   */
  public NotificationRequest process(UUID requestId) {
    final NotificationRequest request = get(requestId);
    if (request.status() != RequestStatus.PENDING) {
      logger.debug("process skipped requestId={} status={}", requestId, request.status());
      return request;
    }
    MDC.put(MDC_CORRELATION_ID, request.correlationId());
    MDC.put(MDC_NOTIFICATION_ID, requestId.toString());
    try {
      return evaluateAndDispatch(request);
    } finally {
      MDC.remove(MDC_CORRELATION_ID);
      MDC.remove(MDC_NOTIFICATION_ID);
    }
  }

  /**
   * Recomputes recipient outcomes from the delivery logs and moves the request to COMPLETED or
   * FAILED once every recipient is settled. Retries on version conflicts.
   */
  public NotificationRequest reconcile(UUID requestId) {
    ConcurrencyConflictException lastConflict = null;
    for (int attempt = 1; attempt <= requestProperties.reconcileMaxRetries(); attempt++) {
      try {
        return reconcileOnce(requestId);
      } catch (ConcurrencyConflictException ex) {
        lastConflict = ex;
        logger.debug("reconcile conflict requestId={} attempt={}", requestId, attempt);
      }
    }
    throw Objects.requireNonNull(lastConflict);
  }

  /**
   * PENDING requests are canceled outright. PROCESSING requests stop their not-yet-attempted
   * retries and are reconciled. Attempts already in flight finish, and a transient failure among
   * them settles as canceled instead of retrying.
   */
  public NotificationRequest cancel(UUID requestId) {
    final NotificationRequest request = get(requestId);
    if (request.status() == RequestStatus.PENDING) {
      final Instant now = Instant.now(clock);
      final NotificationRequest canceled =
          transactionTemplate.execute(
              status -> commit(request, NotificationRequestTransitions.cancel(request, now)));
      metrics.recordRequestOutcome(RequestStatus.CANCELED.name());
      logger.info("notification request canceled requestId={}", requestId);
      return canceled;
    }
    if (request.status() == RequestStatus.PROCESSING) {
      // attempts in flight read the marker before queueing another retry
      requestRepository.markCancelRequested(requestId, Instant.now(clock));
      orchestrator.cancelRetries(requestId, request.correlationId());
      return reconcile(requestId);
    }
    throw new InvalidStateTransitionException(
        "cannot cancel request " + requestId + " in status " + request.status());
  }

  /** Scheduled and deferred requests whose evaluation time has come. */
  public int processDue() {
    final List<UUID> due =
        requestRepository.findDueForEvaluation(Instant.now(clock), requestProperties.batchSize());
    int processed = 0;
    for (UUID requestId : due) {
      try {
        process(requestId);
        processed++;
      } catch (ConcurrencyConflictException ex) {
        logger.info("process lost race requestId={}", requestId);
      } catch (RuntimeException ex) {
        logger.warn("process failed requestId={}", requestId, ex);
      }
    }
    return processed;
  }

  /** Safety net for PROCESSING requests whose reconcile signal was lost. */
  public int reconcileStale() {
    final Instant threshold = Instant.now(clock).minus(requestProperties.fanoutTimeout());
    final List<UUID> stale =
        requestRepository.findProcessingUpdatedBefore(threshold, requestProperties.batchSize());
    for (UUID requestId : stale) {
      try {
        reconcile(requestId);
      } catch (RuntimeException ex) {
        logger.warn("stale reconcile failed requestId={}", requestId, ex);
      }
    }
    return stale.size();
  }

  @EventListener
  public void onDeliverySettled(DeliverySettledEvent event) {
    try {
      reconcile(event.requestId());
    } catch (RuntimeException ex) {
      // the stale sweep picks the request up again
      logger.warn("reconcile after delivery failed requestId={}", event.requestId(), ex);
    }
  }

  private NotificationRequest evaluateAndDispatch(NotificationRequest request) {
    final Instant now = Instant.now(clock);
    final Instant evaluationTime = PolicyEvaluator.evaluationTime(request, now);

    final Map<String, PolicyDecision> decisions = new LinkedHashMap<>();
    for (Recipient recipient : request.recipients()) {
      decisions.put(recipient.id(), decide(request, recipient, evaluationTime));
    }
    final boolean anyAllowed =
        decisions.values().stream().anyMatch(d -> d.outcome() == PolicyOutcome.ALLOW);
    final Optional<Instant> earliestDefer =
        decisions.values().stream()
            .filter(d -> d.outcome() == PolicyOutcome.DEFER)
            .map(PolicyDecision::deferUntil)
            .min(Instant::compareTo);

    if (!anyAllowed && earliestDefer.isEmpty()) {
      final List<Recipient> blocked =
          request.recipients().stream()
              .map(r -> r.withPlan(List.of(), RecipientOutcome.BLOCKED))
              .toList();
      final String reason = blockReason(decisions);
      final NotificationRequest saved =
          transactionTemplate.execute(
              status ->
                  commit(request, NotificationRequestTransitions.block(request, blocked, reason, now)));
      metrics.recordRequestOutcome(RequestStatus.BLOCKED.name());
      logger.info("notification request blocked requestId={} reason={}", request.requestId(), reason);
      return saved;
    }
    if (!anyAllowed || evaluationTime.isAfter(now)) {
      final Instant until = anyAllowed ? evaluationTime : earliestDefer.get();
      final NotificationRequest saved =
          transactionTemplate.execute(
              status -> commit(request, NotificationRequestTransitions.defer(request, until, now)));
      logger.info("notification request deferred requestId={} until={}", request.requestId(), until);
      return saved;
    }

    final List<Recipient> planned = new ArrayList<>();
    final List<DispatchTask> tasks = new ArrayList<>();
    String renderFailure = null;
    for (Recipient recipient : request.recipients()) {
      final PolicyDecision decision = decisions.get(recipient.id());
      if (decision.outcome() == PolicyOutcome.BLOCK) {
        planned.add(recipient.withPlan(List.of(), RecipientOutcome.BLOCKED));
        continue;
      }
      planned.add(recipient.withPlan(decision.channels(), RecipientOutcome.PENDING));
      final Instant firstAttemptAt =
          decision.outcome() == PolicyOutcome.DEFER ? decision.deferUntil() : now;
      for (Channel channel : decision.channels()) {
        if (renderFailure != null) {
          break;
        }
        try {
          final RenderedMessage message = render(request, recipient, channel);
          tasks.add(new DispatchTask(recipient, channel, message, firstAttemptAt));
        } catch (TemplateNotFoundException | MissingPlaceholderException ex) {
          renderFailure = ex.getMessage();
          logger.warn(
              "render failed requestId={} recipientId={} channel={}",
              request.requestId(),
              recipient.id(),
              channel,
              ex);
        }
      }
    }

    final String failureReason = renderFailure;
    final List<SentNotificationLog> opened = new ArrayList<>();
    final NotificationRequest processing =
        transactionTemplate.execute(
            status -> {
              final NotificationRequest started =
                  commit(
                      request,
                      NotificationRequestTransitions.startProcessing(request, planned, now));
              if (failureReason != null) {
                final List<Recipient> failed =
                    started.recipients().stream()
                        .map(
                            r ->
                                r.outcome() == RecipientOutcome.BLOCKED
                                    ? r
                                    : r.withOutcome(RecipientOutcome.FAILED))
                        .toList();
                return commit(
                    started,
                    NotificationRequestTransitions.markAsFailed(started, failed, failureReason, now));
              }
              for (DispatchTask task : tasks) {
                opened.add(
                    ledger.open(
                        started.requestId(),
                        started.type(),
                        task.recipient().id(),
                        task.channel(),
                        task.recipient().addressFor(task.channel()),
                        task.message(),
                        task.firstAttemptAt(),
                        started.correlationId()));
              }
              return started;
            });
    if (processing.status() == RequestStatus.FAILED) {
      metrics.recordRequestOutcome(RequestStatus.FAILED.name());
      logger.warn(
          "notification request failed during render requestId={} reason={}",
          request.requestId(),
          failureReason);
      return processing;
    }
    logger.info(
        "notification request processing requestId={} deliveries={}",
        processing.requestId(),
        opened.size());
    fanOut(processing, opened, now);
    return get(processing.requestId());
  }

  private PolicyDecision decide(
      NotificationRequest request, Recipient recipient, Instant evaluationTime) {
    final UserNotificationPreferences preferences = preferenceService.get(recipient.id());
    final Optional<FrequencyLimit> limit = preferences.frequencyLimit(request.type());
    final long recent =
        limit
            .map(
                l ->
                    ledger.countSuccessfulSends(
                        recipient.id(),
                        request.type(),
                        evaluationTime.minus(l.window()),
                        evaluationTime))
            .orElse(0L);
    return policyEvaluator.evaluate(
        request, recipient, new PolicyContext(preferences, recent, evaluationTime));
  }

  private RenderedMessage render(NotificationRequest request, Recipient recipient, Channel channel) {
    final UUID pinned = request.pinnedTemplateIds().get(channel);
    final NotificationTemplate template =
        pinned != null
            ? templateEngine.findVersion(pinned)
            : templateEngine.resolve(request.type(), channel);
    final Map<String, Object> data = new LinkedHashMap<>(request.payload());
    data.putIfAbsent("recipient_id", recipient.id());
    data.putIfAbsent("correlation_id", request.correlationId());
    return templateEngine.render(template, data);
  }

  /** Runs due first attempts concurrently; one failed branch never stops its siblings. */
  private void fanOut(NotificationRequest request, List<SentNotificationLog> logs, Instant now) {
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final List<CompletableFuture<Void>> futures = new ArrayList<>();
    for (SentNotificationLog log : logs) {
      if (log.nextRetryAt() != null && log.nextRetryAt().isAfter(now)) {
        continue;
      }
      futures.add(
          CompletableFuture.runAsync(
              () -> {
                final Map<String, String> previous = MDC.getCopyOfContextMap();
                if (mdc != null) {
                  MDC.setContextMap(mdc);
                }
                try {
                  orchestrator.attempt(log, request.correlationId());
                } catch (RuntimeException ex) {
                  logger.warn(
                      "dispatch branch failed logId={} channel={}", log.logId(), log.channel(), ex);
                } finally {
                  // CallerRunsPolicy may run this on the calling thread
                  if (previous == null) {
                    MDC.clear();
                  } else {
                    MDC.setContextMap(previous);
                  }
                }
              },
              fanoutExecutor));
    }
    try {
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
          .get(requestProperties.fanoutTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      logger.warn(
          "dispatch fan-out still running after {} requestId={}",
          requestProperties.fanoutTimeout(),
          request.requestId());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("dispatch fan-out interrupted requestId={}", request.requestId());
    } catch (ExecutionException ex) {
      logger.warn("dispatch fan-out failed requestId={}", request.requestId(), ex);
    }
  }

  private NotificationRequest reconcileOnce(UUID requestId) {
    final NotificationRequest request = get(requestId);
    if (request.status() != RequestStatus.PROCESSING) {
      return request;
    }
    final List<SentNotificationLog> logs = ledger.findByRequestId(requestId);
    final List<Recipient> settled =
        request.recipients().stream().map(r -> r.withOutcome(outcomeOf(r, logs))).toList();
    final boolean allTerminal = settled.stream().allMatch(r -> r.outcome().isTerminal());
    final Instant now = Instant.now(clock);
    if (!allTerminal) {
      if (settled.equals(request.recipients())) {
        return request;
      }
      return transactionTemplate.execute(
          status ->
              commit(request, NotificationRequestTransitions.updateOutcomes(request, settled, now)));
    }
    final boolean anySucceeded =
        settled.stream().anyMatch(r -> r.outcome() == RecipientOutcome.SUCCEEDED);
    final RequestTransition transition =
        anySucceeded
            ? NotificationRequestTransitions.markAsCompleted(request, settled, now)
            : NotificationRequestTransitions.markAsFailed(
                request, settled, failureSummary(settled, logs), now);
    final NotificationRequest saved =
        transactionTemplate.execute(status -> commit(request, transition));
    metrics.recordRequestOutcome(saved.status().name());
    logger.info(
        "notification request settled requestId={} status={}", saved.requestId(), saved.status());
    return saved;
  }

  @VisibleForTesting
  static RecipientOutcome outcomeOf(Recipient recipient, List<SentNotificationLog> logs) {
    if (recipient.outcome() == RecipientOutcome.BLOCKED) {
      return RecipientOutcome.BLOCKED;
    }
    final List<SentNotificationLog> own =
        logs.stream()
            .filter(
                l ->
                    l.recipientId().equals(recipient.id())
                        && recipient.plannedChannels().contains(l.channel()))
            .toList();
    // a channel is settled once its log left the queue; SENT counts as settled success
    final Set<Channel> settledChannels = new HashSet<>();
    for (SentNotificationLog log : own) {
      if (log.status() != DeliveryStatus.QUEUED_FOR_DISPATCH) {
        settledChannels.add(log.channel());
      }
    }
    if (recipient.plannedChannels().isEmpty()
        || !settledChannels.containsAll(recipient.plannedChannels())) {
      return RecipientOutcome.PENDING;
    }
    return own.stream().anyMatch(l -> l.status().isSuccess())
        ? RecipientOutcome.SUCCEEDED
        : RecipientOutcome.FAILED;
  }

  private String failureSummary(List<Recipient> settled, List<SentNotificationLog> logs) {
    if (settled.stream().allMatch(r -> r.outcome() == RecipientOutcome.BLOCKED)) {
      return "all recipients blocked";
    }
    return logs.stream()
        .map(SentNotificationLog::lastFailureReason)
        .filter(Objects::nonNull)
        .findFirst()
        .map(reason -> "all deliveries failed: " + reason)
        .orElse("all deliveries failed");
  }

  private NotificationRequest commit(NotificationRequest previous, RequestTransition transition) {
    final NotificationRequest saved =
        requestRepository.save(transition.request(), previous.version());
    eventOutbox.appendAll(transition.events());
    return saved;
  }

  private static String blockReason(Map<String, PolicyDecision> decisions) {
    return decisions.values().stream()
        .map(PolicyDecision::reason)
        .filter(Objects::nonNull)
        .distinct()
        .reduce((a, b) -> a + "; " + b)
        .orElse("blocked by policy");
  }

  private void validate(CreateNotificationCommand command) {
    requireText(command.type(), "type");
    requireText(command.correlationId(), "correlation_id");
    requireText(command.dedupKey(), "dedup_key");
    if (command.payload().isEmpty()) {
      throw new ValidationException("payload must not be empty");
    }
    if (command.recipients().isEmpty()) {
      throw new ValidationException("recipients must not be empty");
    }
    if (command.channelPreferences().isEmpty()) {
      throw new ValidationException("channel_preferences must not be empty");
    }
    if (new HashSet<>(command.channelPreferences()).size() != command.channelPreferences().size()) {
      throw new ValidationException("channel_preferences must not repeat a channel");
    }
    final Set<String> recipientIds = new HashSet<>();
    for (RecipientInput recipient : command.recipients()) {
      requireText(recipient.id(), "recipient id");
      if (!recipientIds.add(recipient.id())) {
        throw new ValidationException("recipient " + recipient.id() + " is listed twice");
      }
      if (recipient.addresses().isEmpty()) {
        throw new ValidationException("recipient " + recipient.id() + " has no addresses");
      }
      for (Map.Entry<Channel, String> address : recipient.addresses().entrySet()) {
        if (address.getValue() == null || address.getValue().isBlank()) {
          throw new ValidationException(
              "recipient " + recipient.id() + " has a blank " + address.getKey() + " address");
        }
      }
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " must not be blank");
    }
  }

  private Map<Channel, UUID> pinActiveTemplates(CreateNotificationCommand command) {
    final Map<Channel, UUID> pinned = new LinkedHashMap<>();
    for (Channel channel : command.channelPreferences()) {
      templateEngine
          .findActive(command.type(), channel)
          .ifPresent(t -> pinned.put(channel, t.templateId()));
    }
    return pinned;
  }

  private record DispatchTask(
      Recipient recipient, Channel channel, RenderedMessage message, Instant firstAttemptAt) {}
}
