package com.example.dispatch;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.CreateNotificationCommand;
import com.example.dispatch.model.CreateNotificationCommand.RecipientInput;
import com.example.dispatch.model.DeliveryStatus;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.NotificationRequestTransitions;
import com.example.dispatch.model.SentNotificationLog;
import com.example.dispatch.model.Urgency;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Builders shared by unit tests. */
public final class DispatchTestData {

  public static final String TYPE = "order_shipped";

  private DispatchTestData() {}

  public static CreateNotificationCommand command(
      List<RecipientInput> recipients, List<Channel> channels, Urgency urgency) {
    return new CreateNotificationCommand(
        TYPE,
        Map.of("order_id", "o-1"),
        recipients,
        channels,
        urgency,
        null,
        "corr-1",
        "dedup-" + UUID.randomUUID());
  }

  public static RecipientInput recipient(String id, Map<Channel, String> addresses) {
    return new RecipientInput(id, addresses);
  }

  public static NotificationRequest pendingRequest(
      CreateNotificationCommand command, Instant now) {
    return NotificationRequestTransitions.newRequest(UUID.randomUUID(), command, Map.of(), now);
  }

  public static SentNotificationLog queuedLog(
      UUID requestId, String recipientId, Channel channel, String address, Instant now) {
    return new SentNotificationLog(
        UUID.randomUUID(),
        requestId,
        TYPE,
        recipientId,
        channel,
        address,
        "subject",
        "body",
        DeliveryStatus.QUEUED_FOR_DISPATCH,
        0,
        now,
        null,
        null,
        now,
        now);
  }

  public static SentNotificationLog logInStatus(
      UUID requestId, String recipientId, Channel channel, DeliveryStatus status, Instant now) {
    return new SentNotificationLog(
        UUID.randomUUID(),
        requestId,
        TYPE,
        recipientId,
        channel,
        channel.name().toLowerCase() + "-address",
        "subject",
        "body",
        status,
        status == DeliveryStatus.QUEUED_FOR_DISPATCH ? 0 : 1,
        null,
        status == DeliveryStatus.QUEUED_FOR_DISPATCH ? null : "provider-1",
        status == DeliveryStatus.FAILED ? "rejected" : null,
        now,
        now);
  }

  public static NotificationRequest withVersion(NotificationRequest request, long version) {
    return new NotificationRequest(
        request.requestId(),
        request.type(),
        request.payload(),
        request.recipients(),
        request.channelPreferences(),
        request.urgency(),
        request.scheduledAt(),
        request.correlationId(),
        request.dedupKey(),
        request.status(),
        request.statusReason(),
        request.pinnedTemplateIds(),
        request.nextEvaluationAt(),
        version,
        request.createdAt(),
        request.updatedAt());
  }
}
