package com.example.dispatch.model;

public enum DomainEventType {
  NOTIFICATION_REQUESTED("NotificationRequestedEvent"),
  NOTIFICATION_PROCESSING_STARTED("NotificationProcessingStartedEvent"),
  NOTIFICATION_READY_TO_DISPATCH("NotificationReadyToDispatchEvent"),
  NOTIFICATION_DISPATCH_ATTEMPTED("NotificationDispatchAttemptedEvent"),
  NOTIFICATION_SENT_TO_CHANNEL("NotificationSentToChannelEvent"),
  NOTIFICATION_DELIVERED("NotificationDeliveredEvent"),
  NOTIFICATION_DELIVERY_FAILED("NotificationDeliveryFailedEvent"),
  NOTIFICATION_READ("NotificationReadEvent"),
  NOTIFICATION_FAILED("NotificationFailedEvent"),
  NOTIFICATION_COMPLETED("NotificationCompletedEvent"),
  NOTIFICATION_BLOCKED("NotificationBlockedEvent"),
  NOTIFICATION_CANCELED("NotificationCanceledEvent"),
  NOTIFICATION_TEMPLATE_VERSION_CREATED("NotificationTemplateVersionCreatedEvent"),
  USER_NOTIFICATION_PREFERENCES_UPDATED("UserNotificationPreferencesUpdatedEvent");

  private final String eventName;

  DomainEventType(String eventName) {
    this.eventName = eventName;
  }

  public String eventName() {
    return eventName;
  }

  public static DomainEventType fromEventName(String eventName) {
    for (DomainEventType type : values()) {
      if (type.eventName.equals(eventName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown event type: " + eventName);
  }
}
