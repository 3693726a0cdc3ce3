package com.example.dispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = {"dispatch.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class DispatchOutboxWorker {

  private final DispatchOutboxPublisher publisher;

  @Scheduled(fixedDelayString = "${dispatch.outbox.poll-interval}")
  public void run() {
    publisher.publishPendingBatch();
  }
}
