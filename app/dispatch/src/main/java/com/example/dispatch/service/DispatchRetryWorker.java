package com.example.dispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dispatch.delivery.enabled", havingValue = "true", matchIfMissing = true)
public class DispatchRetryWorker {

  private final DispatchOrchestrator orchestrator;

  @Scheduled(fixedDelayString = "${dispatch.delivery.poll-interval}")
  public void run() {
    orchestrator.retryDue();
  }
}
