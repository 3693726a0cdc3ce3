package com.example.dispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "dispatch.requests.enabled", havingValue = "true", matchIfMissing = true)
public class PendingRequestWorker {

  private final RequestLifecycleManager lifecycleManager;

  @Scheduled(fixedDelayString = "${dispatch.requests.poll-interval}")
  public void run() {
    lifecycleManager.processDue();
    lifecycleManager.reconcileStale();
  }
}
