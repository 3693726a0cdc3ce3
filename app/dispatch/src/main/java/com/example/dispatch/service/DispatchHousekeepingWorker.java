package com.example.dispatch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "dispatch.housekeeping.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class DispatchHousekeepingWorker {

  private final DispatchHousekeepingService housekeepingService;

  @Scheduled(cron = "${dispatch.housekeeping.cron}")
  public void run() {
    housekeepingService.purgeExpired();
  }
}
