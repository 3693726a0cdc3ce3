package com.example.dispatch.service;

import com.example.dispatch.repository.DispatchLeaseRepository;
import com.example.dispatch.repository.JdbcIdempotencyStore;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DispatchHousekeepingService {

  private static final Logger logger = LoggerFactory.getLogger(DispatchHousekeepingService.class);

  private final JdbcIdempotencyStore idempotencyStore;
  private final DispatchLeaseRepository leaseRepository;
  private final Clock clock;

  public void purgeExpired() {
    final Instant now = Instant.now(clock);
    final int keys = idempotencyStore.deleteExpired(now);
    final int leases = leaseRepository.deleteExpired(now);
    if (keys > 0 || leases > 0) {
      logger.info("housekeeping purged idempotencyKeys={} leases={}", keys, leases);
    }
  }
}
