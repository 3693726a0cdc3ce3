/*
 * Where: Dispatch API
 * What: Provider receipts and delivery log queries
 * Why: Receipts advance SENT logs; queries serve support and audit
 */
package com.example.dispatch.api;

import com.example.dispatch.service.DeliveryLedger;
import com.example.dispatch.service.DispatchOrchestrator;
import com.example.dispatch.service.ValidationException;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/deliveries")
@RequiredArgsConstructor
@Validated
public class DeliveryController {

  private final DispatchOrchestrator orchestrator;
  private final DeliveryLedger ledger;

  @PostMapping("/{log_id}/delivered")
  public DeliveryResponse delivered(@PathVariable("log_id") UUID logId) {
    return DeliveryResponse.from(orchestrator.confirmDelivery(logId));
  }

  @PostMapping("/{log_id}/read")
  public DeliveryResponse read(@PathVariable("log_id") UUID logId) {
    return DeliveryResponse.from(orchestrator.markRead(logId));
  }

  /** Exactly one of request_id or address selects the logs. */
  @GetMapping
  public DeliveriesResponse search(
      @RequestParam(value = "request_id", required = false) UUID requestId,
      @RequestParam(value = "address", required = false) String address) {
    if ((requestId == null) == (address == null || address.isBlank())) {
      throw new ValidationException("exactly one of request_id or address is required");
    }
    if (requestId != null) {
      return DeliveriesResponse.of(
          ledger.findByRequestId(requestId), ledger.attemptsByRequestId(requestId));
    }
    return DeliveriesResponse.of(ledger.findByAddress(address), List.of());
  }

  @GetMapping("/failed")
  public DeliveriesResponse failed(@RequestParam("older_than") Duration olderThan) {
    if (olderThan.isNegative()) {
      throw new ValidationException("older_than must not be negative");
    }
    return DeliveriesResponse.of(ledger.findFailedOlderThan(olderThan), List.of());
  }
}
