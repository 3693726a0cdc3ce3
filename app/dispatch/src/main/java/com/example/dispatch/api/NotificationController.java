/*
 * Where: Dispatch API
 * What: Create, read and cancel notification requests
 * Why: Creation only persists the request; PendingRequestWorker picks it up for dispatch
 */
package com.example.dispatch.api;

import com.example.dispatch.model.CreateResult;
import com.example.dispatch.service.RequestLifecycleManager;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
@Validated
public class NotificationController {

  private static final String HEADER_CORRELATION_ID = "X-Correlation-Id";

  private final RequestLifecycleManager lifecycleManager;

  /** 202 for a new request, 200 when the dedup key was already used. */
  @PostMapping
  public ResponseEntity<NotificationResponse> create(
      @RequestHeader(value = HEADER_CORRELATION_ID, required = false) String correlationId,
      @Valid @RequestBody CreateNotificationRequest request) {
    final CreateResult result = lifecycleManager.create(request.toCommand(correlationId));
    final HttpStatus status = result.created() ? HttpStatus.ACCEPTED : HttpStatus.OK;
    return ResponseEntity.status(status).body(NotificationResponse.from(result.request()));
  }

  @GetMapping("/{id}")
  public NotificationResponse get(@PathVariable("id") UUID id) {
    return NotificationResponse.from(lifecycleManager.get(id));
  }

  @PostMapping("/{id}/cancel")
  public NotificationResponse cancel(@PathVariable("id") UUID id) {
    return NotificationResponse.from(lifecycleManager.cancel(id));
  }
}
