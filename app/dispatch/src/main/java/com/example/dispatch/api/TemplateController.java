package com.example.dispatch.api;

import com.example.dispatch.model.NotificationTemplate;
import com.example.dispatch.model.RenderedMessage;
import com.example.dispatch.service.TemplateEngine;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/templates")
@RequiredArgsConstructor
@Validated
public class TemplateController {

  private final TemplateEngine templateEngine;

  @PostMapping
  public ResponseEntity<TemplateResponse> publish(
      @Valid @RequestBody PublishTemplateRequest request) {
    final NotificationTemplate template = templateEngine.publish(request.toCommand());
    return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(template));
  }

  @PostMapping("/{template_id}/activate")
  public TemplateResponse activate(@PathVariable("template_id") UUID templateId) {
    return TemplateResponse.from(templateEngine.activate(templateId));
  }

  /** Renders a stored version with sample data; missing placeholders answer 422. */
  @PostMapping("/{template_id}/render")
  public RenderPreviewResponse render(
      @PathVariable("template_id") UUID templateId, @RequestBody RenderPreviewRequest request) {
    final NotificationTemplate template = templateEngine.findVersion(templateId);
    final RenderedMessage message = templateEngine.render(template, request.data());
    return new RenderPreviewResponse(
        template.templateId(), template.version(), message.subject(), message.body());
  }
}
