package com.example.dispatch.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.NotificationTemplate;
import com.example.dispatch.model.PublishTemplateCommand;
import com.example.dispatch.model.RenderedMessage;
import com.example.dispatch.model.TemplateStatus;
import com.example.dispatch.service.MissingPlaceholderException;
import com.example.dispatch.service.TemplateEngine;
import com.example.dispatch.service.TemplateNotFoundException;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(TemplateController.class)
@Import(ApiExceptionHandler.class)
class TemplateControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TemplateEngine templateEngine;

  private static NotificationTemplate template(TemplateStatus status) {
    return new NotificationTemplate(
        UUID.randomUUID(),
        "order_shipped",
        Channel.EMAIL,
        "Order {{order_id}}",
        "Your order {{order_id}} shipped",
        2,
        status,
        NOW);
  }

  @Test
  void publishReturns201WithVersion() throws Exception {
    when(templateEngine.publish(any(PublishTemplateCommand.class)))
        .thenReturn(template(TemplateStatus.ACTIVE));

    mockMvc
        .perform(
            post("/v1/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"order_shipped","channel":"EMAIL","subject_template":"Order {{order_id}}",
                     "body_template":"Your order {{order_id}} shipped","activate":true}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.version").value(2))
        .andExpect(jsonPath("$.status").value("ACTIVE"));
  }

  @Test
  void publishWithoutBodyTemplateReturns400() throws Exception {
    mockMvc
        .perform(
            post("/v1/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"order_shipped\",\"channel\":\"EMAIL\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("body_template is required"));
    verifyNoInteractions(templateEngine);
  }

  @Test
  void activateUnknownTemplateReturns404() throws Exception {
    final UUID templateId = UUID.randomUUID();
    when(templateEngine.activate(templateId))
        .thenThrow(new TemplateNotFoundException("template " + templateId + " not found"));

    mockMvc
        .perform(post("/v1/templates/{template_id}/activate", templateId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("TEMPLATE_NOT_FOUND"));
  }

  @Test
  void renderPreviewReturnsRenderedMessage() throws Exception {
    final NotificationTemplate template = template(TemplateStatus.DRAFT);
    when(templateEngine.findVersion(template.templateId())).thenReturn(template);
    when(templateEngine.render(eq(template), anyMap()))
        .thenReturn(new RenderedMessage("Order o-1", "Your order o-1 shipped"));

    mockMvc
        .perform(
            post("/v1/templates/{template_id}/render", template.templateId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"data\":{\"order_id\":\"o-1\"}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.subject").value("Order o-1"))
        .andExpect(jsonPath("$.body").value("Your order o-1 shipped"));
  }

  @Test
  void renderWithMissingPlaceholderReturns422() throws Exception {
    final NotificationTemplate template = template(TemplateStatus.ACTIVE);
    when(templateEngine.findVersion(template.templateId())).thenReturn(template);
    when(templateEngine.render(eq(template), anyMap()))
        .thenThrow(new MissingPlaceholderException("order_shipped", "order_id"));

    mockMvc
        .perform(
            post("/v1/templates/{template_id}/render", template.templateId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"data\":{}}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("MISSING_PLACEHOLDER"));
  }
}
