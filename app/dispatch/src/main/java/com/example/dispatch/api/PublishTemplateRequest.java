package com.example.dispatch.api;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.PublishTemplateCommand;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublishTemplateRequest(
    @NotBlank(message = "name is required") String name,
    @NotNull(message = "channel is required") Channel channel,
    String subjectTemplate,
    @NotBlank(message = "body_template is required") String bodyTemplate,
    boolean activate) {

  public PublishTemplateCommand toCommand() {
    return new PublishTemplateCommand(name, channel, subjectTemplate, bodyTemplate, activate);
  }
}
