package com.example.dispatch.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "dispatch.nats")
public record DispatchNatsProperties(
    @NotBlank String subjectPrefix, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  /** Events go to {@code <prefix>.<EventName>}; the stream captures {@code <prefix>.>}. */
  public String subjectFor(String eventType) {
    return subjectPrefix + "." + eventType;
  }

  public String streamSubjects() {
    return subjectPrefix + ".>";
  }
}
