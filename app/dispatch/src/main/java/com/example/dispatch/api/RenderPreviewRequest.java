package com.example.dispatch.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RenderPreviewRequest(Map<String, Object> data) {

  public RenderPreviewRequest {
    data = data == null ? Map.of() : data;
  }
}
