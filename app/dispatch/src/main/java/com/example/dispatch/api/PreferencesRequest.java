/*
 * Where: Dispatch API
 * What: JSON body of PUT /v1/users/{user_id}/preferences
 * Why: The body replaces every preference of the user at once
 */
package com.example.dispatch.api;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DoNotDisturbWindow;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.PreferenceUpdate;
import com.example.dispatch.service.ValidationException;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PreferencesRequest(
    List<@Valid OptInRequest> optIns,
    @Valid DoNotDisturbRequest doNotDisturb,
    List<@Valid FrequencyLimitRequest> frequencyLimits,
    Long expectedVersion) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record OptInRequest(
      @NotBlank(message = "opt_in type is required") String type,
      @NotNull(message = "opt_in channel is required") Channel channel,
      boolean enabled) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DoNotDisturbRequest(
      @NotNull(message = "do_not_disturb start is required") LocalTime start,
      @NotNull(message = "do_not_disturb end is required") LocalTime end,
      @NotBlank(message = "do_not_disturb zone is required") String zone) {}

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record FrequencyLimitRequest(
      @NotBlank(message = "frequency_limit type is required") String type,
      int maxCount,
      @NotNull(message = "frequency_limit window is required") Duration window) {}

  public PreferenceUpdate toUpdate(String userId) {
    final List<ChannelOptIn> mappedOptIns =
        optIns == null
            ? List.of()
            : optIns.stream().map(o -> new ChannelOptIn(o.type(), o.channel(), o.enabled())).toList();
    final List<FrequencyLimit> mappedLimits =
        frequencyLimits == null
            ? List.of()
            : frequencyLimits.stream()
                .map(l -> new FrequencyLimit(l.type(), l.maxCount(), l.window()))
                .toList();
    return new PreferenceUpdate(
        userId, mappedOptIns, toWindow(doNotDisturb), mappedLimits, expectedVersion);
  }

  private static DoNotDisturbWindow toWindow(DoNotDisturbRequest request) {
    if (request == null) {
      return null;
    }
    try {
      return new DoNotDisturbWindow(request.start(), request.end(), ZoneId.of(request.zone()));
    } catch (DateTimeException ex) {
      throw new ValidationException("do_not_disturb zone is invalid: " + request.zone());
    }
  }
}
