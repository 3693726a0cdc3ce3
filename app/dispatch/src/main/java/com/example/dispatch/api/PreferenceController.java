package com.example.dispatch.api;

import com.example.dispatch.service.PreferenceService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users/{user_id}/preferences")
@RequiredArgsConstructor
@Validated
public class PreferenceController {

  private final PreferenceService preferenceService;

  @GetMapping
  public PreferencesResponse get(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId) {
    return PreferencesResponse.from(preferenceService.get(userId));
  }

  @PutMapping
  public PreferencesResponse update(
      @PathVariable("user_id") @NotBlank(message = "user_id is required") String userId,
      @Valid @RequestBody PreferencesRequest request) {
    return PreferencesResponse.from(preferenceService.update(request.toUpdate(userId)));
  }
}
