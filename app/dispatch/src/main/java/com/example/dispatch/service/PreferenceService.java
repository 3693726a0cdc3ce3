/*
 * Where: Dispatch service layer
 * What: Reads and replaces user notification preferences
 * Why: Every accepted update raises UserNotificationPreferencesUpdatedEvent in the same transaction
 */
package com.example.dispatch.service;

import com.example.dispatch.model.ChannelOptIn;
import com.example.dispatch.model.DomainEvent;
import com.example.dispatch.model.DomainEventType;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.PreferenceUpdate;
import com.example.dispatch.model.UserNotificationPreferences;
import com.example.dispatch.repository.UserPreferenceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PreferenceService {

  private static final Logger logger = LoggerFactory.getLogger(PreferenceService.class);

  private final UserPreferenceRepository preferenceRepository;
  private final EventOutbox eventOutbox;
  private final Clock clock;

  /** Stored preferences, or the all-enabled defaults for a user who never set any. */
  public UserNotificationPreferences get(String userId) {
    return preferenceRepository
        .findByUserId(userId)
        .orElseGet(() -> UserNotificationPreferences.defaults(userId));
  }

  @Transactional
  public UserNotificationPreferences update(PreferenceUpdate update) {
    validate(update);
    final long expectedVersion =
        update.expectedVersion() != null ? update.expectedVersion() : get(update.userId()).version();
    final Instant now = Instant.now(clock);
    final UserNotificationPreferences saved =
        preferenceRepository.upsert(
            new UserNotificationPreferences(
                update.userId(),
                update.optIns(),
                update.doNotDisturb(),
                update.frequencyLimits(),
                expectedVersion,
                now),
            expectedVersion);
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("user_id", saved.userId());
    attributes.put("version", saved.version());
    attributes.put("opt_out_count", saved.optIns().stream().filter(o -> !o.enabled()).count());
    attributes.put("do_not_disturb", saved.doNotDisturb() != null);
    eventOutbox.append(
        DomainEvent.of(
            DomainEventType.USER_NOTIFICATION_PREFERENCES_UPDATED,
            "user:" + saved.userId(),
            saved.userId(),
            now,
            attributes));
    logger.info("preferences updated userId={} version={}", saved.userId(), saved.version());
    return saved;
  }

  private void validate(PreferenceUpdate update) {
    if (update.userId() == null || update.userId().isBlank()) {
      throw new ValidationException("user_id must not be blank");
    }
    final Set<String> optInKeys = new HashSet<>();
    for (ChannelOptIn optIn : update.optIns()) {
      if (optIn.type() == null || optIn.type().isBlank() || optIn.channel() == null) {
        throw new ValidationException("opt-in needs a type and a channel");
      }
      if (!optInKeys.add(optIn.type() + ":" + optIn.channel())) {
        throw new ValidationException(
            "duplicate opt-in for type " + optIn.type() + " channel " + optIn.channel());
      }
    }
    final Set<String> limitTypes = new HashSet<>();
    for (FrequencyLimit limit : update.frequencyLimits()) {
      if (limit.type() == null || limit.type().isBlank()) {
        throw new ValidationException("frequency limit needs a type");
      }
      if (limit.maxCount() < 1) {
        throw new ValidationException("frequency limit max_count must be at least 1");
      }
      if (limit.window() == null || limit.window().isZero() || limit.window().isNegative()) {
        throw new ValidationException("frequency limit window must be positive");
      }
      if (!limitTypes.add(limit.type())) {
        throw new ValidationException("duplicate frequency limit for type " + limit.type());
      }
    }
  }
}
