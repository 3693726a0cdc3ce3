/*
 * Where: Dispatch service layer
 * What: Decides which channels a recipient may be reached on right now
 * Why: Opt-outs, frequency caps and quiet hours are applied per channel in preference order
 */
package com.example.dispatch.service;

import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DoNotDisturbWindow;
import com.example.dispatch.model.FrequencyLimit;
import com.example.dispatch.model.NotificationRequest;
import com.example.dispatch.model.PolicyContext;
import com.example.dispatch.model.PolicyDecision;
import com.example.dispatch.model.Recipient;
import com.example.dispatch.model.Urgency;
import com.example.dispatch.model.UserNotificationPreferences;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class PolicyEvaluator {

  static final String REASON_NO_ADDRESS = "no address for preferred channels";
  static final String REASON_OPTED_OUT = "opted out";
  static final String REASON_FREQUENCY = "frequency limit reached";
  static final String REASON_DND = "do not disturb";

  /** Scheduled time when it is still ahead of {@code now}, otherwise {@code now}. */
  public static Instant evaluationTime(NotificationRequest request, Instant now) {
    final Instant scheduled = request.scheduledAt();
    return scheduled != null && scheduled.isAfter(now) ? scheduled : now;
  }

  public PolicyDecision evaluate(
      NotificationRequest request, Recipient recipient, PolicyContext context) {
    final UserNotificationPreferences preferences = context.preferences();
    final Instant instant = context.evaluationTime();
    final Optional<FrequencyLimit> limit = preferences.frequencyLimit(request.type());
    final boolean overLimit =
        limit.isPresent() && context.recentDispatchCount() >= limit.get().maxCount();
    final DoNotDisturbWindow dnd = preferences.doNotDisturb();
    final boolean quietNow =
        dnd != null && request.urgency() != Urgency.HIGH && dnd.contains(instant);

    final List<Channel> allowed = new ArrayList<>();
    final List<Channel> deferred = new ArrayList<>();
    String firstDropReason = null;
    for (Channel channel : request.channelPreferences()) {
      final String dropReason;
      if (recipient.addressFor(channel) == null) {
        dropReason = REASON_NO_ADDRESS;
      } else if (!preferences.isEnabled(request.type(), channel)) {
        dropReason = REASON_OPTED_OUT;
      } else if (overLimit) {
        dropReason = REASON_FREQUENCY;
      } else {
        dropReason = null;
      }
      if (dropReason != null) {
        if (firstDropReason == null) {
          firstDropReason = dropReason;
        }
        continue;
      }
      if (quietNow) {
        deferred.add(channel);
      } else {
        allowed.add(channel);
      }
    }

    if (!allowed.isEmpty()) {
      return PolicyDecision.allow(allowed);
    }
    if (!deferred.isEmpty()) {
      return PolicyDecision.defer(deferred, dnd.endAfter(instant), REASON_DND);
    }
    return PolicyDecision.block(firstDropReason == null ? REASON_NO_ADDRESS : firstDropReason);
  }
}
