/*
 * Where: Dispatch service layer
 * What: Resolves, renders and versions notification templates
 * Why: Active lookups are cached; published versions never change content
 */
package com.example.dispatch.service;

import com.example.dispatch.config.DispatchTemplateCacheProperties;
import com.example.dispatch.model.Channel;
import com.example.dispatch.model.DomainEvent;
import com.example.dispatch.model.DomainEventType;
import com.example.dispatch.model.InvalidStateTransitionException;
import com.example.dispatch.model.NotificationTemplate;
import com.example.dispatch.model.PublishTemplateCommand;
import com.example.dispatch.model.RenderedMessage;
import com.example.dispatch.model.TemplateStatus;
import com.example.dispatch.repository.NotificationTemplateRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class TemplateEngine {

  private static final Logger logger = LoggerFactory.getLogger(TemplateEngine.class);

  // {{key}} or {{key|default}}; keys may use dots to reach nested payload objects
  private static final Pattern TOKEN =
      Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*(?:\\|([^}]*))?\\}\\}");

  private final NotificationTemplateRepository templateRepository;
  private final EventOutbox eventOutbox;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;
  // "name:CHANNEL" -> active version; Optional.empty() is cached too, never null
  private final Cache<String, Optional<NotificationTemplate>> activeCache;

  public TemplateEngine(
      NotificationTemplateRepository templateRepository,
      EventOutbox eventOutbox,
      PlatformTransactionManager transactionManager,
      Clock clock,
      DispatchTemplateCacheProperties cacheProperties) {
    this.templateRepository = templateRepository;
    this.eventOutbox = eventOutbox;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
    this.activeCache =
        Caffeine.newBuilder()
            .expireAfterWrite(cacheProperties.ttl())
            .maximumSize(cacheProperties.maximumSize())
            .build();
  }

  /** ACTIVE version for (type, channel), if any. */
  public Optional<NotificationTemplate> findActive(String type, Channel channel) {
    return activeCache.get(
        NotificationTemplate.cacheKey(type, channel),
        key -> templateRepository.findActive(type, channel));
  }

  public NotificationTemplate resolve(String type, Channel channel) {
    return findActive(type, channel)
        .orElseThrow(
            () ->
                new TemplateNotFoundException(
                    "no active template for type " + type + " channel " + channel));
  }

  public NotificationTemplate findVersion(UUID templateId) {
    return templateRepository
        .findById(templateId)
        .orElseThrow(() -> new TemplateNotFoundException("template " + templateId + " not found"));
  }

  /**
   * Substitutes every token with its value from {@code data}. Extra keys are ignored.
   *
   * @throws MissingPlaceholderException when a token without default has no value
   */
  public RenderedMessage render(NotificationTemplate template, Map<String, Object> data) {
    final String subject =
        template.subjectTemplate() == null
            ? null
            : substitute(template.name(), template.subjectTemplate(), data);
    final String body = substitute(template.name(), template.bodyTemplate(), data);
    return new RenderedMessage(subject, body);
  }

  public NotificationTemplate publish(PublishTemplateCommand command) {
    validate(command);
    final NotificationTemplate created =
        transactionTemplate.execute(
            status -> {
              templateRepository.lockTemplateKey(command.name(), command.channel());
              final int nextVersion =
                  templateRepository.findMaxVersion(command.name(), command.channel()) + 1;
              if (command.activate()) {
                templateRepository.deprecateActive(command.name(), command.channel());
              }
              final NotificationTemplate template =
                  new NotificationTemplate(
                      UUID.randomUUID(),
                      command.name(),
                      command.channel(),
                      command.subjectTemplate(),
                      command.bodyTemplate(),
                      nextVersion,
                      command.activate() ? TemplateStatus.ACTIVE : TemplateStatus.DRAFT,
                      Instant.now(clock));
              templateRepository.insert(template);
              eventOutbox.append(versionCreated(template));
              return template;
            });
    activeCache.invalidate(created.cacheKey());
    logger.info(
        "template version published name={} channel={} version={} status={}",
        created.name(),
        created.channel(),
        created.version(),
        created.status());
    return created;
  }

  /** DRAFT -> ACTIVE, deprecating the version it supersedes. */
  public NotificationTemplate activate(UUID templateId) {
    final NotificationTemplate activated =
        transactionTemplate.execute(
            status -> {
              final NotificationTemplate draft = findVersion(templateId);
              templateRepository.lockTemplateKey(draft.name(), draft.channel());
              if (draft.status() != TemplateStatus.DRAFT) {
                throw new InvalidStateTransitionException(
                    "template " + templateId + " is " + draft.status() + ", expected DRAFT");
              }
              templateRepository.deprecateActive(draft.name(), draft.channel());
              if (templateRepository.activateDraft(templateId) == 0) {
                throw new InvalidStateTransitionException(
                    "template " + templateId + " changed status concurrently");
              }
              return findVersion(templateId);
            });
    activeCache.invalidate(activated.cacheKey());
    logger.info(
        "template version activated name={} channel={} version={}",
        activated.name(),
        activated.channel(),
        activated.version());
    return activated;
  }

  @VisibleForTesting
  void invalidateAll() {
    activeCache.invalidateAll();
  }

  private String substitute(String templateName, String source, Map<String, Object> data) {
    final Matcher matcher = TOKEN.matcher(source);
    final StringBuilder rendered = new StringBuilder();
    while (matcher.find()) {
      final String key = matcher.group(1);
      final String fallback = matcher.group(2);
      final Object value = lookup(data, key);
      final String replacement;
      if (value != null) {
        replacement = String.valueOf(value);
      } else if (fallback != null) {
        replacement = fallback;
      } else {
        throw new MissingPlaceholderException(templateName, key);
      }
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }

  private Object lookup(Map<String, Object> data, String key) {
    if (data.containsKey(key)) {
      return data.get(key);
    }
    Object current = data;
    for (String part : key.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(part);
    }
    return current;
  }

  private void validate(PublishTemplateCommand command) {
    if (command.name() == null || command.name().isBlank()) {
      throw new ValidationException("template name must not be blank");
    }
    if (command.channel() == null) {
      throw new ValidationException("template channel must be set");
    }
    if (command.bodyTemplate() == null || command.bodyTemplate().isBlank()) {
      throw new ValidationException("template body must not be blank");
    }
  }

  private DomainEvent versionCreated(NotificationTemplate template) {
    final Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("template_id", template.templateId().toString());
    attributes.put("name", template.name());
    attributes.put("channel", template.channel().name());
    attributes.put("version", template.version());
    attributes.put("status", template.status().name());
    return DomainEvent.of(
        DomainEventType.NOTIFICATION_TEMPLATE_VERSION_CREATED,
        "template:" + template.cacheKey(),
        template.templateId().toString(),
        template.createdAt(),
        attributes);
  }
}
