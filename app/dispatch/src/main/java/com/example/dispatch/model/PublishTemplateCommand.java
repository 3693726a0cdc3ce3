package com.example.dispatch.model;

public record PublishTemplateCommand(
    String name, Channel channel, String subjectTemplate, String bodyTemplate, boolean activate) {}
