package com.example.dispatch.model;

public enum TemplateStatus {
  DRAFT,
  ACTIVE,
  DEPRECATED
}
