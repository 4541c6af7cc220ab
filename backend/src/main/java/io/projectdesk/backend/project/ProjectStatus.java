package io.projectdesk.backend.project;

import com.fasterxml.jackson.annotation.JsonValue;

/** Derived health of a project, serialized by its display label. */
public enum ProjectStatus {
  NOT_STARTED("Not Started"),
  ON_TRACK("On Track"),
  AT_RISK("At Risk"),
  BEHIND_SCHEDULE("Behind Schedule"),
  DANGER("Danger"),
  COMPLETED("Completed");

  private final String label;

  ProjectStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
