package com.cplite.notification.model;

/** Result of handling one delivered event. */
public enum ConsumeOutcome {
  /** The event was claimed and its notification committed. */
  PERSISTED("persisted"),
  /** The event id was already claimed by an earlier delivery. */
  DUPLICATE("duplicate");

  private final String metricTag;

  ConsumeOutcome(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
