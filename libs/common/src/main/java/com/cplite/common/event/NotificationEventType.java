/*
 * Where: shared event contract
 * What: kinds of notification events and their wire names
 * Why: producers and the notification consumer must agree on the same names
 */
package com.cplite.common.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationEventType {
  CONTEST_REMINDER("ContestReminder"),
  TASK_OF_DAY("TaskOfDay"),
  TASK_ASSIGNED("TaskAssigned"),
  TASKS_BATCH_CREATED("TasksBatchCreated");

  private final String wireName;

  NotificationEventType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static NotificationEventType fromWireName(String value) {
    for (NotificationEventType type : values()) {
      if (type.wireName.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown notification event type: " + value);
  }
}
