package com.cplite.notification.service;

public class ContestNotFoundException extends RuntimeException {

  private final long contestId;

  public ContestNotFoundException(long contestId) {
    super("contest not found");
    this.contestId = contestId;
  }

  public long contestId() {
    return contestId;
  }
}
