package com.cplite.recommendation.api;

public enum ApiErrorCode {
  JOB_ALREADY_RUNNING,
  JOB_FAILED
}
