package com.cplite.notification.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOTIFICATION_NOT_FOUND,
  CONTEST_NOT_FOUND
}
