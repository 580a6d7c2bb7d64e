package com.cplite.notification.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/** @param updated rows flipped by read-all; absent for single-row updates */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusResponse(String status, Integer updated) {

  private static final String SUCCESS = "success";

  public static StatusResponse success() {
    return new StatusResponse(SUCCESS, null);
  }

  public static StatusResponse success(int updated) {
    return new StatusResponse(SUCCESS, updated);
  }
}
