package com.cplite.notification.api;

public record ApiErrorResponse(ApiErrorCode code, String message) {}
