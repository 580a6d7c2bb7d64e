package com.cplite.notification.api.response;

public record HealthResponse(String status, String service) {}
