package com.cplite.recommendation.api.response;

public record HealthResponse(String status, String service) {}
