/*
 * Where: notification service configuration
 * What: NATS connection settings
 * Why: the broker address differs between local runs and deployments
 */
package com.cplite.notification.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
