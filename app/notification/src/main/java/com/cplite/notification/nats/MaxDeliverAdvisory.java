package com.cplite.notification.nats;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * JetStream {@code io.nats.jetstream.advisory.v1.max_deliver} advisory. Only the fields needed to
 * find the message again are mapped.
 *
 * @param streamSeq sequence of the exhausted message in the event stream; null when absent
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MaxDeliverAdvisory(
    String id, String stream, String consumer, Long streamSeq, Integer deliveries) {}
