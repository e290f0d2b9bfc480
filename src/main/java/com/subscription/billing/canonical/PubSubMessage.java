package com.subscription.billing.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * A decoded Pub/Sub push delivery: the message id and the JSON carried in {@code message.data}.
 */
@Value
public class PubSubMessage {

    String messageId;
    JsonNode data;
}
