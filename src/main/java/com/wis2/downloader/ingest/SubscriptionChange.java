package com.wis2.downloader.ingest;

import java.util.Map;

/**
 * Result of a subscription control operation.
 *
 * @param topic         topic the operation targeted
 * @param changed       whether the table was modified (false for a repeated add or a delete of an absent topic)
 * @param subscriptions table contents after the operation, topic to directory
 */
public record SubscriptionChange(String topic, boolean changed, Map<String, String> subscriptions) {
}
