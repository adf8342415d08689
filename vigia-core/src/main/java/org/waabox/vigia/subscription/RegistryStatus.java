package org.waabox.vigia.subscription;

/**
 * A point-in-time view of the subscription registry.
 *
 * @param mode              the aggregated mode, never null
 * @param topicCount        the subscribed topics
 * @param activeTopicCount  the topics on push
 * @param pollingTopicCount the topics on poll
 * @param pendingTopicCount the topics without a transport
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RegistryStatus(
    SyncMode mode,
    int topicCount,
    int activeTopicCount,
    int pollingTopicCount,
    int pendingTopicCount
) {
}
