package org.waabox.nexus.query;

/**
 * A competitor whose single in one event beats their single in another.
 *
 * @param competitorId the competitor id
 * @param name         the competitor name
 * @param country      the competitor country, may be null
 * @param firstBest    the raw single of the first event
 * @param secondBest   the raw single of the second event
 * @param difference   how much faster the first event is, in seconds
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record EventComparison(
    String competitorId,
    String name,
    String country,
    int firstBest,
    int secondBest,
    double difference
) {
}
