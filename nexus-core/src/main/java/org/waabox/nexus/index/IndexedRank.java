package org.waabox.nexus.index;

import org.waabox.nexus.model.ResultType;

/**
 * One entry of a {@link RankIndex}, flattened with its full key.
 *
 * @param scope   the scope, never null
 * @param eventId the event id, never null
 * @param type    the result type, never null
 * @param rank    the rank number
 * @param holder  the rank holder, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record IndexedRank(
    String scope,
    String eventId,
    ResultType type,
    int rank,
    RankHolder holder
) {
}
