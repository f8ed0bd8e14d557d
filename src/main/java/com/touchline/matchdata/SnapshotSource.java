package com.touchline.matchdata;

import com.touchline.domain.model.MatchSnapshot;
import java.util.List;

/**
 * Supplies the current state of every tracked fixture once per polling cycle.
 *
 * <p>Implementations own their retry and fallback policy. They never throw for
 * upstream trouble: a failed fetch comes back as stale snapshots or an empty list.
 */
public interface SnapshotSource {

    List<MatchSnapshot> fetchCurrentMatches();
}
