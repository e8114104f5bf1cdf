package de.mirkosertic.filesearch.search;

import java.util.List;

/**
 * Bounded chunk of hits from one drive. Sequence numbers count per drive, starting at 0.
 */
public record ResultBatch(long sessionId, String drive, int sequence, List<SearchHit> hits) {

    public ResultBatch {
        hits = List.copyOf(hits);
    }

    public int size() {
        return hits.size();
    }
}
