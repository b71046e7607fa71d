package com.delta.lottracker.discovery.model;

import java.util.List;

/**
 * Walks a fixed list of lot ids through the rendered channel, one lot per page.
 */
public record RenderedCursor(
    List<String> lotIds,
    int index
) {
    public RenderedCursor {
        lotIds = lotIds == null ? List.of() : List.copyOf(lotIds);
        index = Math.max(0, index);
    }

    public boolean exhausted() {
        return index >= lotIds.size();
    }

    public String currentLotId() {
        return exhausted() ? null : lotIds.get(index);
    }

    public RenderedCursor next() {
        return new RenderedCursor(lotIds, index + 1);
    }
}
