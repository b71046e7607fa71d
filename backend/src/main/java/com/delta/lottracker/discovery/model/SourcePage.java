package com.delta.lottracker.discovery.model;

import java.util.List;

public record SourcePage<C>(
    List<RawRecord> records,
    C nextCursor,
    boolean hasMore
) {
    public SourcePage {
        records = records == null ? List.of() : List.copyOf(records);
        if (nextCursor == null) {
            hasMore = false;
        }
    }

    public static <C> SourcePage<C> last(List<RawRecord> records) {
        return new SourcePage<>(records, null, false);
    }
}
