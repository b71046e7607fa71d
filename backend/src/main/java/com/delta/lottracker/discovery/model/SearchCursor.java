package com.delta.lottracker.discovery.model;

public record SearchCursor(
    SearchQuery query,
    int offset,
    int limit
) {
    public SearchCursor next() {
        return new SearchCursor(query, offset + limit, limit);
    }
}
