package com.delta.lottracker.discovery.model;

/**
 * One entry of the search vocabulary. An empty or "*" term is the wildcard query.
 */
public record SearchQuery(
    String term,
    String sortBy
) {
    public String effectiveTerm() {
        return term == null || term.isBlank() ? "*" : term.trim();
    }

    public String streamKey() {
        String key = "q=" + effectiveTerm();
        if (sortBy != null && !sortBy.isBlank()) {
            key += ";sort=" + sortBy.trim();
        }
        return key;
    }
}
