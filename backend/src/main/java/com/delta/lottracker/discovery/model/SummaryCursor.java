package com.delta.lottracker.discovery.model;

/**
 * Page cursor for the summary API. {@code lastPage} is the bound found by the binary search,
 * null until it is known.
 */
public record SummaryCursor(
    int page,
    int pageSize,
    Integer lastPage
) {
    public SummaryCursor next() {
        return new SummaryCursor(page + 1, pageSize, lastPage);
    }
}
