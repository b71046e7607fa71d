package com.delta.lottracker.discovery.source;

import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SourceTag;

/**
 * One marketplace channel. Implementations throw
 * {@link com.delta.lottracker.discovery.http.SourceFetchException} once the retry budget is spent;
 * a page is never partially returned.
 */
public interface SourceClient<C> {
    SourceTag source();

    SourcePage<C> fetchPage(C cursor);
}
