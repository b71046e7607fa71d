package com.delta.lottracker.discovery.source;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.http.MarketplaceHttpClient;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.HttpFetchResult;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SearchCursor;
import com.delta.lottracker.discovery.model.SearchQuery;
import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.util.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search service client (Typesense {@code multi_search}). Offsets are translated to the service's
 * 1-based page numbers, so a cursor's offset is always a multiple of its limit.
 */
@Component
public class SearchClient implements SourceClient<SearchCursor> {
    public static final List<SearchQuery> DEFAULT_QUERIES = List.of(
        new SearchQuery("*", "ranking_weight:desc"),
        new SearchQuery("*", "retail_price:desc"),
        new SearchQuery("electronics", null),
        new SearchQuery("tools", null),
        new SearchQuery("furniture", null),
        new SearchQuery("appliances", null),
        new SearchQuery("home", null)
    );

    private final DiscoveryProperties properties;
    private final MarketplaceHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SearchClient(DiscoveryProperties properties, MarketplaceHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceTag source() {
        return SourceTag.SEARCH;
    }

    public List<SearchQuery> queries() {
        List<SearchQuery> configured = properties.getSearch().getQueries();
        return configured == null || configured.isEmpty() ? DEFAULT_QUERIES : List.copyOf(configured);
    }

    public SearchCursor initialCursor(SearchQuery query) {
        return new SearchCursor(query, 0, properties.getSearch().getPerPage());
    }

    @Override
    public SourcePage<SearchCursor> fetchPage(SearchCursor cursor) {
        if (cursor == null) {
            throw new IllegalArgumentException("search cursor is required");
        }
        HttpFetchResult result = httpClient.postJson(
            SourceTag.SEARCH,
            properties.getSearch().getUrl(),
            requestBody(cursor),
            "application/json",
            headers()
        );
        if (!result.isSuccessful()) {
            throw FailureClassifier.toException(SourceTag.SEARCH, result);
        }
        JsonNode first = parse(result, cursor).path("results").path(0);
        if (first.hasNonNull("error")) {
            throw new SourceFetchException(
                SourceTag.SEARCH,
                FailureClass.PERMANENT,
                first.path("code").asInt(result.statusCode()),
                FailureClassifier.INVALID_PAYLOAD,
                "search rejected " + cursor.query().streamKey() + ": " + first.path("error").asText()
            );
        }

        List<RawRecord> records = new ArrayList<>();
        for (JsonNode hit : first.path("hits")) {
            JsonNode document = hit.path("document");
            if (document.isObject()) {
                records.add(new RawRecord(SourceTag.SEARCH, document));
            }
        }
        int hitCount = first.path("hits").size();
        long found = first.path("found").asLong(0);
        int consumed = cursor.offset() + hitCount;
        boolean hasMore = hitCount > 0
            && consumed < found
            && cursor.offset() + cursor.limit() < properties.getSearch().getMaxOffset();
        return new SourcePage<>(records, hasMore ? cursor.next() : null, hasMore);
    }

    String requestBody(SearchCursor cursor) {
        DiscoveryProperties.Search search = properties.getSearch();
        int limit = Math.max(1, cursor.limit());
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode entry = body.putArray("searches").addObject();
        entry.put("collection", search.getCollection());
        entry.put("q", cursor.query().effectiveTerm());
        entry.put("query_by", search.getQueryBy());
        if (search.getFilterBy() != null && !search.getFilterBy().isBlank()) {
            entry.put("filter_by", search.getFilterBy());
        }
        String sortBy = cursor.query().sortBy();
        if (sortBy != null && !sortBy.isBlank()) {
            entry.put("sort_by", sortBy.trim());
        }
        entry.put("page", cursor.offset() / limit + 1);
        entry.put("per_page", limit);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not serialize search request", e);
        }
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        String apiKey = properties.getSearch().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("x-typesense-api-key", apiKey.trim());
        }
        return headers;
    }

    private JsonNode parse(HttpFetchResult result, SearchCursor cursor) {
        try {
            return objectMapper.readTree(result.body() == null ? "{}" : result.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(
                SourceTag.SEARCH,
                FailureClass.PERMANENT,
                result.statusCode(),
                FailureClassifier.INVALID_PAYLOAD,
                "search response for " + cursor.query().streamKey() + " is not JSON: " + e.getOriginalMessage()
            );
        }
    }
}
