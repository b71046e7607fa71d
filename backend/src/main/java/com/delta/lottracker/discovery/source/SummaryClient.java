package com.delta.lottracker.discovery.source;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.http.MarketplaceHttpClient;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.HttpFetchResult;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.model.SummaryCursor;
import com.delta.lottracker.discovery.util.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Paginated summary API ({@code ?pg=N&ppg=M}). The first call locates the last non-empty page
 * with an exponential probe followed by a binary search, then pages are read in order.
 */
@Component
public class SummaryClient implements SourceClient<SummaryCursor> {
    private static final Logger log = LoggerFactory.getLogger(SummaryClient.class);
    private static final String ACCEPT = "application/json";

    private final DiscoveryProperties properties;
    private final MarketplaceHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SummaryClient(DiscoveryProperties properties, MarketplaceHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceTag source() {
        return SourceTag.SUMMARY;
    }

    public SummaryCursor initialCursor() {
        return new SummaryCursor(1, properties.getSummary().getPageSize(), null);
    }

    @Override
    public SourcePage<SummaryCursor> fetchPage(SummaryCursor cursor) {
        SummaryCursor current = cursor == null ? initialCursor() : cursor;
        if (current.lastPage() == null) {
            int lastPage = findLastPage(current.pageSize());
            log.info("summary API last non-empty page is {} (page size {})", lastPage, current.pageSize());
            current = new SummaryCursor(current.page(), current.pageSize(), lastPage);
        }
        if (current.lastPage() == 0 || current.page() > properties.getSummary().getMaxPages()) {
            return SourcePage.last(List.of());
        }

        List<RawRecord> records = readPage(current.page(), current.pageSize());
        if (records.isEmpty()) {
            return SourcePage.last(records);
        }
        boolean withinBound = current.page() < current.lastPage();
        // the catalog can grow between the probe and the scan; a full page past the bound keeps going
        boolean grewPastBound = !withinBound && records.size() >= current.pageSize();
        boolean hasMore = (withinBound || grewPastBound) && current.page() < properties.getSummary().getMaxPages();
        return new SourcePage<>(records, hasMore ? current.next() : null, hasMore);
    }

    /**
     * @return the highest page number that still returns records, 0 when the first page is empty
     */
    public int findLastPage(int pageSize) {
        int maxPages = properties.getSummary().getMaxPages();
        if (readPage(1, pageSize).isEmpty()) {
            return 0;
        }
        int nonEmpty = 1;
        int probe = 2;
        Integer empty = null;
        while (probe <= maxPages) {
            if (readPage(probe, pageSize).isEmpty()) {
                empty = probe;
                break;
            }
            nonEmpty = probe;
            probe = probe * 2;
        }
        if (empty == null) {
            if (nonEmpty == maxPages) {
                return maxPages;
            }
            if (!readPage(maxPages, pageSize).isEmpty()) {
                return maxPages;
            }
            empty = maxPages;
        }
        int low = nonEmpty;
        int high = empty;
        while (high - low > 1) {
            int mid = low + (high - low) / 2;
            if (readPage(mid, pageSize).isEmpty()) {
                high = mid;
            } else {
                low = mid;
            }
        }
        return low;
    }

    private List<RawRecord> readPage(int page, int pageSize) {
        String url = pageUrl(page, pageSize);
        HttpFetchResult result = httpClient.get(SourceTag.SUMMARY, url, ACCEPT, Map.of());
        if (!result.isSuccessful()) {
            if (result.errorCode() == null && result.statusCode() == 404) {
                return List.of();
            }
            throw FailureClassifier.toException(SourceTag.SUMMARY, result);
        }
        if (result.body() == null || result.body().isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(
                SourceTag.SUMMARY,
                FailureClass.PERMANENT,
                result.statusCode(),
                FailureClassifier.INVALID_PAYLOAD,
                "summary page " + page + " is not JSON: " + e.getOriginalMessage()
            );
        }
        JsonNode data = root.isArray() ? root : root.path("data");
        List<RawRecord> records = new ArrayList<>();
        if (data.isArray()) {
            for (JsonNode node : data) {
                if (node.isObject()) {
                    records.add(new RawRecord(SourceTag.SUMMARY, node));
                }
            }
        }
        return records;
    }

    private String pageUrl(int page, int pageSize) {
        String base = properties.getSummary().getBaseUrl();
        String separator = base.contains("?") ? "&" : "?";
        return base + separator + "pg=" + page + "&ppg=" + pageSize;
    }
}
