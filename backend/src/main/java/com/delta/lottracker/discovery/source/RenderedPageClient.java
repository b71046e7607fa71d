package com.delta.lottracker.discovery.source;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.augment.AuthSession;
import com.delta.lottracker.discovery.http.MarketplaceHttpClient;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.HttpFetchResult;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.RenderedCursor;
import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.util.FailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Reads one lot from its server-rendered page. Both the HTML document (embedded
 * {@code script#__NEXT_DATA__} block) and the framework's JSON data route are understood.
 */
@Component
public class RenderedPageClient implements SourceClient<RenderedCursor> {
    private static final Logger log = LoggerFactory.getLogger(RenderedPageClient.class);
    private static final String ACCEPT = "text/html,application/xhtml+xml,application/json;q=0.9,*/*;q=0.8";
    private static final List<String> LOT_KEYS = List.of("lot", "activeLot");

    private final DiscoveryProperties properties;
    private final MarketplaceHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RenderedPageClient(DiscoveryProperties properties, MarketplaceHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceTag source() {
        return SourceTag.RENDERED;
    }

    /**
     * Seed streams read public pages without credentials. An unreadable or missing page yields an
     * empty page and the walk continues with the next id; only an auth rejection ends the stream.
     */
    @Override
    public SourcePage<RenderedCursor> fetchPage(RenderedCursor cursor) {
        if (cursor == null || cursor.exhausted()) {
            return SourcePage.last(List.of());
        }
        String lotId = cursor.currentLotId();
        RenderedCursor next = cursor.next();
        boolean hasMore = !next.exhausted();
        List<RawRecord> records;
        try {
            records = List.of(fetchLot(lotId, null));
        } catch (DegradedPayloadException e) {
            log.warn("rendered page for lot {} had no usable data block: {}", lotId, e.getMessage());
            records = List.of();
        } catch (SourceFetchException e) {
            if (e.isAuthRejected()) {
                throw e;
            }
            log.warn("skipping rendered lot {} ({}): {}", lotId, e.failureClass(), e.getMessage());
            records = List.of();
        }
        return new SourcePage<>(records, hasMore ? next : null, hasMore);
    }

    /**
     * @throws DegradedPayloadException when the page was served but carries no readable lot data
     * @throws SourceFetchException when the page could not be fetched
     */
    public RawRecord fetchLot(String lotId, AuthSession session) {
        Map<String, String> headers = session == null ? Map.of() : session.headers();
        HttpFetchResult result = httpClient.get(SourceTag.RENDERED, lotUrl(lotId), ACCEPT, headers);
        if (!result.isSuccessful()) {
            throw FailureClassifier.toException(SourceTag.RENDERED, result);
        }
        JsonNode lot = extractLot(lotId, result);
        return new RawRecord(SourceTag.RENDERED, withIdentity(lot, lotId));
    }

    public String lotUrl(String lotId) {
        DiscoveryProperties.Rendered rendered = properties.getRendered();
        String encoded = URLEncoder.encode(lotId == null ? "" : lotId.trim(), StandardCharsets.UTF_8);
        String base = rendered.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String path = rendered.getLotPathTemplate().replace("{lotId}", encoded);
        return base + (path.startsWith("/") ? path : "/" + path);
    }

    JsonNode extractLot(String lotId, HttpFetchResult result) {
        String body = result.body();
        if (body == null || body.isBlank()) {
            throw new DegradedPayloadException(lotId, "empty rendered body");
        }
        String trimmed = body.trim();
        JsonNode root;
        if (result.isJson() || trimmed.startsWith("{")) {
            root = readJson(lotId, trimmed);
        } else {
            Document document = Jsoup.parse(body);
            Element script = document.selectFirst("script#__NEXT_DATA__");
            if (script == null) {
                throw new DegradedPayloadException(lotId, "no __NEXT_DATA__ block in rendered page");
            }
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            root = readJson(lotId, payload);
        }
        JsonNode pageProps = root.has("props") ? root.path("props").path("pageProps") : root.path("pageProps");
        for (String key : LOT_KEYS) {
            JsonNode lot = pageProps.path(key);
            if (lot.isObject() && lot.size() > 0) {
                return lot;
            }
        }
        throw new DegradedPayloadException(lotId, "rendered data block has no lot object");
    }

    private JsonNode readJson(String lotId, String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new DegradedPayloadException(lotId, "unreadable rendered data block: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode withIdentity(JsonNode lot, String lotId) {
        if (lot.hasNonNull("lot_id") || lot.hasNonNull("id") || lotId == null || lotId.isBlank()) {
            return lot;
        }
        ObjectNode copy = ((ObjectNode) lot).deepCopy();
        copy.put("lot_id", lotId.trim());
        return copy;
    }
}
