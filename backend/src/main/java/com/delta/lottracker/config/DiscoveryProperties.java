package com.delta.lottracker.config;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.SearchQuery;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@ConfigurationProperties(prefix = "discovery")
public class DiscoveryProperties {
    private static final String DEFAULT_USER_AGENT = "delta-lot-tracker/0.1 (+contact)";
    private static final String DEFAULT_ZONE = "America/New_York";

    private String userAgent;
    private int requestTimeoutSeconds = 20;
    private int maxAttempts = 3;
    private int retryBaseDelayMs = 500;
    private int retryMaxDelayMs = 8000;
    private int fetchConcurrency = 5;
    private int maxRunSeconds = 1800;
    private int activeRunMinutes = 60;
    private int expireGraceMinutes = 60;
    private boolean excludeSameDayClosing = true;
    private String zoneId = DEFAULT_ZONE;
    private int resultLimit = 25;
    private List<String> locations = new ArrayList<>();
    private Summary summary = new Summary();
    private Search search = new Search();
    private Rendered rendered = new Rendered();
    private Augment augment = new Augment();
    private Scoring scoring = new Scoring();
    private Auth auth = new Auth();
    private Cli cli = new Cli();
    private Daemon daemon = new Daemon();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public int getRetryBaseDelayMs() {
        return Math.max(0, retryBaseDelayMs);
    }

    public void setRetryBaseDelayMs(int retryBaseDelayMs) {
        this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
    }

    public int getRetryMaxDelayMs() {
        return Math.max(0, retryMaxDelayMs);
    }

    public void setRetryMaxDelayMs(int retryMaxDelayMs) {
        this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
    }

    public int getFetchConcurrency() {
        return Math.max(1, fetchConcurrency);
    }

    public void setFetchConcurrency(int fetchConcurrency) {
        this.fetchConcurrency = Math.max(1, fetchConcurrency);
    }

    public int getMaxRunSeconds() {
        return maxRunSeconds;
    }

    public void setMaxRunSeconds(int maxRunSeconds) {
        this.maxRunSeconds = maxRunSeconds;
    }

    public int getActiveRunMinutes() {
        return Math.max(1, activeRunMinutes);
    }

    public void setActiveRunMinutes(int activeRunMinutes) {
        this.activeRunMinutes = Math.max(1, activeRunMinutes);
    }

    public int getExpireGraceMinutes() {
        return Math.max(0, expireGraceMinutes);
    }

    public void setExpireGraceMinutes(int expireGraceMinutes) {
        this.expireGraceMinutes = Math.max(0, expireGraceMinutes);
    }

    public boolean isExcludeSameDayClosing() {
        return excludeSameDayClosing;
    }

    public void setExcludeSameDayClosing(boolean excludeSameDayClosing) {
        this.excludeSameDayClosing = excludeSameDayClosing;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId == null || zoneId.isBlank() ? DEFAULT_ZONE : zoneId.trim();
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId == null ? DEFAULT_ZONE : zoneId);
    }

    public int getResultLimit() {
        return Math.max(1, resultLimit);
    }

    public void setResultLimit(int resultLimit) {
        this.resultLimit = Math.max(1, resultLimit);
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations == null ? new ArrayList<>() : locations;
    }

    /**
     * Warehouses in scope for discovery; empty means every location.
     */
    public Set<Location> locationScope() {
        Set<Location> scope = EnumSet.noneOf(Location.class);
        for (String label : locations) {
            Location location = Location.fromLabel(label);
            if (location != Location.UNKNOWN) {
                scope.add(location);
            }
        }
        return scope;
    }

    public Summary getSummary() {
        return summary;
    }

    public void setSummary(Summary summary) {
        this.summary = summary;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Rendered getRendered() {
        return rendered;
    }

    public void setRendered(Rendered rendered) {
        this.rendered = rendered;
    }

    public Augment getAugment() {
        return augment;
    }

    public void setAugment(Augment augment) {
        this.augment = augment;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Auth getAuth() {
        return auth;
    }

    public void setAuth(Auth auth) {
        this.auth = auth;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Summary {
        private String baseUrl = "https://api.macdiscount.com/auctionsummary";
        private int pageSize = 100;
        private int maxPages = 10000;
        private double requestsPerSecond = 3.0;
        private Map<Integer, String> locationIds = new LinkedHashMap<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public double getRequestsPerSecond() {
            return requestsPerSecond;
        }

        public void setRequestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public Map<Integer, String> getLocationIds() {
            return locationIds;
        }

        public void setLocationIds(Map<Integer, String> locationIds) {
            this.locationIds = locationIds == null ? new LinkedHashMap<>() : locationIds;
        }
    }

    public static class Search {
        private String url = "https://xczkhpt94lod37gqp.a1.typesense.net/multi_search";
        private String apiKey = "";
        private String collection = "prod_macdiscount_alias";
        private String queryBy = "product_name,description,keywords,upc,inventory_id,auction_title";
        private String filterBy = "is_open:=[1]";
        private int perPage = 96;
        private int maxOffset = 10000;
        private double requestsPerSecond = 5.0;
        private List<SearchQuery> queries = new ArrayList<>();

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollection() {
            return collection;
        }

        public void setCollection(String collection) {
            this.collection = collection;
        }

        public String getQueryBy() {
            return queryBy;
        }

        public void setQueryBy(String queryBy) {
            this.queryBy = queryBy;
        }

        public String getFilterBy() {
            return filterBy;
        }

        public void setFilterBy(String filterBy) {
            this.filterBy = filterBy;
        }

        public int getPerPage() {
            return Math.max(1, Math.min(250, perPage));
        }

        public void setPerPage(int perPage) {
            this.perPage = perPage;
        }

        public int getMaxOffset() {
            return Math.max(1, maxOffset);
        }

        public void setMaxOffset(int maxOffset) {
            this.maxOffset = Math.max(1, maxOffset);
        }

        public double getRequestsPerSecond() {
            return requestsPerSecond;
        }

        public void setRequestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public List<SearchQuery> getQueries() {
            return queries;
        }

        public void setQueries(List<SearchQuery> queries) {
            this.queries = queries == null ? new ArrayList<>() : queries;
        }
    }

    public static class Rendered {
        private String baseUrl = "https://www.mac.bid";
        private String lotPathTemplate = "/lot/{lotId}";
        private double requestsPerSecond = 2.0;
        private List<String> seedLotIds = new ArrayList<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getLotPathTemplate() {
            return lotPathTemplate;
        }

        public void setLotPathTemplate(String lotPathTemplate) {
            this.lotPathTemplate = lotPathTemplate;
        }

        public double getRequestsPerSecond() {
            return requestsPerSecond;
        }

        public void setRequestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
        }

        public List<String> getSeedLotIds() {
            return seedLotIds;
        }

        public void setSeedLotIds(List<String> seedLotIds) {
            this.seedLotIds = seedLotIds == null ? new ArrayList<>() : seedLotIds;
        }
    }

    public static class Augment {
        private int concurrency = 3;
        private int batchSize = 200;
        private int freshnessMinutes = 15;

        public int getConcurrency() {
            return Math.max(1, concurrency);
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }

        public int getBatchSize() {
            return Math.max(0, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(0, batchSize);
        }

        public int getFreshnessMinutes() {
            return Math.max(1, freshnessMinutes);
        }

        public void setFreshnessMinutes(int freshnessMinutes) {
            this.freshnessMinutes = Math.max(1, freshnessMinutes);
        }

        public Duration freshness() {
            return Duration.ofMinutes(getFreshnessMinutes());
        }
    }

    public static class Scoring {
        private double discountWeight = 0.5;
        private double scarcityWeight = 0.3;
        private double noBidWeight = 0.2;

        public double getDiscountWeight() {
            return Math.max(0.0, discountWeight);
        }

        public void setDiscountWeight(double discountWeight) {
            this.discountWeight = discountWeight;
        }

        public double getScarcityWeight() {
            return Math.max(0.0, scarcityWeight);
        }

        public void setScarcityWeight(double scarcityWeight) {
            this.scarcityWeight = scarcityWeight;
        }

        public double getNoBidWeight() {
            return Math.max(0.0, noBidWeight);
        }

        public void setNoBidWeight(double noBidWeight) {
            this.noBidWeight = noBidWeight;
        }
    }

    public static class Auth {
        private String cookie = "";
        private String bearerToken = "";

        public String getCookie() {
            return cookie;
        }

        public void setCookie(String cookie) {
            this.cookie = cookie;
        }

        public String getBearerToken() {
            return bearerToken;
        }

        public void setBearerToken(String bearerToken) {
            this.bearerToken = bearerToken;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    public static class Daemon {
        private boolean enabled;
        private int intervalMinutes = 30;
        private int initialDelaySeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalMinutes() {
            return Math.max(1, intervalMinutes);
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = Math.max(1, intervalMinutes);
        }

        public int getInitialDelaySeconds() {
            return Math.max(0, initialDelaySeconds);
        }

        public void setInitialDelaySeconds(int initialDelaySeconds) {
            this.initialDelaySeconds = Math.max(0, initialDelaySeconds);
        }
    }
}
