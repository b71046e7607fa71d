package com.delta.lottracker.discovery.source;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.http.MarketplaceHttpClient;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SummaryCursor;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummaryClientTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void locatesLastNonEmptyPage() throws Exception {
        startCatalog(9, 2, false);
        SummaryClient client = newClient(2, 64, 1);

        assertThat(client.findLastPage(2)).isEqualTo(5);
    }

    @Test
    void walksEveryPageOnce() throws Exception {
        startCatalog(9, 2, false);
        SummaryClient client = newClient(2, 64, 1);

        List<RawRecord> all = new ArrayList<>();
        SummaryCursor cursor = client.initialCursor();
        int pages = 0;
        while (cursor != null) {
            SourcePage<SummaryCursor> page = client.fetchPage(cursor);
            all.addAll(page.records());
            cursor = page.hasMore() ? page.nextCursor() : null;
            pages++;
        }

        assertThat(pages).isEqualTo(5);
        assertThat(all).hasSize(9);
        assertThat(all).extracting(record -> record.payload().path("lot_id").asText())
            .doesNotHaveDuplicates()
            .contains("lot-1", "lot-9");
    }

    @Test
    void notFoundPageCountsAsEmpty() throws Exception {
        startCatalog(3, 2, true);
        SummaryClient client = newClient(2, 16, 1);

        assertThat(client.findLastPage(2)).isEqualTo(2);
    }

    @Test
    void emptyCatalogYieldsNoRecords() throws Exception {
        startCatalog(0, 2, false);
        SummaryClient client = newClient(2, 16, 1);

        SourcePage<SummaryCursor> page = client.fetchPage(client.initialCursor());

        assertThat(page.records()).isEmpty();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void serverErrorAfterRetriesIsRetryableFailure() throws Exception {
        server = new MockWebServer();
        for (int i = 0; i < 2; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }
        server.start();
        SummaryClient client = newClient(2, 16, 2);

        assertThatThrownBy(() -> client.fetchPage(client.initialCursor()))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> {
                assertThat(e.failureClass()).isEqualTo(FailureClass.RETRYABLE);
                assertThat(e.statusCode()).isEqualTo(503);
            });
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void nonJsonBodyIsPermanentFailure() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));
        server.start();
        SummaryClient client = newClient(2, 16, 1);

        assertThatThrownBy(() -> client.findLastPage(2))
            .isInstanceOfSatisfying(SourceFetchException.class,
                e -> assertThat(e.failureClass()).isEqualTo(FailureClass.PERMANENT));
    }

    private void startCatalog(int totalRecords, int pageSize, boolean notFoundPastEnd) throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                int page = Integer.parseInt(request.getRequestUrl().queryParameter("pg"));
                int from = (page - 1) * pageSize;
                if (from >= totalRecords && notFoundPastEnd) {
                    return new MockResponse().setResponseCode(404);
                }
                StringBuilder body = new StringBuilder("{\"data\":[");
                for (int i = from; i < Math.min(totalRecords, from + pageSize); i++) {
                    if (i > from) {
                        body.append(',');
                    }
                    body.append("{\"lot_id\":\"lot-").append(i + 1).append("\"}");
                }
                body.append("]}");
                return new MockResponse()
                    .setResponseCode(200)
                    .addHeader("Content-Type", "application/json")
                    .setBody(body.toString());
            }
        });
        server.start();
    }

    private SummaryClient newClient(int pageSize, int maxPages, int maxAttempts) {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setMaxAttempts(maxAttempts);
        properties.setRetryBaseDelayMs(1);
        properties.setRetryMaxDelayMs(5);
        properties.getSummary().setBaseUrl(server.url("/auctionsummary").toString());
        properties.getSummary().setPageSize(pageSize);
        properties.getSummary().setMaxPages(maxPages);
        properties.getSummary().setRequestsPerSecond(100);
        executor = Executors.newFixedThreadPool(2);
        MarketplaceHttpClient httpClient = new MarketplaceHttpClient(properties, executor);
        return new SummaryClient(properties, httpClient, new ObjectMapper());
    }
}
