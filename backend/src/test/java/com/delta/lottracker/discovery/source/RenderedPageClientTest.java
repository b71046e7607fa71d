package com.delta.lottracker.discovery.source;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.augment.StaticAuthSession;
import com.delta.lottracker.discovery.http.MarketplaceHttpClient;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.RenderedCursor;
import com.delta.lottracker.discovery.model.SourcePage;
import com.delta.lottracker.discovery.model.SourceTag;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderedPageClientTest {
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
    void extractsLotFromEmbeddedDataBlock() throws Exception {
        startServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "text/html; charset=utf-8")
            .setBody(fixture("rendered-lot.html")));
        RenderedPageClient client = newClient();

        RawRecord record = client.fetchLot("48213377", new StaticAuthSession("sid=abc", null));

        assertThat(record.source()).isEqualTo(SourceTag.RENDERED);
        assertThat(record.payload().path("lot_id").asText()).isEqualTo("48213377");
        assertThat(record.payload().path("currentBid").asText()).isEqualTo("15.00");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/lot/48213377");
        assertThat(request.getHeader("Cookie")).isEqualTo("sid=abc");
    }

    @Test
    void readsJsonDataRoute() throws Exception {
        startServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "application/json")
            .setBody("{\"pageProps\":{\"activeLot\":{\"id\":\"77\",\"currentBid\":3}}}"));
        RenderedPageClient client = newClient();

        RawRecord record = client.fetchLot("77", null);

        assertThat(record.payload().path("id").asText()).isEqualTo("77");
        assertThat(record.payload().has("lot_id")).isFalse();
    }

    @Test
    void pageWithoutDataBlockIsDegraded() throws Exception {
        startServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("rendered-lot-no-data.html")));
        RenderedPageClient client = newClient();

        assertThatThrownBy(() -> client.fetchLot("48213377", null))
            .isInstanceOfSatisfying(DegradedPayloadException.class,
                e -> assertThat(e.lotId()).isEqualTo("48213377"));
    }

    @Test
    void rejectedSessionSurfacesAsAuthFailure() throws Exception {
        startServer();
        server.enqueue(new MockResponse().setResponseCode(401));
        RenderedPageClient client = newClient();

        assertThatThrownBy(() -> client.fetchLot("48213377", new StaticAuthSession("sid=expired", null)))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> assertThat(e.isAuthRejected()).isTrue());
    }

    @Test
    void seedWalkSkipsDegradedPagesAndContinues() throws Exception {
        startServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("rendered-lot-no-data.html")));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("rendered-lot.html")));
        RenderedPageClient client = newClient();

        SourcePage<RenderedCursor> first = client.fetchPage(new RenderedCursor(List.of("1", "48213377"), 0));
        SourcePage<RenderedCursor> second = client.fetchPage(first.nextCursor());

        assertThat(first.records()).isEmpty();
        assertThat(first.hasMore()).isTrue();
        assertThat(second.records()).hasSize(1);
        assertThat(second.hasMore()).isFalse();
    }

    @Test
    void seedWalkSkipsMissingLotAndFetchesTheNext() throws Exception {
        startServer();
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(fixture("rendered-lot.html")));
        RenderedPageClient client = newClient();

        SourcePage<RenderedCursor> first = client.fetchPage(new RenderedCursor(List.of("gone", "48213377"), 0));
        SourcePage<RenderedCursor> second = client.fetchPage(first.nextCursor());

        assertThat(first.records()).isEmpty();
        assertThat(first.hasMore()).isTrue();
        assertThat(second.records()).hasSize(1);
        assertThat(second.records().get(0).payload().path("lot_id").asText()).isEqualTo("48213377");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/lot/gone");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/lot/48213377");
    }

    @Test
    void seedWalkStopsWhenPagesRequireAuth() throws Exception {
        startServer();
        server.enqueue(new MockResponse().setResponseCode(403));
        RenderedPageClient client = newClient();

        assertThatThrownBy(() -> client.fetchPage(new RenderedCursor(List.of("1", "2"), 0)))
            .isInstanceOfSatisfying(SourceFetchException.class, e -> assertThat(e.isAuthRejected()).isTrue());
    }

    @Test
    void encodesLotIdIntoPath() throws Exception {
        startServer();
        RenderedPageClient client = newClient();

        assertThat(client.lotUrl(" a b/c ")).endsWith("/lot/a+b%2Fc");
    }

    private void startServer() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    private RenderedPageClient newClient() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setMaxAttempts(1);
        properties.getRendered().setBaseUrl(server.url("/").toString());
        properties.getRendered().setRequestsPerSecond(100);
        executor = Executors.newFixedThreadPool(2);
        return new RenderedPageClient(properties, new MarketplaceHttpClient(properties, executor), new ObjectMapper());
    }

    private String fixture(String name) throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
