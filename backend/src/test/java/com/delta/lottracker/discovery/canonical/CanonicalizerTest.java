package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SourceTag;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CanonicalizerTest {
    private static final Instant SEEN_AT = Instant.parse("2026-05-01T12:00:00Z");
    private static final Instant CLOSES_AT = Instant.parse("2026-05-02T23:30:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Canonicalizer canonicalizer = new Canonicalizer(properties());

    @Test
    void mapsSummaryRow() throws Exception {
        JsonNode row = fixture("summary-page.json").path("data").path(0);

        Lot lot = canonicalizer.canonicalize(new RawRecord(SourceTag.SUMMARY, row), SEEN_AT).orElseThrow();

        assertThat(lot.id()).isEqualTo("48213377");
        assertThat(lot.title()).isEqualTo("DEWALT 20V MAX Cordless Drill Kit");
        assertThat(lot.condition()).isEqualTo("Appears New");
        assertThat(lot.auctionId()).isEqualTo("91822");
        assertThat(lot.location()).isEqualTo(Location.ROCK_HILL);
        assertThat(lot.retailPrice()).isEqualByComparingTo("179.00");
        assertThat(lot.currentBid()).isEqualByComparingTo("12.50");
        assertThat(lot.bidCount()).isEqualTo(4);
        assertThat(lot.uniqueBidders()).isEqualTo(3);
        assertThat(lot.open()).isTrue();
        // local close time in the marketplace zone
        assertThat(lot.closesAt()).isEqualTo(CLOSES_AT);
        assertThat(lot.bidSource()).isEqualTo(SourceTag.SUMMARY);
        assertThat(lot.bidObservedAt()).isEqualTo(SEEN_AT);
        assertThat(lot.lastSeen(SourceTag.SUMMARY)).isEqualTo(SEEN_AT);
    }

    @Test
    void resolvesSummaryLocationFromNumericId() throws Exception {
        JsonNode row = fixture("summary-page.json").path("data").path(1);

        Lot lot = canonicalizer.canonicalize(row, SourceTag.SUMMARY, SEEN_AT).orElseThrow();

        assertThat(lot.location()).isEqualTo(Location.GASTONIA);
        assertThat(lot.hasNoBids()).isTrue();
    }

    @Test
    void rowWithoutIdentifierIsUnmappable() throws Exception {
        JsonNode row = fixture("summary-page.json").path("data").path(2);

        assertThat(canonicalizer.canonicalize(row, SourceTag.SUMMARY, SEEN_AT)).isEmpty();
    }

    @Test
    void mapsSearchDocuments() throws Exception {
        JsonNode hits = fixture("search-response.json").path("results").path(0).path("hits");

        Lot drill = canonicalizer.canonicalize(hits.path(0).path("document"), SourceTag.SEARCH, SEEN_AT).orElseThrow();
        Lot dresser = canonicalizer.canonicalize(hits.path(1).path("document"), SourceTag.SEARCH, SEEN_AT).orElseThrow();

        assertThat(drill.id()).isEqualTo("48213377");
        assertThat(drill.location()).isEqualTo(Location.ROCK_HILL);
        assertThat(drill.closesAt()).isEqualTo(CLOSES_AT);
        assertThat(drill.bidSource()).isEqualTo(SourceTag.SEARCH);

        assertThat(dresser.id()).isEqualTo("48213411");
        assertThat(dresser.location()).isEqualTo(Location.GREENVILLE);
        assertThat(dresser.closesAt()).isEqualTo(Instant.ofEpochMilli(1777850000000L));
        assertThat(dresser.bidSource()).isNull();
        assertThat(dresser.hasNoBids()).isTrue();
    }

    @Test
    void mapsCamelCaseRenderedLot() throws Exception {
        JsonNode lotNode = objectMapper.readTree("""
            {"lot_id":"48213377","productName":"DEWALT 20V MAX Cordless Drill Kit","currentBid":"15.00",
             "totalBids":6,"uniqueBidders":4,"isOpen":false,"expectedCloseDate":"2026-05-02T23:30:00Z"}
            """);

        Lot lot = canonicalizer.canonicalize(lotNode, SourceTag.RENDERED, SEEN_AT).orElseThrow();

        assertThat(lot.title()).isEqualTo("DEWALT 20V MAX Cordless Drill Kit");
        assertThat(lot.currentBid()).isEqualByComparingTo("15.00");
        assertThat(lot.bidCount()).isEqualTo(6);
        assertThat(lot.uniqueBidders()).isEqualTo(4);
        assertThat(lot.open()).isFalse();
        assertThat(lot.closesAt()).isEqualTo(CLOSES_AT);
        assertThat(lot.location()).isEqualTo(Location.UNKNOWN);
    }

    @Test
    void sameLotFromEveryChannelSharesIdentity() throws Exception {
        JsonNode summaryRow = fixture("summary-page.json").path("data").path(0);
        JsonNode searchDoc = fixture("search-response.json").path("results").path(0).path("hits").path(0).path("document");
        JsonNode renderedLot = objectMapper.readTree("{\"id\":48213377,\"title\":\"Drill\"}");

        Optional<Lot> fromSummary = canonicalizer.canonicalize(summaryRow, SourceTag.SUMMARY, SEEN_AT);
        Optional<Lot> fromSearch = canonicalizer.canonicalize(searchDoc, SourceTag.SEARCH, SEEN_AT);
        Optional<Lot> fromRendered = canonicalizer.canonicalize(renderedLot, SourceTag.RENDERED, SEEN_AT);

        assertThat(fromSummary).map(Lot::id).contains("48213377");
        assertThat(fromSearch).map(Lot::id).contains("48213377");
        assertThat(fromRendered).map(Lot::id).contains("48213377");
    }

    @Test
    void canonicalizationIsPure() throws Exception {
        JsonNode row = fixture("summary-page.json").path("data").path(0);

        assertThat(canonicalizer.canonicalize(row, SourceTag.SUMMARY, SEEN_AT))
            .isEqualTo(canonicalizer.canonicalize(row, SourceTag.SUMMARY, SEEN_AT));
    }

    @Test
    void nonObjectPayloadIsUnmappable() throws Exception {
        assertThat(canonicalizer.canonicalize(objectMapper.readTree("[1,2]"), SourceTag.SEARCH, SEEN_AT)).isEmpty();
        assertThat(canonicalizer.canonicalize((RawRecord) null, SEEN_AT)).isEmpty();
    }

    @Test
    void valuesTheLotTableCannotHoldAreDropped() throws Exception {
        JsonNode row = objectMapper.readTree(
            "{\"lot_id\":\"900\",\"retail_price\":99999999999,\"current_bid\":5,\"total_bids\":99999999999}");

        Lot lot = canonicalizer.canonicalize(row, SourceTag.SUMMARY, SEEN_AT).orElseThrow();

        assertThat(lot.retailPrice()).isNull();
        assertThat(lot.currentBid()).isEqualByComparingTo("5");
        assertThat(lot.bidCount()).isZero();
    }

    @Test
    void overlongIdentifierIsUnmappable() throws Exception {
        JsonNode row = objectMapper.readTree("{\"lot_id\":\"" + "9".repeat(65) + "\",\"retail_price\":10}");

        assertThat(canonicalizer.canonicalize(row, SourceTag.SUMMARY, SEEN_AT)).isEmpty();
    }

    private JsonNode fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return objectMapper.readTree(in);
        }
    }

    private static DiscoveryProperties properties() {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.getSummary().setLocationIds(Map.of(34, "Gastonia - A", 20, "Greenville - N"));
        return properties;
    }
}
