package com.delta.lottracker.discovery.augment;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.canonical.Canonicalizer;
import com.delta.lottracker.discovery.http.SourceFetchException;
import com.delta.lottracker.discovery.model.AugmentOutcome;
import com.delta.lottracker.discovery.model.FailureClass;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.LotUpsertResult;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.persistence.LotStore;
import com.delta.lottracker.discovery.source.DegradedPayloadException;
import com.delta.lottracker.discovery.source.RenderedPageClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BidAugmenterTest {
    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    @Mock
    private RenderedPageClient renderedPageClient;
    @Mock
    private LotStore lotStore;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AuthSession session = new StaticAuthSession("sid=abc", null);
    private BidAugmenter augmenter;

    @BeforeEach
    void setUp() {
        DiscoveryProperties properties = new DiscoveryProperties();
        augmenter = new BidAugmenter(
            renderedPageClient,
            new Canonicalizer(properties),
            lotStore,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void refreshesBidFromRenderedPage() throws Exception {
        Lot lot = openLot("42");
        when(renderedPageClient.fetchLot("42", session)).thenReturn(rendered("{\"lot_id\":\"42\",\"currentBid\":\"18.00\",\"totalBids\":5}"));
        when(lotStore.upsert(any(Lot.class))).thenAnswer(invocation -> new LotUpsertResult(invocation.getArgument(0), false, true));

        AugmentOutcome outcome = augmenter.augment(lot, session);

        assertThat(outcome).isEqualTo(AugmentOutcome.UPDATED);
        ArgumentCaptor<Lot> captor = ArgumentCaptor.forClass(Lot.class);
        verify(lotStore).upsert(captor.capture());
        Lot refreshed = captor.getValue();
        assertThat(refreshed.currentBid()).isEqualByComparingTo("18.00");
        assertThat(refreshed.bidSource()).isEqualTo(SourceTag.RENDERED);
        assertThat(refreshed.bidObservedAt()).isEqualTo(NOW);
        assertThat(refreshed.lastSeen(SourceTag.RENDERED)).isEqualTo(NOW);
    }

    @Test
    void unchangedBidIsReported() throws Exception {
        when(renderedPageClient.fetchLot("42", session)).thenReturn(rendered("{\"lot_id\":\"42\",\"currentBid\":\"0\"}"));
        when(lotStore.upsert(any(Lot.class))).thenAnswer(invocation -> new LotUpsertResult(invocation.getArgument(0), false, false));

        assertThat(augmenter.augment(openLot("42"), session)).isEqualTo(AugmentOutcome.UNCHANGED);
    }

    @Test
    void freshOrClosedLotsAreSkipped() {
        Lot fresh = openLot("42").toBuilder().seen(SourceTag.RENDERED, NOW.minus(Duration.ofMinutes(2))).build();
        Lot closed = openLot("43").toBuilder().open(false).build();

        assertThat(augmenter.augment(fresh, session)).isEqualTo(AugmentOutcome.SKIPPED);
        assertThat(augmenter.augment(closed, session)).isEqualTo(AugmentOutcome.SKIPPED);
        verifyNoInteractions(renderedPageClient, lotStore);
    }

    @Test
    void invalidSessionIsRejectedBeforeFetching() {
        assertThatThrownBy(() -> augmenter.augment(openLot("42"), new StaticAuthSession(" ", null)))
            .isInstanceOf(SessionExpiredException.class);
        verifyNoInteractions(renderedPageClient);
    }

    @Test
    void authRejectionExpiresSession() {
        when(renderedPageClient.fetchLot(eq("42"), any()))
            .thenThrow(new SourceFetchException(SourceTag.RENDERED, FailureClass.PERMANENT, 403, "HTTP_401_403", "forbidden"));

        assertThatThrownBy(() -> augmenter.augment(openLot("42"), session))
            .isInstanceOf(SessionExpiredException.class);
        verifyNoInteractions(lotStore);
    }

    @Test
    void degradedPageKeepsExistingBidState() {
        when(renderedPageClient.fetchLot(eq("42"), any())).thenThrow(new DegradedPayloadException("42", "no data block"));

        assertThat(augmenter.augment(openLot("42"), session)).isEqualTo(AugmentOutcome.DEGRADED);
        verifyNoInteractions(lotStore);
    }

    @Test
    void transportFailureIsReportedAsFailed() {
        when(renderedPageClient.fetchLot(eq("42"), any()))
            .thenThrow(new SourceFetchException(SourceTag.RENDERED, FailureClass.RETRYABLE, 503, "HTTP_5XX", "busy"));

        assertThat(augmenter.augment(openLot("42"), session)).isEqualTo(AugmentOutcome.FAILED);
    }

    @Test
    void payloadForAnotherLotIsDegraded() throws Exception {
        when(renderedPageClient.fetchLot("42", session)).thenReturn(rendered("{\"lot_id\":\"99\",\"currentBid\":\"1\"}"));

        assertThat(augmenter.augment(openLot("42"), session)).isEqualTo(AugmentOutcome.DEGRADED);
        verifyNoInteractions(lotStore);
    }

    private RawRecord rendered(String json) throws Exception {
        return new RawRecord(SourceTag.RENDERED, objectMapper.readTree(json));
    }

    private static Lot openLot(String id) {
        return Lot.builder(id)
            .title("Lot " + id)
            .retailPrice(new BigDecimal("50"))
            .seen(SourceTag.SUMMARY, NOW.minus(Duration.ofHours(1)))
            .build();
    }
}
