package com.delta.lottracker.discovery.scoring;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.SourceTag;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;

/**
 * Deterministic lot scores.
 *
 * <p>Opportunity (0..1): {@code wD * discount + wS * 1/(1 + uniqueBidders) + wN * noBid}, clamped,
 * where discount is {@code 1 - currentBid / retailPrice} clamped to 0..1 and 0 without a retail
 * price. Closed lots score 0.
 *
 * <p>Quality (0..100): 20 per contributing channel, 5 per essential field present (title, retail
 * price, location, close time), and up to 20 for recent rendered bid data.
 */
@Component
public class LotScorer {
    private static final int POINTS_PER_SOURCE = 20;
    private static final int POINTS_PER_FIELD = 5;
    private static final int FRESH_RENDERED_POINTS = 20;
    private static final int AGING_RENDERED_POINTS = 10;

    private final DiscoveryProperties properties;

    public LotScorer(DiscoveryProperties properties) {
        this.properties = properties;
    }

    public double opportunityScore(Lot lot) {
        if (lot == null || !lot.open()) {
            return 0.0;
        }
        DiscoveryProperties.Scoring weights = properties.getScoring();
        double score = weights.getDiscountWeight() * discount(lot)
            + weights.getScarcityWeight() * (1.0 / (1.0 + lot.uniqueBidders()))
            + weights.getNoBidWeight() * (lot.hasNoBids() ? 1.0 : 0.0);
        return clamp(score, 0.0, 1.0);
    }

    public double qualityScore(Lot lot, Instant now) {
        if (lot == null) {
            return 0.0;
        }
        int points = POINTS_PER_SOURCE * lot.sources().size();
        if (lot.title() != null && !lot.title().isBlank()) {
            points += POINTS_PER_FIELD;
        }
        if (lot.retailPrice() != null && lot.retailPrice().signum() > 0) {
            points += POINTS_PER_FIELD;
        }
        if (lot.location() != Location.UNKNOWN) {
            points += POINTS_PER_FIELD;
        }
        if (lot.closesAt() != null) {
            points += POINTS_PER_FIELD;
        }
        Instant rendered = lot.lastSeen(SourceTag.RENDERED);
        if (rendered != null && now != null) {
            Duration age = Duration.between(rendered, now);
            Duration freshness = properties.getAugment().freshness();
            if (age.compareTo(freshness) <= 0) {
                points += FRESH_RENDERED_POINTS;
            } else if (age.compareTo(freshness.multipliedBy(4)) <= 0) {
                points += AGING_RENDERED_POINTS;
            }
        }
        return clamp(points, 0.0, 100.0);
    }

    public Lot score(Lot lot, Instant now) {
        return lot.withScores(qualityScore(lot, now), opportunityScore(lot));
    }

    static double discount(Lot lot) {
        BigDecimal retail = lot.retailPrice();
        if (retail == null || retail.signum() <= 0) {
            return 0.0;
        }
        double ratio = lot.currentBid().divide(retail, MathContext.DECIMAL64).doubleValue();
        return clamp(1.0 - ratio, 0.0, 1.0);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
