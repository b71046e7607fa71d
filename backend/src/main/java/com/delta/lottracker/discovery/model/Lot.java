package com.delta.lottracker.discovery.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Canonical lot record. Money values are normalized to two decimals so that records read back
 * from the store compare equal to the ones that were written.
 */
public record Lot(
    String id,
    String title,
    String category,
    String brand,
    String condition,
    String auctionId,
    Location location,
    BigDecimal retailPrice,
    BigDecimal currentBid,
    int bidCount,
    int uniqueBidders,
    boolean open,
    Instant closesAt,
    SourceTag bidSource,
    Instant bidObservedAt,
    Map<SourceTag, Instant> sourceSeen,
    double qualityScore,
    double opportunityScore
) {
    public Lot {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("lot id is required");
        }
        id = id.trim();
        location = location == null ? Location.UNKNOWN : location;
        retailPrice = normalizeRetail(retailPrice);
        currentBid = normalizeBid(currentBid);
        bidCount = Math.max(0, bidCount);
        uniqueBidders = Math.max(0, uniqueBidders);
        sourceSeen = copySeen(sourceSeen);
    }

    public Set<SourceTag> sources() {
        return sourceSeen.keySet();
    }

    public Instant lastSeen(SourceTag source) {
        return sourceSeen.get(source);
    }

    public Instant latestSeen() {
        Instant latest = null;
        for (Instant seen : sourceSeen.values()) {
            if (latest == null || seen.isAfter(latest)) {
                latest = seen;
            }
        }
        return latest;
    }

    public boolean hasNoBids() {
        return currentBid.signum() == 0 && bidCount == 0;
    }

    public Lot withScores(double quality, double opportunity) {
        return toBuilder().qualityScore(quality).opportunityScore(opportunity).build();
    }

    public Builder toBuilder() {
        return new Builder(id)
            .title(title)
            .category(category)
            .brand(brand)
            .condition(condition)
            .auctionId(auctionId)
            .location(location)
            .retailPrice(retailPrice)
            .currentBid(currentBid)
            .bidCount(bidCount)
            .uniqueBidders(uniqueBidders)
            .open(open)
            .closesAt(closesAt)
            .bidSource(bidSource)
            .bidObservedAt(bidObservedAt)
            .sourceSeen(sourceSeen)
            .qualityScore(qualityScore)
            .opportunityScore(opportunityScore);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    private static BigDecimal normalizeRetail(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return null;
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal normalizeBid(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static Map<SourceTag, Instant> copySeen(Map<SourceTag, Instant> seen) {
        EnumMap<SourceTag, Instant> copy = new EnumMap<>(SourceTag.class);
        if (seen != null) {
            seen.forEach((source, at) -> {
                if (source != null && at != null) {
                    copy.put(source, at);
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final String id;
        private String title;
        private String category;
        private String brand;
        private String condition;
        private String auctionId;
        private Location location = Location.UNKNOWN;
        private BigDecimal retailPrice;
        private BigDecimal currentBid;
        private int bidCount;
        private int uniqueBidders;
        private boolean open = true;
        private Instant closesAt;
        private SourceTag bidSource;
        private Instant bidObservedAt;
        private final Map<SourceTag, Instant> sourceSeen = new EnumMap<>(SourceTag.class);
        private double qualityScore;
        private double opportunityScore;

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder auctionId(String auctionId) {
            this.auctionId = auctionId;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder retailPrice(BigDecimal retailPrice) {
            this.retailPrice = retailPrice;
            return this;
        }

        public Builder currentBid(BigDecimal currentBid) {
            this.currentBid = currentBid;
            return this;
        }

        public Builder bidCount(int bidCount) {
            this.bidCount = bidCount;
            return this;
        }

        public Builder uniqueBidders(int uniqueBidders) {
            this.uniqueBidders = uniqueBidders;
            return this;
        }

        public Builder open(boolean open) {
            this.open = open;
            return this;
        }

        public Builder closesAt(Instant closesAt) {
            this.closesAt = closesAt;
            return this;
        }

        public Builder bidSource(SourceTag bidSource) {
            this.bidSource = bidSource;
            return this;
        }

        public Builder bidObservedAt(Instant bidObservedAt) {
            this.bidObservedAt = bidObservedAt;
            return this;
        }

        public Builder seen(SourceTag source, Instant at) {
            if (source != null && at != null) {
                this.sourceSeen.put(source, at);
            }
            return this;
        }

        public Builder sourceSeen(Map<SourceTag, Instant> seen) {
            this.sourceSeen.clear();
            if (seen != null) {
                seen.forEach(this::seen);
            }
            return this;
        }

        public Builder qualityScore(double qualityScore) {
            this.qualityScore = qualityScore;
            return this;
        }

        public Builder opportunityScore(double opportunityScore) {
            this.opportunityScore = opportunityScore;
            return this;
        }

        public Lot build() {
            return new Lot(
                id,
                title,
                category,
                brand,
                condition,
                auctionId,
                location,
                retailPrice,
                currentBid,
                bidCount,
                uniqueBidders,
                open,
                closesAt,
                bidSource,
                bidObservedAt,
                sourceSeen,
                qualityScore,
                opportunityScore
            );
        }
    }
}
