package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

abstract class AbstractLotMapper implements RawLotMapper {
    static final List<String> ID_KEYS = List.of("lot_id", "id", "mac_lot_id", "inventory_id");
    static final List<String> RETAIL_KEYS = List.of("retail_price", "retailPrice", "msrp");
    static final List<String> OPEN_KEYS = List.of("is_open", "isOpen", "open");
    static final List<String> CATEGORY_KEYS = List.of("category", "category_name");
    static final List<String> BRAND_KEYS = List.of("brand", "detected_brand");
    static final List<String> CONDITION_KEYS = List.of("condition", "condition_name");
    static final List<String> AUCTION_KEYS = List.of("auction_id", "auctionId", "auction_number");
    static final List<String> LOCATION_KEYS = List.of("auction_location", "location_name", "location", "warehouse");

    // NUMERIC(12, 2) and VARCHAR(64) columns of the lots table
    static final BigDecimal MAX_MONEY = new BigDecimal("9999999999.99");
    static final int MAX_ID_LENGTH = 64;

    protected final ZoneId zone;

    protected AbstractLotMapper(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public Optional<Lot> map(JsonNode payload, Instant seenAt) {
        String id = JsonFields.text(payload, ID_KEYS);
        if (id == null || id.length() > MAX_ID_LENGTH) {
            return Optional.empty();
        }
        Boolean open = JsonFields.bool(payload, OPEN_KEYS);
        Lot.Builder builder = Lot.builder(id)
            .title(JsonFields.text(payload, titleKeys()))
            .category(JsonFields.text(payload, CATEGORY_KEYS))
            .brand(JsonFields.text(payload, BRAND_KEYS))
            .condition(JsonFields.text(payload, CONDITION_KEYS))
            .auctionId(JsonFields.text(payload, AUCTION_KEYS))
            .location(location(payload))
            .retailPrice(money(payload, RETAIL_KEYS))
            .open(open == null || open)
            .closesAt(JsonFields.instant(payload, closesAtKeys(), zone))
            .seen(source(), seenAt);

        BigDecimal currentBid = money(payload, bidKeys());
        Integer bidCount = JsonFields.integer(payload, bidCountKeys());
        Integer uniqueBidders = JsonFields.integer(payload, uniqueBidderKeys());
        if (currentBid != null || bidCount != null || uniqueBidders != null) {
            builder.currentBid(currentBid)
                .bidCount(bidCount == null ? 0 : bidCount)
                .uniqueBidders(uniqueBidders == null ? 0 : uniqueBidders)
                .bidSource(source())
                .bidObservedAt(seenAt);
        }
        return Optional.of(builder.build());
    }

    // Amounts the lots table cannot hold are read as absent.
    private static BigDecimal money(JsonNode payload, List<String> keys) {
        BigDecimal value = JsonFields.decimal(payload, keys);
        if (value == null || value.compareTo(MAX_MONEY) > 0) {
            return null;
        }
        return value;
    }

    protected Location location(JsonNode payload) {
        return Location.fromLabel(JsonFields.text(payload, LOCATION_KEYS));
    }

    protected abstract List<String> titleKeys();

    protected abstract List<String> closesAtKeys();

    protected abstract List<String> bidKeys();

    protected abstract List<String> bidCountKeys();

    protected abstract List<String> uniqueBidderKeys();
}
