package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.SourceTag;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Summary API rows. Warehouses often arrive only as a numeric {@code location_id}.
 */
class SummaryLotMapper extends AbstractLotMapper {
    private final Map<Integer, String> locationIds;

    SummaryLotMapper(ZoneId zone, Map<Integer, String> locationIds) {
        super(zone);
        this.locationIds = locationIds == null ? Map.of() : Map.copyOf(locationIds);
    }

    @Override
    public SourceTag source() {
        return SourceTag.SUMMARY;
    }

    @Override
    protected Location location(JsonNode payload) {
        Location byLabel = super.location(payload);
        if (byLabel != Location.UNKNOWN) {
            return byLabel;
        }
        Integer locationId = JsonFields.integer(payload, List.of("location_id"));
        return locationId == null ? Location.UNKNOWN : Location.fromLabel(locationIds.get(locationId));
    }

    @Override
    protected List<String> titleKeys() {
        return List.of("product_name", "title", "auction_title");
    }

    @Override
    protected List<String> closesAtKeys() {
        return List.of("expected_close_date", "closing_date", "close_date");
    }

    @Override
    protected List<String> bidKeys() {
        return List.of("current_bid");
    }

    @Override
    protected List<String> bidCountKeys() {
        return List.of("total_bids", "bid_count");
    }

    @Override
    protected List<String> uniqueBidderKeys() {
        return List.of("unique_bidders");
    }
}
