package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.discovery.model.SourceTag;

import java.time.ZoneId;
import java.util.List;

/**
 * Lot object from the page's embedded data block; keys come in both snake and camel case.
 */
class RenderedLotMapper extends AbstractLotMapper {
    RenderedLotMapper(ZoneId zone) {
        super(zone);
    }

    @Override
    public SourceTag source() {
        return SourceTag.RENDERED;
    }

    @Override
    protected List<String> titleKeys() {
        return List.of("product_name", "productName", "title", "name");
    }

    @Override
    protected List<String> closesAtKeys() {
        return List.of("expected_close_date", "expectedCloseDate", "closing_date", "closesAt");
    }

    @Override
    protected List<String> bidKeys() {
        return List.of("current_bid", "currentBid", "high_bid");
    }

    @Override
    protected List<String> bidCountKeys() {
        return List.of("total_bids", "totalBids", "bid_count", "bidCount");
    }

    @Override
    protected List<String> uniqueBidderKeys() {
        return List.of("unique_bidders", "uniqueBidders");
    }
}
