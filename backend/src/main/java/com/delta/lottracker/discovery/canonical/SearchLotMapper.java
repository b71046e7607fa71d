package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.discovery.model.SourceTag;

import java.time.ZoneId;
import java.util.List;

class SearchLotMapper extends AbstractLotMapper {
    SearchLotMapper(ZoneId zone) {
        super(zone);
    }

    @Override
    public SourceTag source() {
        return SourceTag.SEARCH;
    }

    @Override
    protected List<String> titleKeys() {
        return List.of("product_name", "title", "description");
    }

    @Override
    protected List<String> closesAtKeys() {
        return List.of("expected_close_date", "closing_date");
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
