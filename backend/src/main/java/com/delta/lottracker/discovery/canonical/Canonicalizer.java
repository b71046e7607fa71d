package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.config.DiscoveryProperties;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.RawRecord;
import com.delta.lottracker.discovery.model.SourceTag;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw channel payloads onto {@link Lot}. Pure: the same payload and timestamp always yield
 * the same lot, keyed by the marketplace lot id. Empty means the record had no identity.
 */
@Component
public class Canonicalizer {
    private final Map<SourceTag, RawLotMapper> mappers = new EnumMap<>(SourceTag.class);

    public Canonicalizer(DiscoveryProperties properties) {
        ZoneId zone = properties.zone();
        register(List.of(
            new SummaryLotMapper(zone, properties.getSummary().getLocationIds()),
            new SearchLotMapper(zone),
            new RenderedLotMapper(zone)
        ));
    }

    public Optional<Lot> canonicalize(RawRecord raw, Instant seenAt) {
        if (raw == null) {
            return Optional.empty();
        }
        return canonicalize(raw.payload(), raw.source(), seenAt);
    }

    public Optional<Lot> canonicalize(JsonNode payload, SourceTag source, Instant seenAt) {
        if (payload == null || !payload.isObject() || source == null || seenAt == null) {
            return Optional.empty();
        }
        return mappers.get(source).map(payload, seenAt);
    }

    private void register(List<RawLotMapper> all) {
        for (RawLotMapper mapper : all) {
            mappers.put(mapper.source(), mapper);
        }
    }
}
