package com.delta.lottracker.discovery.canonical;

import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.SourceTag;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

/**
 * Field mapping for one channel's payload. Empty when the payload carries no lot identity.
 */
interface RawLotMapper {
    SourceTag source();

    Optional<Lot> map(JsonNode payload, Instant seenAt);
}
