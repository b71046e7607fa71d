package com.delta.lottracker.discovery.model;

import com.fasterxml.jackson.databind.JsonNode;

public record RawRecord(
    SourceTag source,
    JsonNode payload
) {
}
