package com.delta.lottracker.discovery.model;

public record LotUpsertResult(
    Lot lot,
    boolean created,
    boolean bidChanged
) {
}
