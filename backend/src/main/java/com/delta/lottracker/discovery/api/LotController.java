package com.delta.lottracker.discovery.api;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.LotQuery;
import com.delta.lottracker.discovery.persistence.LotStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/lots")
public class LotController {
    private final LotStore lotStore;

    public LotController(LotStore lotStore) {
        this.lotStore = lotStore;
    }

    @GetMapping
    public List<Lot> listLots(
        @RequestParam(name = "open", required = false, defaultValue = "true") Boolean open,
        @RequestParam(name = "location", required = false) List<String> locations,
        @RequestParam(name = "closesAfter", required = false) String closesAfter,
        @RequestParam(name = "closesBefore", required = false) String closesBefore,
        @RequestParam(name = "minScore", required = false) Double minScore,
        @RequestParam(name = "minRetail", required = false) BigDecimal minRetail,
        @RequestParam(name = "maxBid", required = false) BigDecimal maxBid,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        LotQuery query = new LotQuery(
            open,
            parseLocations(locations),
            parseInstant("closesAfter", closesAfter),
            parseInstant("closesBefore", closesBefore),
            minScore,
            minRetail,
            maxBid,
            limit
        );
        return lotStore.query(query);
    }

    @GetMapping("/{lotId}")
    public Lot getLot(@PathVariable("lotId") String lotId) {
        return lotStore.get(lotId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "lot not found: " + lotId));
    }

    private Set<Location> parseLocations(List<String> raw) {
        Set<Location> locations = EnumSet.noneOf(Location.class);
        if (raw == null) {
            return locations;
        }
        for (String value : raw) {
            if (value == null || value.isBlank()) {
                continue;
            }
            Location location = Location.fromLabel(value);
            if (location == Location.UNKNOWN && !"unknown".equalsIgnoreCase(value.trim())) {
                throw new ResponseStatusException(BAD_REQUEST, "unknown location: " + value);
            }
            locations.add(location);
        }
        return locations;
    }

    private Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, name + " must be an ISO-8601 instant");
        }
    }
}
