package com.delta.lottracker.discovery.api;

import com.delta.lottracker.discovery.model.Location;
import com.delta.lottracker.discovery.model.Lot;
import com.delta.lottracker.discovery.model.SourceTag;
import com.delta.lottracker.discovery.persistence.LotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class LotControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private LotStore lotStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void lotDetailReturnsCanonicalRecord() throws Exception {
        String id = "c-" + UUID.randomUUID().toString().substring(0, 10);
        lotStore.upsert(lot(id, Location.ROCK_HILL, Instant.now().plus(1, ChronoUnit.DAYS)));

        mockMvc.perform(get("/api/lots/{lotId}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id))
            .andExpect(jsonPath("$.location").value("ROCK_HILL"))
            .andExpect(jsonPath("$.open").value(true))
            .andExpect(jsonPath("$.bidSource").value("SUMMARY"))
            .andExpect(jsonPath("$.sourceSeen.SUMMARY").exists());
    }

    @Test
    void unknownLotIsNotFound() throws Exception {
        mockMvc.perform(get("/api/lots/{lotId}", "missing-" + UUID.randomUUID()))
            .andExpect(status().isNotFound());
    }

    @Test
    void listFiltersByLocationAndCloseWindow() throws Exception {
        Instant window = Instant.parse("2098-03-01T00:00:00Z");
        String greenville = "c-" + UUID.randomUUID().toString().substring(0, 10);
        String anderson = "c-" + UUID.randomUUID().toString().substring(0, 10);
        lotStore.upsert(lot(greenville, Location.GREENVILLE, window.plusSeconds(60)));
        lotStore.upsert(lot(anderson, Location.ANDERSON, window.plusSeconds(60)));

        mockMvc.perform(get("/api/lots")
                .param("location", "greenville")
                .param("closesAfter", window.toString())
                .param("closesBefore", window.plusSeconds(3600).toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].id").value(greenville));
    }

    @Test
    void malformedFiltersAreRejected() throws Exception {
        mockMvc.perform(get("/api/lots").param("closesAfter", "tomorrow"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/lots").param("location", "Charlotte"))
            .andExpect(status().isBadRequest());
    }

    private static Lot lot(String id, Location location, Instant closesAt) {
        Instant seen = Instant.now().truncatedTo(ChronoUnit.MICROS);
        return Lot.builder(id)
            .title("Lot " + id)
            .location(location)
            .retailPrice(new BigDecimal("120.00"))
            .currentBid(new BigDecimal("8.00"))
            .bidCount(2)
            .uniqueBidders(2)
            .bidSource(SourceTag.SUMMARY)
            .bidObservedAt(seen)
            .closesAt(closesAt)
            .seen(SourceTag.SUMMARY, seen)
            .build();
    }
}
