package com.footballtransfers.infrastructure.config;

import com.footballtransfers.application.usecase.ScrapePlan;
import com.footballtransfers.domain.model.LeagueRef;
import com.footballtransfers.domain.model.Window;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransfersConfigTest {

    private static TransfersProperties props(List<TransfersProperties.League> leagues, List<Integer> seasons,
                                             List<String> windows) {
        return new TransfersProperties(null, null, null, null, leagues, seasons, windows, null, null, false, null);
    }

    @Test
    void testDefaults() {
        TransfersProperties props = props(null, null, null);

        assertEquals("https://www.transfermarkt.com", props.baseUrl());
        assertEquals(List.of(2024), props.seasons());
        assertEquals(List.of("summer", "winter"), props.windows());
        assertEquals(4, props.workerThreads());
        assertTrue(props.runOnStartup());
        assertEquals(Duration.ofSeconds(2), props.fetch().minDelay());
        assertEquals(Duration.ofSeconds(60), props.fetch().defaultCooldown());
    }

    @Test
    void testPlanFromProperties() {
        TransfersProperties.Club arsenal = new TransfersProperties.Club("fc-arsenal", "11", "Arsenal FC", List.of("Arsenal"));
        TransfersProperties props = props(
            List.of(new TransfersProperties.League("premier-league", "GB1", List.of(arsenal)),
                new TransfersProperties.League("laliga", "ES1", null)),
            List.of(2023, 2024, 2023),
            List.of("s", "WINTER", "summer"));

        ScrapePlan plan = TransfersConfig.toPlan(props);

        assertEquals(2, plan.leagues().size());
        LeagueRef premierLeague = plan.leagues().get(0);
        assertEquals("GB1", premierLeague.code());
        assertEquals("Arsenal FC", premierLeague.clubs().get(0).name());
        assertEquals(List.of("Arsenal"), premierLeague.clubs().get(0).aliases());
        assertTrue(plan.leagues().get(1).clubs().isEmpty());
        assertEquals(List.of(2023, 2024), plan.seasons());
        assertEquals(List.of(Window.SUMMER, Window.WINTER), plan.windows());
        assertFalse(plan.forcePartial());
    }

    @Test
    void testPlanNeedsALeague() {
        assertThrows(IllegalStateException.class, () -> TransfersConfig.toPlan(props(null, null, null)));
    }

    @Test
    void testUnknownWindowIsRejected() {
        TransfersProperties props = props(List.of(new TransfersProperties.League("premier-league", "GB1", null)),
            null, List.of("spring"));

        assertThrows(IllegalArgumentException.class, () -> TransfersConfig.toPlan(props));
    }
}
