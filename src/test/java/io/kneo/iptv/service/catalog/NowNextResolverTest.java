package io.kneo.iptv.service.catalog;

import io.kneo.iptv.model.Channel;
import io.kneo.iptv.model.GuideData;
import io.kneo.iptv.model.NowNext;
import io.kneo.iptv.model.Programme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NowNextResolverTest {

    private static final Programme MORNING = programme("news", "Morning", "2024-01-01T09:00:00Z", "2024-01-01T12:00:00Z");
    private static final Programme NOON = programme("news", "Noon", "2024-01-01T12:00:00Z", "2024-01-01T13:00:00Z");
    private static final Programme EVENING = programme("news", "Evening", "2024-01-01T18:00:00Z", "2024-01-01T19:00:00Z");

    private CatalogIndex index;
    private NowNextResolver resolver;

    @BeforeEach
    void setUp() {
        index = new CatalogIndex();
        index.publishGuide(new GuideData(Map.of("news", List.of(MORNING, NOON, EVENING)), Map.of("news channel", "news")));
        resolver = new NowNextResolver(index);
    }

    @Test
    void resolvesCurrentAndNext() {
        NowNext result = resolver.resolve("news", Instant.parse("2024-01-01T10:15:00Z"));

        assertEquals("Morning", result.current().orElseThrow().title());
        assertEquals("Noon", result.next().orElseThrow().title());
    }

    @Test
    void startIsInclusiveStopIsExclusive() {
        NowNext atNoon = resolver.resolve("news", Instant.parse("2024-01-01T12:00:00Z"));

        assertEquals("Noon", atNoon.current().orElseThrow().title());
        assertEquals("Evening", atNoon.next().orElseThrow().title());
    }

    @Test
    void lastProgrammeHasNoNext() {
        NowNext result = resolver.resolve("news", Instant.parse("2024-01-01T18:30:00Z"));

        assertEquals("Evening", result.current().orElseThrow().title());
        assertFalse(result.next().isPresent());
    }

    @Test
    void gapYieldsOnlyUpcomingProgramme() {
        NowNext result = resolver.resolve("news", Instant.parse("2024-01-01T15:00:00Z"));

        assertFalse(result.current().isPresent());
        assertEquals("Evening", result.next().orElseThrow().title());
    }

    @Test
    void beforeFirstAndAfterLast() {
        NowNext early = resolver.resolve("news", Instant.parse("2024-01-01T06:00:00Z"));
        assertFalse(early.current().isPresent());
        assertEquals("Morning", early.next().orElseThrow().title());

        NowNext late = resolver.resolve("news", Instant.parse("2024-01-02T00:00:00Z"));
        assertEquals(NowNext.none(), late);
    }

    @Test
    void unknownGuideIdResolvesToNothing() {
        NowNext result = resolver.resolve("missing", Instant.parse("2024-01-01T10:15:00Z"));

        assertFalse(result.current().isPresent());
        assertFalse(result.next().isPresent());
    }

    @Test
    void currentAlwaysContainsInstant() {
        Instant asOf = Instant.parse("2024-01-01T09:00:00Z");
        for (int minutes = 0; minutes < 600; minutes += 7) {
            Instant at = asOf.plusSeconds(minutes * 60L);
            resolver.resolve("news", at).current()
                    .ifPresent(p -> assertTrue(p.isAiringAt(at), p.title() + " at " + at));
        }
    }

    @Test
    void channelFallsBackToDisplayName() {
        Channel channel = new Channel("iptv:0", "News Channel", null, "News", "http://a/1",
                "News Channel", null, null, null);

        NowNext result = resolver.resolve(index.current(), channel, Instant.parse("2024-01-01T10:15:00Z"));

        assertEquals("Morning", result.current().orElseThrow().title());
    }

    private static Programme programme(String guideId, String title, String start, String stop) {
        return new Programme(guideId, title, null, null, Instant.parse(start), Instant.parse(stop));
    }
}
