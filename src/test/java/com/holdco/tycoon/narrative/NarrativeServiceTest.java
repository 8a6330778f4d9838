package com.holdco.tycoon.narrative;

import com.holdco.tycoon.event.EventType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NarrativeServiceTest {

    private static final NarrativeContext CONTEXT =
        new NarrativeContext(4, "Client Signs", "Summit Digital Marketing", "Marketing Agency", 2500, 1800);

    @ParameterizedTest
    @EnumSource(EventType.class)
    void testEveryEventHasTemplate(EventType type) {
        String text = NarrativeService.template(type, CONTEXT);
        assertNotNull(text);
        assertTrue(text.startsWith("Year 4: "), text);
        assertTrue(text.length() > "Year 4: ".length());
    }

    @Test
    void testTemplateNamesBusiness() {
        String text = NarrativeService.template(EventType.PORTFOLIO_CLIENT_SIGNS, CONTEXT);
        assertTrue(text.contains("Summit Digital Marketing"), text);
    }

    @Test
    void testTemplatesOnly() {
        NarrativeService service = NarrativeService.templatesOnly();
        assertEquals(NarrativeService.template(EventType.GLOBAL_QUIET, CONTEXT),
            service.narrate(EventType.GLOBAL_QUIET, CONTEXT));
    }

    @Test
    void testSourceTextPreferred() {
        NarrativeService service = new NarrativeService((type, ctx) -> Optional.of("A vivid story."));
        assertEquals("A vivid story.", service.narrate(EventType.GLOBAL_RECESSION, CONTEXT));
    }

    @Test
    void testFallbackOnEmptyOrBlank() {
        String expected = NarrativeService.template(EventType.GLOBAL_RECESSION, CONTEXT);

        assertEquals(expected, new NarrativeService((type, ctx) -> Optional.empty())
            .narrate(EventType.GLOBAL_RECESSION, CONTEXT));
        assertEquals(expected, new NarrativeService((type, ctx) -> Optional.of("   "))
            .narrate(EventType.GLOBAL_RECESSION, CONTEXT));
        assertEquals(expected, new NarrativeService((type, ctx) -> null)
            .narrate(EventType.GLOBAL_RECESSION, CONTEXT));
    }

    @Test
    void testFallbackWhenSourceFails() {
        AtomicInteger calls = new AtomicInteger();
        NarrativeService service = new NarrativeService((type, ctx) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("service unavailable");
        });

        String text = service.narrate(EventType.GLOBAL_INTEREST_HIKE, CONTEXT);

        assertEquals(1, calls.get());
        assertEquals(NarrativeService.template(EventType.GLOBAL_INTEREST_HIKE, CONTEXT), text);
    }
}
