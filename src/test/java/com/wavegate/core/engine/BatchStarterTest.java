package com.wavegate.core.engine;

import com.wavegate.core.config.WavegateProperties;
import com.wavegate.core.model.Session;
import com.wavegate.core.model.SessionMode;
import com.wavegate.core.plan.CharacterDevelopmentPlan;
import com.wavegate.core.plan.UnknownPlanException;
import com.wavegate.core.plan.WavePlanRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchStarterTest {

    private SessionService sessions;
    private WavegateProperties properties;
    private BatchStarter starter;

    @BeforeEach
    void setUp() {
        sessions = mock(SessionService.class);
        properties = new WavegateProperties();
        var registry = new WavePlanRegistry(List.of(CharacterDevelopmentPlan.plan()), CharacterDevelopmentPlan.NAME);
        starter = new BatchStarter(sessions, registry, properties);
        when(sessions.start(any(), any(), any())).thenAnswer(call -> {
            Map<String, Object> input = call.getArgument(2);
            return Session.create("S-" + input.get("name"), CharacterDevelopmentPlan.NAME,
                    SessionMode.BALANCED, 7, input);
        });
    }

    private static BatchEntry entry(String name, Integer priority) {
        return new BatchEntry(null, null, Map.of("name", name), priority);
    }

    private static List<String> names(List<BatchEntry> entries) {
        return entries.stream().map(e -> (String) e.input().get("name")).toList();
    }

    @Nested
    @DisplayName("selection")
    class Selection {

        @Test
        @DisplayName("orders by priority, keeps request order on ties and skips low priorities")
        void priorityOrder() {
            List<BatchEntry> selected = BatchStarter.select(List.of(
                    entry("side", 1),
                    entry("support-1", 3),
                    entry("lead", 5),
                    entry("support-2", null),
                    entry("rival", 4),
                    entry("support-3", 3),
                    entry("cameo", 2),
                    entry("villain", 5)), 2);

            assertEquals(List.of("lead", "villain", "rival", "support-1", "support-2"), names(selected));
        }

        @Test
        @DisplayName("every high-priority entry starts regardless of the medium limit")
        void highPriorityUnlimited() {
            var entries = new ArrayList<BatchEntry>();
            for (int i = 0; i < 6; i++) {
                entries.add(entry("lead-" + i, 4));
            }

            assertEquals(6, BatchStarter.select(entries, 0).size());
        }
    }

    @Test
    @DisplayName("starts the selected sessions and reports selected and submitted counts")
    void startsSelected() {
        BatchResult result = starter.start(List.of(entry("side", 1), entry("support", 3), entry("lead", 5)));

        assertEquals(3, result.submitted());
        assertEquals(List.of("S-lead", "S-support"),
                result.started().stream().map(s -> s.session().id()).toList());
        assertEquals(List.of(5, 3), result.started().stream().map(BatchResult.Started::priority).toList());
        verify(sessions, times(2)).start(any(), any(), any());
    }

    @Test
    @DisplayName("the medium-priority limit comes from configuration")
    void configuredLimit() {
        properties.getBatch().setMediumPriorityLimit(1);

        BatchResult result = starter.start(List.of(entry("a", 3), entry("b", 3), entry("c", 3)));

        assertEquals(1, result.started().size());
        assertEquals("S-a", result.started().get(0).session().id());
    }

    @Test
    @DisplayName("an empty batch is refused")
    void emptyBatch() {
        assertThrows(IllegalArgumentException.class, () -> starter.start(List.of()));
        assertThrows(IllegalArgumentException.class, () -> starter.start(null));
    }

    @Test
    @DisplayName("one invalid entry fails the whole batch before anything starts")
    void validatesBeforeStarting() {
        assertThrows(IllegalArgumentException.class, () -> starter.start(List.of(
                entry("lead", 5), new BatchEntry(null, "turbo", Map.of("name", "x"), 5))));
        assertThrows(UnknownPlanException.class, () -> starter.start(List.of(
                entry("lead", 5), new BatchEntry("no-such-plan", null, Map.of("name", "x"), 1))));
        var e = assertThrows(IllegalArgumentException.class, () -> starter.start(List.of(entry("lead", 9))));
        assertTrue(e.getMessage().contains("priority"));

        verify(sessions, never()).start(any(), any(), any());
    }
}
