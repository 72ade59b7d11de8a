package com.redline.core.review;

import com.redline.core.events.EventBus;
import com.redline.core.events.RedlineEvent;
import com.redline.core.metrics.RedlineMetrics;
import com.redline.core.model.Attack;
import com.redline.core.model.AttackCategory;
import com.redline.core.model.Severity;
import com.redline.core.model.Template;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReviewEmitterTest {

    private EventBus eventBus;
    private List<RedlineEvent> events;
    private SimpleMeterRegistry registry;
    private ReviewEmitter emitter;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        emitter = new ReviewEmitter(new EventBusReviewQueueSink(eventBus), new RedlineMetrics(registry));
    }

    private static Attack attack(Severity severity, boolean bypassed, List<String> policies) {
        var template = new Template("t", "T", AttackCategory.DATA_LEAKAGE, severity, null, "x",
                null, null, true, false);
        return Attack.dispatched("A-1", "C-1", template, "m", "x", Map.of())
                .scored("r", bypassed, 0.9, "n", policies, 5);
    }

    @Test
    @DisplayName("critical bypass publishes one review item and sets the back-reference")
    void critical() {
        Attack withReview = emitter.emit(attack(Severity.CRITICAL, true, List.of("sensitive-data-exposure")))
                .orElseThrow();

        assertNotNull(withReview.reviewItemId());
        assertEquals(1, events.size());
        RedlineEvent event = events.get(0);
        assertEquals("review.created", event.eventType());
        assertEquals("C-1", event.campaignId());
        assertEquals("A-1", event.attackId());
        assertEquals(withReview.reviewItemId(), event.payload().get("reviewItemId"));
        assertEquals(List.of("sensitive-data-exposure"), event.payload().get("flaggedPolicies"));
        assertEquals(1.0, registry.find("redline.review_items.total").tag("severity", "critical")
                .counter().count());
    }

    @Test
    @DisplayName("policies default to the category")
    void defaultPolicies() {
        emitter.emit(attack(Severity.HIGH, true, List.of()));

        assertEquals(List.of("data-leakage"), events.get(0).payload().get("flaggedPolicies"));
    }

    @Test
    @DisplayName("blocked or low-severity attacks do not qualify")
    void notQualifying() {
        assertTrue(emitter.emit(attack(Severity.CRITICAL, false, List.of())).isEmpty());
        assertTrue(emitter.emit(attack(Severity.MEDIUM, true, List.of())).isEmpty());
        assertTrue(emitter.emit(attack(Severity.LOW, true, List.of())).isEmpty());
        assertTrue(events.isEmpty());
    }

    @Test
    @DisplayName("an attack that already has a review item is not queued again")
    void onlyOnce() {
        Attack first = emitter.emit(attack(Severity.HIGH, true, List.of())).orElseThrow();

        assertTrue(emitter.emit(first).isEmpty());
        assertEquals(1, events.size());
    }

    @Test
    @DisplayName("a failing sink is logged and the attack still gets its id")
    void failingSink() {
        ReviewQueueSink sink = mock(ReviewQueueSink.class);
        doThrow(new IllegalStateException("queue down")).when(sink).createReviewItem(any());
        var failing = new ReviewEmitter(sink, new RedlineMetrics(registry));

        assertTrue(failing.emit(attack(Severity.HIGH, true, List.of())).isPresent());
        verify(sink).createReviewItem(any());
    }
}
