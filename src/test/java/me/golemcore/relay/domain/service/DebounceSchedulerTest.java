package me.golemcore.relay.domain.service;

import me.golemcore.relay.domain.model.TimerState;
import me.golemcore.relay.testsupport.loop.ManualEventLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DebounceSchedulerTest {

    private static final Duration QUIET = Duration.ofSeconds(60);

    private ManualEventLoop loop;
    private DebounceScheduler scheduler;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        scheduler = new DebounceScheduler(loop);
        fired = new ArrayList<>();
    }

    @Test
    void shouldFireOnceAfterDelay() {
        scheduler.schedule("r1", QUIET, fired::add);
        assertEquals(TimerState.SCHEDULED, scheduler.getState("r1").orElseThrow());

        loop.advanceBy(Duration.ofSeconds(59));
        assertTrue(fired.isEmpty());

        loop.advanceBy(Duration.ofSeconds(1));
        assertEquals(List.of("r1"), fired);

        loop.advanceBy(Duration.ofMinutes(10));
        assertEquals(1, fired.size());
    }

    @Test
    void shouldRetireTimerAfterFire() {
        scheduler.schedule("r1", QUIET, fired::add);
        loop.advanceBy(QUIET);

        assertTrue(scheduler.getState("r1").isEmpty());
        assertEquals(0, scheduler.activeTimers());
    }

    @Test
    void shouldNotFireCancelledTimer() {
        scheduler.schedule("r1", QUIET, fired::add);

        assertTrue(scheduler.cancel("r1"));
        loop.advanceBy(Duration.ofMinutes(5));

        assertTrue(fired.isEmpty());
        assertEquals(0, scheduler.activeTimers());
        assertEquals(0, loop.pendingEvents());
    }

    @Test
    void shouldTreatCancelOfUnknownIdAsNoOp() {
        assertFalse(scheduler.cancel("missing"));
    }

    @Test
    void shouldTreatCancelAfterFireAsNoOp() {
        scheduler.schedule("r1", QUIET, fired::add);
        loop.advanceBy(QUIET);

        assertFalse(scheduler.cancel("r1"));
        assertEquals(List.of("r1"), fired);
    }

    @Test
    void shouldTreatSecondCancelAsNoOp() {
        scheduler.schedule("r1", QUIET, fired::add);

        assertTrue(scheduler.cancel("r1"));
        assertFalse(scheduler.cancel("r1"));
    }

    @Test
    void shouldReplaceTimerScheduledUnderSameId() {
        scheduler.schedule("r1", QUIET, id -> fired.add("first"));
        loop.advanceBy(Duration.ofSeconds(30));
        scheduler.schedule("r1", QUIET, id -> fired.add("second"));

        loop.advanceBy(Duration.ofSeconds(30));
        assertTrue(fired.isEmpty());

        loop.advanceBy(Duration.ofSeconds(30));
        assertEquals(List.of("second"), fired);
        assertEquals(0, scheduler.activeTimers());
    }

    @Test
    void shouldFireIndependentTimersInDueOrder() {
        scheduler.schedule("late", Duration.ofSeconds(20), fired::add);
        scheduler.schedule("early", Duration.ofSeconds(10), fired::add);

        loop.advanceBy(Duration.ofSeconds(30));

        assertEquals(List.of("early", "late"), fired);
    }
}
