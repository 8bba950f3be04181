package org.carma.influence.event;

import org.carma.influence.model.GridPoint;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventBusTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final GridPoint POINT = new GridPoint(0.8, 0.6, 6.0, 0.5, 1, false);

    @Test
    void typedSubscribersSeeOnlyTheirType() {
        EventBus bus = new EventBus();
        List<HarnessEvent.GridPointFailed> failed = new ArrayList<>();
        List<HarnessEvent> all = new ArrayList<>();
        bus.subscribe(HarnessEvent.GridPointFailed.class, failed::add);
        bus.subscribeAll(all::add);

        bus.publish(new HarnessEvent.GridPointCompleted(NOW, POINT, 1.0, 1, 10));
        bus.publish(new HarnessEvent.GridPointFailed(NOW, POINT, "planner round 1: boom", 12));

        assertThat(failed).extracting(HarnessEvent.GridPointFailed::reason).containsExactly("planner round 1: boom");
        assertThat(all).extracting(HarnessEvent::eventType)
            .containsExactly("GRID_POINT_COMPLETED", "GRID_POINT_FAILED");
    }

    @Test
    void throwingHandlerDoesNotStopDelivery() {
        EventBus bus = new EventBus();
        List<HarnessEvent> delivered = new ArrayList<>();
        bus.subscribe(HarnessEvent.SweepFinished.class, e -> {
            throw new IllegalStateException("observer broke");
        });
        bus.subscribeAll(delivered::add);

        bus.publish(new HarnessEvent.SweepFinished(NOW, 3, 1, Duration.ofSeconds(4)));

        assertThat(delivered).hasSize(1);
    }

    @Test
    void historyIsFilteredByType() {
        EventBus bus = new EventBus();
        bus.publish(new HarnessEvent.SweepStarted(NOW, 4, 1, 3, 2));
        bus.publish(new HarnessEvent.GridPointDispatched(NOW, POINT, 0, 3));
        bus.publish(new HarnessEvent.GridPointDispatched(NOW, POINT, 1, 3));

        assertThat(bus.getHistory()).hasSize(3);
        assertThat(bus.getEventCount(HarnessEvent.GridPointDispatched.class)).isEqualTo(2);
        assertThat(bus.getHistory(HarnessEvent.SweepStarted.class).get(0).pending()).isEqualTo(3);

        bus.clearHistory();
        assertThat(bus.getHistory()).isEmpty();
    }

    @Test
    void historyCanBeDisabled() {
        EventBus bus = new EventBus(false);
        bus.publish(new HarnessEvent.SweepStarted(NOW, 4, 0, 4, 1));

        assertThat(bus.getHistory()).isEmpty();
    }
}
