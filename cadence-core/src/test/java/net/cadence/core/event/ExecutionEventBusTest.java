package net.cadence.core.event;

import net.cadence.core.model.Execution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class ExecutionEventBusTest {

    final ExecutionEventBus bus = new ExecutionEventBus();

    @AfterEach
    void close() {
        bus.close();
    }

    private static ExecutionEvent event(long jobId) {
        return new ExecutionEvent(jobId, "job-" + jobId, jobId * 10, Execution.Outcome.SUCCESS, 0, 0,
                Duration.ofSeconds(1), true);
    }

    @Test
    void failing_listener_does_not_block_others() {
        List<Long> seen = new CopyOnWriteArrayList<>();
        bus.subscribe(e -> { throw new IllegalStateException("listener bug"); });
        bus.subscribe(e -> seen.add(e.jobId()));

        bus.publish(event(1));
        bus.publish(event(2));

        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 2);
        assertThat(seen).containsExactly(1L, 2L);
    }

    @Test
    void closed_subscription_stops_delivery() {
        List<Long> seen = new CopyOnWriteArrayList<>();
        List<Long> other = new CopyOnWriteArrayList<>();
        Subscription sub = bus.subscribe(e -> seen.add(e.jobId()));
        bus.subscribe(e -> other.add(e.jobId()));

        bus.publish(event(1));
        await().atMost(Duration.ofSeconds(5)).until(() -> seen.size() == 1);
        sub.close();
        bus.publish(event(2));

        await().atMost(Duration.ofSeconds(5)).until(() -> other.size() == 2);
        assertThat(seen).containsExactly(1L);
    }

    @Test
    void store_faults_reach_listeners_that_care() {
        List<StoreFault> faults = new CopyOnWriteArrayList<>();
        bus.subscribe(new ExecutionListener() {
            @Override
            public void onExecutionFinished(ExecutionEvent event) {
            }

            @Override
            public void onStoreFault(StoreFault fault) {
                faults.add(fault);
            }
        });

        bus.publish(new StoreFault(7, 70L, Execution.Outcome.FAILED, "disk full"));

        await().atMost(Duration.ofSeconds(5)).until(() -> faults.size() == 1);
        assertThat(faults.get(0).attemptedOutcome()).isEqualTo(Execution.Outcome.FAILED);
    }
}
