package net.cadence.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * 코어 → 협력자 방향의 타입 있는 이벤트 채널.
 * 발행은 큐에 넣고 바로 반환하며, 구독자 예외는 다른 구독자에게 전파되지 않는다.
 */
public final class ExecutionEventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEventBus.class);

    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService delivery = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "cadence-events");
        t.setDaemon(true);
        return t;
    });

    public Subscription subscribe(ExecutionListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(ExecutionEvent event) {
        deliver(l -> l.onExecutionFinished(event));
    }

    public void publish(StoreFault fault) {
        deliver(l -> l.onStoreFault(fault));
    }

    private void deliver(Consumer<ExecutionListener> call) {
        try {
            delivery.execute(() -> {
                for (ExecutionListener l : listeners) {
                    try {
                        call.accept(l);
                    } catch (RuntimeException e) {
                        log.warn("Event listener {} failed", l.getClass().getSimpleName(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Event bus closed, event dropped");
        }
    }

    @Override
    public void close() {
        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(2, TimeUnit.SECONDS)) delivery.shutdownNow();
        } catch (InterruptedException e) {
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
