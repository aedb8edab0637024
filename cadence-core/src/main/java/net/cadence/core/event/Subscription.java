package net.cadence.core.event;

@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
