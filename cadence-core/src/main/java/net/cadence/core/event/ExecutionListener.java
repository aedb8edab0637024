package net.cadence.core.event;

/** 엔진 이벤트 구독자. 이벤트 전용 스레드에서 호출된다 */
public interface ExecutionListener {
    void onExecutionFinished(ExecutionEvent event);

    default void onStoreFault(StoreFault fault) {}
}
