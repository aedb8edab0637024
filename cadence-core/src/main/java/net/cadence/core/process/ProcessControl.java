package net.cadence.core.process;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/** 프로세스 트리 종료: 정상 종료 요청 → grace 대기 → 강제 종료 */
public final class ProcessControl {
    private ProcessControl() {}

    /**
     * @return 트리 전체가 종료된 것이 확인되면 true, 강제 종료 후에도 살아 있으면 false
     */
    public static boolean terminate(Process process, Duration grace) {
        // 부모가 죽으면 자식이 재부모화되어 descendants 에서 빠지므로 먼저 스냅샷
        List<ProcessHandle> tree = new ArrayList<>(process.descendants().collect(Collectors.toList()));
        tree.add(process.toHandle());

        tree.forEach(ProcessHandle::destroy);
        if (awaitDeath(tree, grace)) return true;

        tree.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        return awaitDeath(tree, grace);
    }

    private static boolean awaitDeath(List<ProcessHandle> tree, Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        for (ProcessHandle h : tree) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) break;
            try {
                h.onExit().get(remaining, TimeUnit.NANOSECONDS);
            } catch (java.util.concurrent.TimeoutException e) {
                break;
            } catch (java.util.concurrent.ExecutionException e) {
                // onExit 은 실패로 완료되지 않는다. 아래 isAlive 로 판정
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return tree.stream().noneMatch(ProcessHandle::isAlive);
    }
}
