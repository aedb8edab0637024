package net.cadence.core.service;

import net.cadence.core.model.DependencyEdge;
import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 디스패치 가능 여부 판정. 잡은 (1) 활성이고 (2) 자신이 실행 중이 아니며
 * (3) 모든 의존 대상의 가장 최근 실행이 SUCCESS 이고 진행 중인 실행이 없을 때만 eligible.
 * 의존 대상이 한 번도 실행되지 않았다면 막힌다.
 */
public final class DependencyResolver {

    public Set<Long> eligible(Collection<Job> jobs,
                              Collection<DependencyEdge> edges,
                              Map<Long, Execution> latestByJob,
                              Set<Long> inFlight) {
        Map<Long, List<Long>> deps = index(edges);
        Set<Long> out = new HashSet<>();
        for (Job job : jobs) {
            if (!job.enabled() || job.id() == null) continue;
            long id = job.id();
            if (inFlight.contains(id) || isRunning(latestByJob.get(id))) continue;
            if (satisfied(deps.getOrDefault(id, List.of()), latestByJob, inFlight)) out.add(id);
        }
        return out;
    }

    private static boolean satisfied(List<Long> dependencies, Map<Long, Execution> latestByJob, Set<Long> inFlight) {
        for (Long dep : dependencies) {
            if (inFlight.contains(dep)) return false;
            Execution last = latestByJob.get(dep);
            if (last == null || last.outcome() != Execution.Outcome.SUCCESS) return false;
        }
        return true;
    }

    private static boolean isRunning(Execution e) {
        return e != null && e.outcome() == Execution.Outcome.RUNNING;
    }

    /** jobId → 의존 대상 목록 */
    public static Map<Long, List<Long>> index(Collection<DependencyEdge> edges) {
        Map<Long, List<Long>> m = new HashMap<>();
        for (DependencyEdge e : edges) {
            m.computeIfAbsent(e.jobId(), k -> new ArrayList<>()).add(e.dependsOnJobId());
        }
        return m;
    }
}
