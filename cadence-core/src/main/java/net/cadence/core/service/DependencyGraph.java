package net.cadence.core.service;

import net.cadence.core.model.DependencyEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** 잡 ID 간 "A 는 B 에 의존" 관계. 변경 전에 순환 여부를 확인하는 용도 */
public final class DependencyGraph {
    private final Map<Long, Set<Long>> dependsOn = new HashMap<>();

    public static DependencyGraph of(Collection<DependencyEdge> edges) {
        DependencyGraph g = new DependencyGraph();
        for (DependencyEdge e : edges) g.add(e.jobId(), e.dependsOnJobId());
        return g;
    }

    public void add(long jobId, long dependsOnJobId) {
        dependsOn.computeIfAbsent(jobId, k -> new LinkedHashSet<>()).add(dependsOnJobId);
    }

    public void removeAllFrom(long jobId) {
        dependsOn.remove(jobId);
    }

    public boolean contains(long jobId, long dependsOnJobId) {
        return dependsOn.getOrDefault(jobId, Set.of()).contains(dependsOnJobId);
    }

    public Set<Long> dependenciesOf(long jobId) {
        return Set.copyOf(dependsOn.getOrDefault(jobId, Set.of()));
    }

    /** jobId → dependsOnJobId 를 추가하면 순환이 생기는지. dependsOnJobId 에서 jobId 로 도달 가능하면 순환 */
    public boolean wouldCreateCycle(long jobId, long dependsOnJobId) {
        if (jobId == dependsOnJobId) return true;
        Deque<Long> stack = new ArrayDeque<>();
        Set<Long> seen = new HashSet<>();
        stack.push(dependsOnJobId);
        while (!stack.isEmpty()) {
            long cur = stack.pop();
            if (cur == jobId) return true;
            if (!seen.add(cur)) continue;
            for (Long next : dependsOn.getOrDefault(cur, Set.of())) stack.push(next);
        }
        return false;
    }

    /** 의존 대상이 먼저 오도록 정렬 (입력 순서 안정). 순환이 있으면 IllegalStateException */
    public List<Long> topologicalOrder(Collection<Long> nodes) {
        List<Long> out = new ArrayList<>(nodes.size());
        Set<Long> done = new HashSet<>();
        Set<Long> visiting = new HashSet<>();
        for (Long n : nodes) visit(n, done, visiting, out);
        return out;
    }

    private void visit(Long n, Set<Long> done, Set<Long> visiting, List<Long> out) {
        if (done.contains(n)) return;
        if (!visiting.add(n)) throw new IllegalStateException("dependency cycle through job " + n);
        for (Long dep : dependsOn.getOrDefault(n, Set.of())) visit(dep, done, visiting, out);
        visiting.remove(n);
        done.add(n);
        out.add(n);
    }
}
