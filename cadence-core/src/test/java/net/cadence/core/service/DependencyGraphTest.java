package net.cadence.core.service;

import net.cadence.core.model.DependencyEdge;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphTest {

    private static DependencyEdge edge(long job, long dependsOn) {
        return new DependencyEdge(job, dependsOn, null);
    }

    @Test
    void direct_and_transitive_cycles_are_detected() {
        // 3 → 2 → 1
        DependencyGraph g = DependencyGraph.of(List.of(edge(3, 2), edge(2, 1)));

        assertTrue(g.wouldCreateCycle(1, 3));
        assertTrue(g.wouldCreateCycle(2, 3));
        assertTrue(g.wouldCreateCycle(1, 1));
        assertFalse(g.wouldCreateCycle(3, 1));
        assertFalse(g.wouldCreateCycle(4, 3));
    }

    @Test
    void diamond_is_not_a_cycle() {
        DependencyGraph g = DependencyGraph.of(List.of(edge(4, 2), edge(4, 3), edge(2, 1)));
        assertFalse(g.wouldCreateCycle(3, 1));
        g.add(3, 1);
        assertTrue(g.wouldCreateCycle(1, 4));
    }

    @Test
    void topological_order_puts_dependencies_first() {
        DependencyGraph g = DependencyGraph.of(List.of(edge(3, 1), edge(3, 2), edge(2, 1)));
        List<Long> order = g.topologicalOrder(List.of(3L, 2L, 1L, 5L));
        assertThat(order).containsExactly(1L, 2L, 3L, 5L);
    }

    @Test
    void topological_order_fails_on_cycle() {
        DependencyGraph g = new DependencyGraph();
        g.add(1, 2);
        g.add(2, 1);
        assertThatThrownBy(() -> g.topologicalOrder(List.of(1L, 2L))).isInstanceOf(IllegalStateException.class);
    }
}
