package net.cadence.core.spi;

import net.cadence.core.model.DependencyEdge;

import java.util.List;

public interface JobDependencyRepository {
    void add(long jobId, long dependsOnJobId) throws Exception;
    boolean remove(long jobId, long dependsOnJobId) throws Exception;

    /** 잡 삭제 시 양방향 엣지 제거 */
    int removeAllFor(long jobId) throws Exception;

    /** jobId 가 의존하는 잡들 */
    List<Long> findDependencies(long jobId) throws Exception;

    /** jobId 에 의존하는 잡들 */
    List<Long> findDependents(long jobId) throws Exception;

    List<DependencyEdge> findAll() throws Exception;
}
