package net.cadence.core.model;

import java.time.Instant;

/** jobId 는 dependsOnJobId 가 성공해야 실행 가능 */
public record DependencyEdge(
        long jobId,
        long dependsOnJobId,
        Instant createdAt
) {}
