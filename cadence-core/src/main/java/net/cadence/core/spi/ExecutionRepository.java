package net.cadence.core.spi;

import net.cadence.core.model.Execution;
import net.cadence.core.model.ExecutionSeal;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ExecutionRepository {
    /** RUNNING 행 생성 */
    Execution start(long jobId, Instant startTime, int retryCount, Execution.TriggeredBy triggeredBy) throws Exception;

    void attachPid(long executionId, long pid) throws Exception;

    /** 실행 중 출력 중간 반영. 이미 종료된 행은 건드리지 않는다 */
    void updateOutput(long executionId, String stdout, String stderr) throws Exception;

    /**
     * RUNNING → 종료 결과. END_TIME IS NULL 조건부 UPDATE 이므로
     * 두 번째 호출은 false 를 반환하고 아무것도 바꾸지 않는다.
     */
    boolean seal(long executionId, ExecutionSeal seal) throws Exception;

    Optional<Execution> findById(long id) throws Exception;

    /** 최신순 (START_TIME DESC, ID DESC) */
    List<Execution> findByJob(long jobId, int limit, int offset) throws Exception;

    /** 전체 잡 대상 최신순, outcome null = 전체 */
    List<Execution> findRecent(int limit, Execution.Outcome outcome) throws Exception;

    /** 잡별 가장 최근 실행 1건 */
    Map<Long, Execution> findLatestPerJob() throws Exception;

    List<Execution> findRunning() throws Exception;

    long countByJob(long jobId) throws Exception;
}
