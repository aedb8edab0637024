package net.cadence.core.spi;

import net.cadence.core.model.Execution;
import net.cadence.core.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRepository {
    /** INSERT 후 생성된 ID 가 채워진 행을 반환. 이름 중복은 예외 */
    Job insert(Job job) throws Exception;

    /** 정의 필드 + nextRun 갱신 (ID 필수) */
    void update(Job job) throws Exception;

    boolean delete(long id) throws Exception;

    Optional<Job> findById(long id) throws Exception;
    Optional<Job> findByName(String name) throws Exception;
    List<Job> findAll() throws Exception;       // 이름순
    List<Job> findEnabled() throws Exception;   // 이름순

    void setEnabled(long id, boolean enabled) throws Exception;
    void updateNextRun(long id, Instant nextRun) throws Exception;

    /** 시도 종료 후 파생 필드 기록 */
    void recordRun(long id, Instant lastRun, Execution.Outcome lastStatus) throws Exception;

    /** 재기동 시 RUNNING 으로 남은 lastStatus 정리 */
    int resetRunningStatus(Execution.Outcome replacement) throws Exception;
}
