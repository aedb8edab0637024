package net.cadence.bootstrap.catalog;

import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.model.Job;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.service.DefinitionException;
import net.cadence.core.service.SchedulerEngine;
import net.cadence.core.spi.ScheduleDescriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 설정에 선언된 잡을 등록한다. 이름이 이미 있는 잡은 건드리지 않으므로 재기동해도 멱등이며,
 * 편집기에서 바꾼 정의를 설정값이 덮어쓰지 않는다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final SchedulerEngine engine;
    private final ScheduleDescriber describer;

    public CatalogRegistrar(SchedulerEngine engine, ScheduleDescriber describer) {
        this.engine = engine;
        this.describer = describer;
    }

    /** @return 새로 등록된 잡 */
    public List<Job> register(CadenceProperties.Catalog catalog) throws Exception {
        List<JobDefinition> defs = new ArrayList<>();
        List<List<String>> dependsOn = new ArrayList<>();
        for (var j : catalog.getJobs()) {
            if (j.getName() != null && engine.findJob(j.getName()).isPresent()) {
                log.debug("Catalog job '{}' already registered, skipped", j.getName());
                continue;
            }
            if (j.getCronExpr() != null && j.getIntervalMinutes() != null) {
                throw new DefinitionException("cadence.catalog.jobs[" + j.getName() + "].schedule",
                        "set either cron-expr or interval-minutes, not both");
            }
            defs.add(toDefinition(j));
            dependsOn.add(j.getDependsOn() == null ? List.of() : j.getDependsOn());
        }
        if (defs.isEmpty()) return List.of();

        List<Job> created = engine.catalog().createAll(defs, dependsOn);
        for (Job job : created) {
            log.info("Catalog registered: job='{}' ({})", job.name(), describer.describe(job.schedule()));
        }
        return created;
    }

    private static JobDefinition toDefinition(CadenceProperties.JobDef j) {
        try {
            return j.toDefinition();
        } catch (IllegalArgumentException e) {
            throw new DefinitionException("cadence.catalog.jobs[" + j.getName() + "].kind", e.getMessage(), e);
        }
    }
}
