package net.cadence.bootstrap.autoconfigure;

import net.cadence.bootstrap.catalog.CatalogRegistrar;
import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.event.LoggingNotificationTransport;
import net.cadence.core.service.SchedulerEngine;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.ExecutionRepository;
import net.cadence.core.spi.JobDependencyRepository;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.NotificationTransport;
import net.cadence.core.spi.ScheduleDescriber;
import net.cadence.core.spi.TxRunner;
import net.cadence.integration.spring.CadenceSpringConfig;
import net.cadence.integration.spring.lifecycle.CadenceEngineLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.util.stream.Collectors;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"})
@EnableConfigurationProperties(CadenceProperties.class)
@Import(CadenceSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class CadenceAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CadenceAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    /** 이메일/Slack 전송은 앱이 NotificationTransport 빈을 등록해 대체한다 */
    @Bean
    @ConditionalOnMissingBean
    public NotificationTransport notificationTransport(CadenceProperties props) {
        if (!props.getNotification().isEnabled()) {
            return n -> log.debug("Notifications disabled, dropped: {}", n.subject());
        }
        return new LoggingNotificationTransport();
    }

    // --- 엔진 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public SchedulerEngine schedulerEngine(JobRepository jobs,
                                           JobDependencyRepository deps,
                                           ExecutionRepository executions,
                                           TxRunner tx,
                                           Clock clock,
                                           NotificationTransport transport,
                                           CadenceProperties props) {
        return new SchedulerEngine(jobs, deps, executions, tx, clock, props.toEngineSettings(), transport);
    }

    /** cadence.scheduler.enabled=false 면 엔진을 조립만 하고 루프는 돌리지 않는다 */
    @Bean
    public CadenceEngineLifecycle cadenceEngineLifecycle(SchedulerEngine engine, CadenceProperties props) {
        return new CadenceEngineLifecycle(engine, props.getScheduler().isEnabled());
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(SchedulerEngine engine, ScheduleDescriber describer) {
        return new CatalogRegistrar(engine, describer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cadence.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar,
                                           CadenceProperties props) {
        log.info("Cadence catalog: {} declared job(s)\n{}", props.getCatalog().getJobs().size(),
                props.getCatalog().getJobs().stream()
                        .map(CadenceProperties.JobDef::toString)
                        .collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }
}
