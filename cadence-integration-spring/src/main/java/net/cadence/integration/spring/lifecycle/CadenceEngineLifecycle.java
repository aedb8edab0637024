package net.cadence.integration.spring.lifecycle;

import net.cadence.core.maintenance.MaintenanceService;
import net.cadence.core.service.SchedulerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * 스프링 컨텍스트 수명주기에 엔진을 묶는다.
 * 컨텍스트가 뜨면 기동 점검 후 스케줄러 루프를 시작하고, 닫힐 때 실행 중인 잡을 정리한다.
 */
public class CadenceEngineLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CadenceEngineLifecycle.class);

    private final SchedulerEngine engine;
    private final boolean autoStartup;
    private volatile MaintenanceService.MaintenanceReport startupReport;

    public CadenceEngineLifecycle(SchedulerEngine engine, boolean autoStartup) {
        this.engine = engine;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        startupReport = engine.start();
        log.info("Startup maintenance: {}", startupReport);
    }

    @Override
    public void stop() {
        engine.stop();
    }

    @Override
    public boolean isRunning() {
        return engine.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    /** 카탈로그 등록 등 다른 빈이 먼저 준비되도록 늦게 시작하고 먼저 멈춘다 */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }

    public MaintenanceService.MaintenanceReport startupReport() {
        return startupReport;
    }
}
