package net.cadence.core.config;

import net.cadence.core.model.RetrySettings;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Engine settings. Every value has a default; {@code withX} returns a modified copy so a
 * running engine can be handed a new instance through {@code applySettings}.
 */
public final class EngineSettings {

    // Scheduler loop
    private Duration tickInterval = Duration.ofSeconds(30);
    private ZoneId zone = ZoneId.of("UTC");

    // Execution slots
    private int maxSlots = 5;
    private RetrySettings defaultRetry = RetrySettings.none();
    private Duration shutdownGrace = Duration.ofSeconds(30);
    private Duration killGrace = Duration.ofSeconds(5);
    private int outputLimitChars = 1024 * 1024;
    private Duration outputFlushInterval = Duration.ofSeconds(2);

    // Store write retries on completion
    private int storeWriteAttempts = 3;
    private Duration storeWriteBackoff = Duration.ofMillis(200);

    // Command builders
    private String scriptInterpreter = "python3";
    private String sqlTool = null; // null = SQL_TOOL 잡은 셸로 실행

    private EngineSettings() {
    }

    private EngineSettings(EngineSettings o) {
        this.tickInterval = o.tickInterval;
        this.zone = o.zone;
        this.maxSlots = o.maxSlots;
        this.defaultRetry = o.defaultRetry;
        this.shutdownGrace = o.shutdownGrace;
        this.killGrace = o.killGrace;
        this.outputLimitChars = o.outputLimitChars;
        this.outputFlushInterval = o.outputFlushInterval;
        this.storeWriteAttempts = o.storeWriteAttempts;
        this.storeWriteBackoff = o.storeWriteBackoff;
        this.scriptInterpreter = o.scriptInterpreter;
        this.sqlTool = o.sqlTool;
    }

    public static EngineSettings defaults() {
        return new EngineSettings();
    }

    // Getters
    public Duration tickInterval() { return tickInterval; }
    public ZoneId zone() { return zone; }
    public int maxSlots() { return maxSlots; }
    public RetrySettings defaultRetry() { return defaultRetry; }
    public Duration shutdownGrace() { return shutdownGrace; }
    public Duration killGrace() { return killGrace; }
    public int outputLimitChars() { return outputLimitChars; }
    public Duration outputFlushInterval() { return outputFlushInterval; }
    public int storeWriteAttempts() { return storeWriteAttempts; }
    public Duration storeWriteBackoff() { return storeWriteBackoff; }
    public String scriptInterpreter() { return scriptInterpreter; }
    public String sqlTool() { return sqlTool; }

    public boolean hasSqlTool() { return sqlTool != null && !sqlTool.isBlank(); }

    // Copies
    public EngineSettings withTickInterval(Duration tickInterval) {
        requirePositive(tickInterval, "tickInterval");
        EngineSettings c = new EngineSettings(this);
        c.tickInterval = tickInterval;
        return c;
    }

    public EngineSettings withZone(ZoneId zone) {
        EngineSettings c = new EngineSettings(this);
        c.zone = Objects.requireNonNull(zone);
        return c;
    }

    public EngineSettings withMaxSlots(int maxSlots) {
        if (maxSlots <= 0) throw new IllegalArgumentException("maxSlots must be positive: " + maxSlots);
        EngineSettings c = new EngineSettings(this);
        c.maxSlots = maxSlots;
        return c;
    }

    public EngineSettings withDefaultRetry(RetrySettings defaultRetry) {
        EngineSettings c = new EngineSettings(this);
        c.defaultRetry = Objects.requireNonNull(defaultRetry);
        return c;
    }

    public EngineSettings withShutdownGrace(Duration shutdownGrace) {
        EngineSettings c = new EngineSettings(this);
        c.shutdownGrace = Objects.requireNonNull(shutdownGrace);
        return c;
    }

    public EngineSettings withKillGrace(Duration killGrace) {
        requirePositive(killGrace, "killGrace");
        EngineSettings c = new EngineSettings(this);
        c.killGrace = killGrace;
        return c;
    }

    public EngineSettings withOutputLimitChars(int outputLimitChars) {
        if (outputLimitChars <= 0) throw new IllegalArgumentException("outputLimitChars must be positive");
        EngineSettings c = new EngineSettings(this);
        c.outputLimitChars = outputLimitChars;
        return c;
    }

    public EngineSettings withOutputFlushInterval(Duration outputFlushInterval) {
        requirePositive(outputFlushInterval, "outputFlushInterval");
        EngineSettings c = new EngineSettings(this);
        c.outputFlushInterval = outputFlushInterval;
        return c;
    }

    public EngineSettings withStoreWriteAttempts(int storeWriteAttempts) {
        if (storeWriteAttempts <= 0) throw new IllegalArgumentException("storeWriteAttempts must be positive");
        EngineSettings c = new EngineSettings(this);
        c.storeWriteAttempts = storeWriteAttempts;
        return c;
    }

    public EngineSettings withStoreWriteBackoff(Duration storeWriteBackoff) {
        EngineSettings c = new EngineSettings(this);
        c.storeWriteBackoff = Objects.requireNonNull(storeWriteBackoff);
        return c;
    }

    public EngineSettings withScriptInterpreter(String scriptInterpreter) {
        EngineSettings c = new EngineSettings(this);
        c.scriptInterpreter = Objects.requireNonNull(scriptInterpreter);
        return c;
    }

    public EngineSettings withSqlTool(String sqlTool) {
        EngineSettings c = new EngineSettings(this);
        c.sqlTool = sqlTool;
        return c;
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "tickInterval=" + tickInterval +
                ", zone=" + zone +
                ", maxSlots=" + maxSlots +
                ", defaultRetry=" + defaultRetry +
                ", shutdownGrace=" + shutdownGrace +
                ", killGrace=" + killGrace +
                ", outputLimitChars=" + outputLimitChars +
                ", storeWriteAttempts=" + storeWriteAttempts +
                '}';
    }
}
