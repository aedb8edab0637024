package net.cadence.bootstrap.props;

import net.cadence.core.config.EngineSettings;
import net.cadence.core.model.JobDefinition;
import net.cadence.core.model.JobKind;
import net.cadence.core.model.NotificationPrefs;
import net.cadence.core.model.RetrySettings;
import net.cadence.core.model.Schedule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("cadence")
public class CadenceProperties {
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();
    private Commands commands = new Commands();
    private Notification notification = new Notification();
    private Catalog catalog = new Catalog();

    /** 프로퍼티 → 엔진 설정 */
    public EngineSettings toEngineSettings() {
        return EngineSettings.defaults()
                .withZone(ZoneId.of(zone))
                .withTickInterval(scheduler.getTickInterval())
                .withMaxSlots(scheduler.getMaxSlots())
                .withDefaultRetry(new RetrySettings(scheduler.getDefaultMaxRetries(),
                        scheduler.getDefaultRetryDelay().toSeconds()))
                .withShutdownGrace(scheduler.getShutdownGrace())
                .withKillGrace(scheduler.getKillGrace())
                .withOutputLimitChars(scheduler.getOutputLimitChars())
                .withOutputFlushInterval(scheduler.getOutputFlushInterval())
                .withStoreWriteAttempts(scheduler.getStoreWriteAttempts())
                .withStoreWriteBackoff(scheduler.getStoreWriteBackoff())
                .withScriptInterpreter(commands.getScriptInterpreter())
                .withSqlTool(commands.getSqlTool());
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Commands getCommands() {
        return commands;
    }

    public void setCommands(Commands commands) {
        this.commands = commands;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(30);
        private int maxSlots = 5;
        private int defaultMaxRetries = 0;
        private Duration defaultRetryDelay = Duration.ofSeconds(60);
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private Duration killGrace = Duration.ofSeconds(5);
        private int outputLimitChars = 1024 * 1024;
        private Duration outputFlushInterval = Duration.ofSeconds(2);
        private int storeWriteAttempts = 3;
        private Duration storeWriteBackoff = Duration.ofMillis(200);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public int getMaxSlots() {
            return maxSlots;
        }

        public void setMaxSlots(int maxSlots) {
            this.maxSlots = maxSlots;
        }

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Duration getDefaultRetryDelay() {
            return defaultRetryDelay;
        }

        public void setDefaultRetryDelay(Duration defaultRetryDelay) {
            this.defaultRetryDelay = defaultRetryDelay;
        }

        public Duration getShutdownGrace() {
            return shutdownGrace;
        }

        public void setShutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
        }

        public Duration getKillGrace() {
            return killGrace;
        }

        public void setKillGrace(Duration killGrace) {
            this.killGrace = killGrace;
        }

        public int getOutputLimitChars() {
            return outputLimitChars;
        }

        public void setOutputLimitChars(int outputLimitChars) {
            this.outputLimitChars = outputLimitChars;
        }

        public Duration getOutputFlushInterval() {
            return outputFlushInterval;
        }

        public void setOutputFlushInterval(Duration outputFlushInterval) {
            this.outputFlushInterval = outputFlushInterval;
        }

        public int getStoreWriteAttempts() {
            return storeWriteAttempts;
        }

        public void setStoreWriteAttempts(int storeWriteAttempts) {
            this.storeWriteAttempts = storeWriteAttempts;
        }

        public Duration getStoreWriteBackoff() {
            return storeWriteBackoff;
        }

        public void setStoreWriteBackoff(Duration storeWriteBackoff) {
            this.storeWriteBackoff = storeWriteBackoff;
        }
    }

    public static class Commands {
        private String scriptInterpreter = "python3";
        private String sqlTool;

        public String getScriptInterpreter() {
            return scriptInterpreter;
        }

        public void setScriptInterpreter(String scriptInterpreter) {
            this.scriptInterpreter = scriptInterpreter;
        }

        public String getSqlTool() {
            return sqlTool;
        }

        public void setSqlTool(String sqlTool) {
            this.sqlTool = sqlTool;
        }
    }

    public static class Notification {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    /** 설정 파일로 선언하는 잡. intervalMinutes 와 cronExpr 가 모두 없으면 수동 실행 잡 */
    public static class JobDef {
        private String name;
        private String description;
        private String kind = "SHELL";
        private String command;
        private String workingDirectory;
        private Map<String, String> environment = new LinkedHashMap<>();
        private Integer intervalMinutes;
        private String cronExpr;
        private boolean enabled = true;
        private Integer maxRetries;
        private Long retryDelaySeconds;
        private Integer timeoutSeconds;
        private String notifyAddress;
        private boolean notifyOnSuccess = false;
        private boolean notifyOnFailure = true;
        private List<String> dependsOn = new ArrayList<>();

        public JobDefinition toDefinition() {
            Schedule schedule = cronExpr != null ? Schedule.cron(cronExpr)
                    : intervalMinutes != null ? Schedule.interval(intervalMinutes)
                    : Schedule.manual();
            RetrySettings retry = null;
            if (maxRetries != null || retryDelaySeconds != null) {
                RetrySettings base = RetrySettings.none();
                retry = new RetrySettings(maxRetries == null ? base.maxRetries() : maxRetries,
                        retryDelaySeconds == null ? base.retryDelaySeconds() : retryDelaySeconds);
            }
            return new JobDefinition(name, description, JobKind.from(kind), command, workingDirectory,
                    environment, schedule, enabled, retry, timeoutSeconds,
                    new NotificationPrefs(notifyAddress, notifyOnSuccess, notifyOnFailure));
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public String getCommand() {
            return command;
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public String getWorkingDirectory() {
            return workingDirectory;
        }

        public void setWorkingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
        }

        public Map<String, String> getEnvironment() {
            return environment;
        }

        public void setEnvironment(Map<String, String> environment) {
            this.environment = environment;
        }

        public Integer getIntervalMinutes() {
            return intervalMinutes;
        }

        public void setIntervalMinutes(Integer intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
        }

        public String getCronExpr() {
            return cronExpr;
        }

        public void setCronExpr(String cronExpr) {
            this.cronExpr = cronExpr;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Integer getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Long getRetryDelaySeconds() {
            return retryDelaySeconds;
        }

        public void setRetryDelaySeconds(Long retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
        }

        public Integer getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public String getNotifyAddress() {
            return notifyAddress;
        }

        public void setNotifyAddress(String notifyAddress) {
            this.notifyAddress = notifyAddress;
        }

        public boolean isNotifyOnSuccess() {
            return notifyOnSuccess;
        }

        public void setNotifyOnSuccess(boolean notifyOnSuccess) {
            this.notifyOnSuccess = notifyOnSuccess;
        }

        public boolean isNotifyOnFailure() {
            return notifyOnFailure;
        }

        public void setNotifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
        }

        public List<String> getDependsOn() {
            return dependsOn;
        }

        public void setDependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", kind='" + kind + '\'' +
                    ", command='" + command + '\'' +
                    ", intervalMinutes=" + intervalMinutes +
                    ", cronExpr='" + cronExpr + '\'' +
                    ", dependsOn=" + dependsOn +
                    '}';
        }
    }
}
