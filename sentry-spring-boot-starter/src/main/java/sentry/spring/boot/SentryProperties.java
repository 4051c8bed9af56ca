package sentry.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration properties for the event client.
 *
 * @see SentryAutoConfiguration
 */
@ConfigurationProperties(prefix = "sentry")
public class SentryProperties {

    /**
     * Connection descriptor. The client is only configured when this is set.
     */
    private String dsn;

    /**
     * Reported host name. Defaults to the local host name.
     */
    private String serverName;

    private String release;

    private String environment;

    /**
     * Probability in [0.0, 1.0] that a captured event is kept.
     */
    private double sampleRate = 1.0;

    private int maxAttachmentSize = 20_971_520;

    /**
     * Pending queue bound, 0 for unbounded.
     */
    private int maxQueueSize = 0;

    private Duration flushInterval = Duration.ofSeconds(5);

    private Duration drainTimeout = Duration.ofSeconds(5);

    private Duration requestTimeout = Duration.ofSeconds(30);

    private final Logging logging = new Logging();
    private final CrashLog crashLog = new CrashLog();
    private final Metrics metrics = new Metrics();

    public String getDsn() {
        return dsn;
    }

    public void setDsn(String dsn) {
        this.dsn = dsn;
    }

    public String getServerName() {
        return serverName;
    }

    public void setServerName(String serverName) {
        this.serverName = serverName;
    }

    public String getRelease() {
        return release;
    }

    public void setRelease(String release) {
        this.release = release;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public double getSampleRate() {
        return sampleRate;
    }

    public void setSampleRate(double sampleRate) {
        this.sampleRate = sampleRate;
    }

    public int getMaxAttachmentSize() {
        return maxAttachmentSize;
    }

    public void setMaxAttachmentSize(int maxAttachmentSize) {
        this.maxAttachmentSize = maxAttachmentSize;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public void setMaxQueueSize(int maxQueueSize) {
        this.maxQueueSize = maxQueueSize;
    }

    public Duration getFlushInterval() {
        return flushInterval;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Logging getLogging() {
        return logging;
    }

    public CrashLog getCrashLog() {
        return crashLog;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Forwarding of {@code java.util.logging} records.
     */
    public static class Logging {
        private boolean enabled = true;

        /**
         * Logger the handler is attached to. Empty means the root logger.
         */
        private String loggerName = "";

        /**
         * Minimum JUL level forwarded, by name or numeric value.
         */
        private String level = "WARNING";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLoggerName() {
            return loggerName;
        }

        public void setLoggerName(String loggerName) {
            this.loggerName = loggerName;
        }

        public String getLevel() {
            return level;
        }

        public void setLevel(String level) {
            this.level = level;
        }
    }

    /**
     * Crash log uploaded once the application is ready.
     */
    public static class CrashLog {
        private Path path;

        public Path getPath() {
            return path;
        }

        public void setPath(Path path) {
            this.path = path;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "sentry";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
