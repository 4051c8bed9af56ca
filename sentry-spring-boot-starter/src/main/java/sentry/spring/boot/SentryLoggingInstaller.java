package sentry.spring.boot;

import sentry.Sentry;
import sentry.logging.SentryHandler;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Attaches a {@link SentryHandler} to a JUL logger for the lifetime of the application
 * context and detaches it on close.
 */
public final class SentryLoggingInstaller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SentryLoggingInstaller.class.getName());

    private final Logger target;
    private final SentryHandler handler;

    /**
     * @param sentry     the client records are captured on
     * @param loggerName logger to attach to, empty for the root logger
     * @param level      minimum level forwarded
     */
    public SentryLoggingInstaller(Sentry sentry, String loggerName, Level level) {
        Objects.requireNonNull(sentry, "sentry");
        this.target = Logger.getLogger(loggerName == null ? "" : loggerName);
        this.handler = new SentryHandler(sentry, Objects.requireNonNull(level, "level"));
        target.addHandler(handler);
        logger.log(Level.FINE, "Forwarding " + level + " records from logger '" + target.getName() + "'");
    }

    public SentryHandler handler() {
        return handler;
    }

    @Override
    public void close() {
        target.removeHandler(handler);
        handler.close();
    }
}
