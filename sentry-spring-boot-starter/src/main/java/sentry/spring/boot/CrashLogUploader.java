package sentry.spring.boot;

import sentry.Sentry;
import sentry.model.EventId;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uploads the crash log left by a previous run once the application is ready.
 */
public class CrashLogUploader implements ApplicationListener<ApplicationReadyEvent> {
    private static final Logger logger = Logger.getLogger(CrashLogUploader.class.getName());

    private final Sentry sentry;
    private final Path path;

    public CrashLogUploader(Sentry sentry, Path path) {
        this.sentry = Objects.requireNonNull(sentry, "sentry");
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        upload();
    }

    /**
     * Queues every crash found in the log and truncates it. A failure is logged and leaves the
     * file in place for the next start.
     *
     * @return ids of the queued crash events
     */
    public List<EventId> upload() {
        try {
            return sentry.uploadCrashLog(path);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to upload crash log " + path, e);
            return List.of();
        }
    }
}
