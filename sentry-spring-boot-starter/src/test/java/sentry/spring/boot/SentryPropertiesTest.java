package sentry.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentryPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(SentryProperties.class);
            assertNull(props.getDsn());
            assertNull(props.getServerName());
            assertEquals(1.0, props.getSampleRate());
            assertEquals(20_971_520, props.getMaxAttachmentSize());
            assertEquals(0, props.getMaxQueueSize());
            assertEquals(Duration.ofSeconds(5), props.getFlushInterval());
            assertEquals(Duration.ofSeconds(5), props.getDrainTimeout());
            assertEquals(Duration.ofSeconds(30), props.getRequestTimeout());
            assertTrue(props.getLogging().isEnabled());
            assertEquals("", props.getLogging().getLoggerName());
            assertEquals("WARNING", props.getLogging().getLevel());
            assertNull(props.getCrashLog().getPath());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("sentry", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "sentry.dsn=https://key@ingest.example.com/42",
                "sentry.server-name=web-1",
                "sentry.release=shop@1.4.2",
                "sentry.environment=staging",
                "sentry.sample-rate=0.25",
                "sentry.max-queue-size=500",
                "sentry.flush-interval=2s",
                "sentry.drain-timeout=500ms",
                "sentry.request-timeout=10s",
                "sentry.logging.enabled=false",
                "sentry.logging.logger-name=com.shop",
                "sentry.logging.level=SEVERE",
                "sentry.crash-log.path=/var/lib/shop/crash.log",
                "sentry.metrics.name-prefix=shop.sentry"
        ).run(ctx -> {
            var props = ctx.getBean(SentryProperties.class);
            assertEquals("https://key@ingest.example.com/42", props.getDsn());
            assertEquals("web-1", props.getServerName());
            assertEquals("shop@1.4.2", props.getRelease());
            assertEquals("staging", props.getEnvironment());
            assertEquals(0.25, props.getSampleRate());
            assertEquals(500, props.getMaxQueueSize());
            assertEquals(Duration.ofSeconds(2), props.getFlushInterval());
            assertEquals(Duration.ofMillis(500), props.getDrainTimeout());
            assertEquals(Duration.ofSeconds(10), props.getRequestTimeout());
            assertFalse(props.getLogging().isEnabled());
            assertEquals("com.shop", props.getLogging().getLoggerName());
            assertEquals("SEVERE", props.getLogging().getLevel());
            assertEquals(Path.of("/var/lib/shop/crash.log"), props.getCrashLog().getPath());
            assertEquals("shop.sentry", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(SentryProperties.class)
    static class PropsConfig {
    }
}
