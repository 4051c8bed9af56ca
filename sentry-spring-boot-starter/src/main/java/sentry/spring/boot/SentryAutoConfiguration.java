package sentry.spring.boot;

import sentry.Sentry;
import sentry.SentryOptions;
import sentry.filter.BeforeSendHook;
import sentry.spi.MetricsExporter;
import sentry.transport.Transport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.logging.Level;

/**
 * Auto-configuration for the event client.
 *
 * <p>Builds a {@link Sentry} client from {@link SentryProperties} once {@code sentry.dsn} is
 * set. Optional {@link BeforeSendHook}, {@link Transport} and {@link MetricsExporter} beans are
 * picked up. Unless disabled, a JUL handler forwards {@code WARNING} records, and a configured
 * crash log is uploaded when the application is ready.
 *
 * @see SentryProperties
 * @see SentryMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Sentry.class)
@ConditionalOnProperty(prefix = "sentry", name = "dsn")
@EnableConfigurationProperties(SentryProperties.class)
public class SentryAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public SentryOptions sentryOptions(SentryProperties props) {
    SentryOptions.Builder builder = SentryOptions.builder()
        .dsn(props.getDsn())
        .release(props.getRelease())
        .environment(props.getEnvironment())
        .sampleRate(props.getSampleRate())
        .maxAttachmentSize(props.getMaxAttachmentSize())
        .maxQueueSize(props.getMaxQueueSize())
        .flushInterval(props.getFlushInterval())
        .drainTimeout(props.getDrainTimeout())
        .requestTimeout(props.getRequestTimeout());
    if (props.getServerName() != null) {
      builder.serverName(props.getServerName());
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Sentry sentry(SentryOptions options,
      ObjectProvider<BeforeSendHook> beforeSendProvider,
      ObjectProvider<Transport> transportProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return Sentry.builder()
        .options(options)
        .beforeSend(beforeSendProvider.getIfAvailable())
        .transport(transportProvider.getIfAvailable())
        .metrics(metricsProvider.getIfAvailable())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "sentry.logging", name = "enabled", matchIfMissing = true)
  public SentryLoggingInstaller sentryLoggingInstaller(Sentry sentry, SentryProperties props) {
    return new SentryLoggingInstaller(sentry, props.getLogging().getLoggerName(),
        Level.parse(props.getLogging().getLevel()));
  }

  @Bean
  @ConditionalOnProperty(prefix = "sentry.crash-log", name = "path")
  public CrashLogUploader crashLogUploader(Sentry sentry, SentryProperties props) {
    return new CrashLogUploader(sentry, props.getCrashLog().getPath());
  }
}
