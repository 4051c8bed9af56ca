package sentry.envelope;

import java.util.Objects;

/**
 * Name and version of the SDK that produced an envelope.
 */
public record SdkInfo(String name, String version) {
  public SdkInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
  }
}
