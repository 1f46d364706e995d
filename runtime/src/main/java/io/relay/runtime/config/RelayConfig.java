package io.relay.runtime.config;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;
import java.io.File;

/** Configurations of Relay runtime. See `relay.default.conf` for the meaning of each field. */
public class RelayConfig {

  public static final String DEFAULT_CONFIG_FILE = "relay.default.conf";
  public static final String CUSTOM_CONFIG_FILE = "relay.conf";

  private final Config config;

  /** Prefix of the names of actor threads. */
  public final String actorThreadNamePrefix;

  /** How long shutdown waits for actors to stop. */
  public final long shutdownTimeoutMs;

  public final String loggingLevel;

  public final String loggingPattern;

  public RelayConfig(Config config) {
    this.config = config;
    actorThreadNamePrefix = config.getString("relay.actor.thread-name-prefix");
    shutdownTimeoutMs = config.getLong("relay.actor.shutdown-timeout-ms");
    loggingLevel = config.getString("relay.logging.level");
    loggingPattern = config.getString("relay.logging.pattern");
    validate();
  }

  private void validate() {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(actorThreadNamePrefix), "Actor thread name prefix must be set.");
    Preconditions.checkArgument(
        shutdownTimeoutMs >= 0, "Shutdown timeout must not be negative: %s", shutdownTimeoutMs);
  }

  public Config getInternalConfig() {
    return config;
  }

  /** Renders the config value as a HOCON string. */
  @Override
  public String toString() {
    return config.root().render(ConfigRenderOptions.concise());
  }

  /**
   * Create a RelayConfig by reading configuration in the following order: 1. System properties.
   * 2. `relay.conf` file, or the file named by the `relay.config-file` property. 3.
   * `relay.default.conf` file.
   */
  public static RelayConfig create() {
    ConfigFactory.invalidateCaches();
    Config config = ConfigFactory.systemProperties();
    String configPath = System.getProperty("relay.config-file");
    if (Strings.isNullOrEmpty(configPath)) {
      config = config.withFallback(ConfigFactory.load(CUSTOM_CONFIG_FILE));
    } else {
      config = config.withFallback(ConfigFactory.parseFile(new File(configPath)));
    }
    config = config.withFallback(ConfigFactory.load(DEFAULT_CONFIG_FILE));
    return new RelayConfig(config.withOnlyPath("relay"));
  }
}
