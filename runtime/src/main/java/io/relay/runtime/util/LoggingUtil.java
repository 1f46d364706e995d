package io.relay.runtime.util;

import io.relay.runtime.config.RelayConfig;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilderFactory;
import org.apache.logging.log4j.core.config.builder.api.RootLoggerComponentBuilder;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;

public class LoggingUtil {

  private static boolean setup = false;

  /** Print the runtime's logs to the console, with the level and pattern of the config. */
  public static synchronized void setupLogging(RelayConfig relayConfig) {
    if (setup) {
      return;
    }
    setup = true;

    ConfigurationBuilder<BuiltConfiguration> builder =
        ConfigurationBuilderFactory.newConfigurationBuilder();

    builder.setStatusLevel(Level.WARN);
    builder.setConfigurationName("DefaultLogger");

    // create a console appender
    AppenderComponentBuilder appenderBuilder =
        builder
            .newAppender("Console", "CONSOLE")
            .addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    appenderBuilder.add(
        builder.newLayout("PatternLayout").addAttribute("pattern", relayConfig.loggingPattern));
    RootLoggerComponentBuilder rootLogger =
        builder.newRootLogger(Level.toLevel(relayConfig.loggingLevel, Level.INFO));
    rootLogger.add(builder.newAppenderRef("Console"));

    builder.add(appenderBuilder);
    builder.add(rootLogger);
    Configurator.reconfigure(builder.build());
  }
}
