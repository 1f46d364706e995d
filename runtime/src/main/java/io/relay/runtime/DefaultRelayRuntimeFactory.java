package io.relay.runtime;

import io.relay.api.runtime.RelayRuntime;
import io.relay.api.runtime.RelayRuntimeFactory;
import io.relay.runtime.config.RelayConfig;
import io.relay.runtime.util.LoggingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The default Relay runtime factory. It produces an instance of RelayRuntime. */
public class DefaultRelayRuntimeFactory implements RelayRuntimeFactory {

  @Override
  public RelayRuntime createRelayRuntime() {
    RelayConfig relayConfig = RelayConfig.create();
    LoggingUtil.setupLogging(relayConfig);
    Logger logger = LoggerFactory.getLogger(DefaultRelayRuntimeFactory.class);

    try {
      logger.debug("Initializing runtime with config: {}", relayConfig);
      return new LocalRelayRuntime(relayConfig);
    } catch (Exception e) {
      logger.error("Failed to initialize relay runtime, with config " + relayConfig, e);
      throw new RuntimeException("Failed to initialize relay runtime", e);
    }
  }
}
