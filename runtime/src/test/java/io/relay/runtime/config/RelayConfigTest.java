package io.relay.runtime.config;

import org.testng.Assert;
import org.testng.annotations.Test;

public class RelayConfigTest {

  @Test
  public void testCreateRelayConfig() {
    RelayConfig relayConfig = RelayConfig.create();
    Assert.assertEquals(relayConfig.actorThreadNamePrefix, "relay-actor");
    Assert.assertEquals(relayConfig.shutdownTimeoutMs, 5000);
    Assert.assertEquals(relayConfig.loggingLevel, "INFO");
  }

  @Test
  public void testSystemPropertyOverridesDefault() {
    String key = "relay.actor.shutdown-timeout-ms";
    System.setProperty(key, "250");
    try {
      RelayConfig relayConfig = RelayConfig.create();
      Assert.assertEquals(relayConfig.shutdownTimeoutMs, 250);
      Assert.assertEquals(relayConfig.getInternalConfig().getLong(key), 250);
    } finally {
      System.clearProperty(key);
    }
    Assert.assertEquals(RelayConfig.create().shutdownTimeoutMs, 5000);
  }

  @Test
  public void testInvalidConfig() {
    String key = "relay.actor.shutdown-timeout-ms";
    System.setProperty(key, "-1");
    try {
      Assert.expectThrows(IllegalArgumentException.class, RelayConfig::create);
    } finally {
      System.clearProperty(key);
    }
  }
}
