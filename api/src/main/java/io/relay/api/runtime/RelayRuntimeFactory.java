package io.relay.api.runtime;

/** A factory that produces a RelayRuntime instance. */
public interface RelayRuntimeFactory {

  RelayRuntime createRelayRuntime();
}
