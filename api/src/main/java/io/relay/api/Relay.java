package io.relay.api;

import io.relay.api.function.ActorMethodTable;
import io.relay.api.runtime.RelayRuntime;
import io.relay.api.runtime.RelayRuntimeFactory;
import java.util.Optional;
import java.util.concurrent.Callable;

/** This class contains all public APIs of Relay. */
public final class Relay {

  private static RelayRuntime runtime = null;

  private Relay() {}

  /** Initialize Relay runtime with the default runtime implementation. */
  public static void init() {
    try {
      Class<?> clz = Class.forName("io.relay.runtime.DefaultRelayRuntimeFactory");
      RelayRuntimeFactory factory =
          (RelayRuntimeFactory) clz.getDeclaredConstructor().newInstance();
      init(factory);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to initialize Relay runtime.", e);
    }
  }

  /**
   * Initialize Relay runtime with a custom runtime implementation.
   *
   * @param factory A factory that produces the runtime instance.
   */
  public static synchronized void init(RelayRuntimeFactory factory) {
    if (runtime == null) {
      runtime = factory.createRelayRuntime();
      Runtime.getRuntime().addShutdownHook(new Thread(Relay::shutdown));
    }
  }

  /** Shutdown Relay runtime. */
  public static synchronized void shutdown() {
    if (runtime != null) {
      runtime.shutdown();
      runtime = null;
    }
  }

  /**
   * Check if {@link #init} has been called yet.
   *
   * @return True if {@link #init} has already been called and false otherwise.
   */
  public static boolean isInitialized() {
    return runtime != null;
  }

  /**
   * Create an actor.
   *
   * @param state The actor state.
   * @param methods The operations of the actor.
   * @return A handle to the actor.
   */
  public static <A> ActorHandle<A> actor(A state, ActorMethodTable<A> methods) {
    return internal().createActor(state, methods);
  }

  /** Run a body in exclusive mode on the current task. */
  public static <T> T exclusive(Callable<T> body) {
    return internal().exclusive(body);
  }

  /** The call chain id of the current task. */
  public static Optional<String> currentChainId() {
    return internal().currentChainId();
  }

  /** Get the underlying runtime instance. */
  public static RelayRuntime internal() {
    if (runtime == null) {
      throw new IllegalStateException(
          "Relay has not been started yet. You can start Relay with 'Relay.init()'");
    }
    return runtime;
  }
}
