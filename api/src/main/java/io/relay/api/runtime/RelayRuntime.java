package io.relay.api.runtime;

import io.relay.api.ActorHandle;
import io.relay.api.function.ActorMethodTable;
import java.util.Optional;
import java.util.concurrent.Callable;

/** Base interface of a Relay runtime. */
public interface RelayRuntime {

  /** Shutdown the runtime. */
  void shutdown();

  /**
   * Create an actor.
   *
   * @param state The actor state. It's only touched by the actor's own tasks from now on.
   * @param methods The operations of the actor.
   * @return A handle to the actor.
   */
  <A> ActorHandle<A> createActor(A state, ActorMethodTable<A> methods);

  /**
   * Run a body in exclusive mode. While it runs, the current task won't dispatch other inbound
   * calls when it waits for a response, and calls with blocks can't be made.
   */
  <T> T exclusive(Callable<T> body);

  /** The call chain id of the current task, if it's dispatching a call. */
  Optional<String> currentChainId();
}
