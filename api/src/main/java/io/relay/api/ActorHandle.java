package io.relay.api;

import io.relay.api.id.ActorId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * A handle to an actor.
 *
 * <p>A handle is used to invoke operations of the actor, either synchronously with {@code call} or
 * fire-and-forget with {@code async}. For example:
 *
 * <pre>{@code
 * ActorHandle<Counter> counter = Relay.actor(new Counter(), Counter.METHODS);
 * counter.call("increase", 1);
 * int value = (Integer) counter.call("value");
 * }</pre>
 *
 * @param <A> Type of the actor state.
 */
public interface ActorHandle<A> {

  /** Id of the actor. */
  ActorId getId();

  /**
   * Invoke an operation and wait for its result. The calling task is suspended while waiting.
   *
   * @param method Name of the operation.
   * @param args Arguments of the operation.
   * @return The operation's result.
   */
  Object call(String method, Object... args);

  /**
   * Invoke an operation with a block and wait for its result.
   *
   * @param method Name of the operation.
   * @param args Arguments of the operation.
   * @param block The callback closure passed along.
   * @param execution Where the block is made available.
   * @return The operation's result.
   */
  Object call(String method, List<Object> args, Block block, BlockExecution execution);

  /**
   * Invoke an operation without waiting. Failures never reach the caller.
   *
   * @param method Name of the operation.
   * @param args Arguments of the operation.
   */
  void async(String method, Object... args);

  /** Whether the actor is still accepting calls. */
  boolean isAlive();

  /** Ask the actor to terminate. Calls still queued fail with a dead actor error. */
  void terminate();

  /**
   * Wait until the actor has stopped.
   *
   * @return True if the actor stopped, false if the timeout elapsed first.
   */
  boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

  /** The failure that crashed the actor, if any. */
  Optional<Throwable> getExitReason();
}
