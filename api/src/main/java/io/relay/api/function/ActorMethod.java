package io.relay.api.function;

import io.relay.api.Block;
import java.util.List;

/**
 * Handler of one operation of an actor type.
 *
 * @param <A> Type of the actor state.
 */
@FunctionalInterface
public interface ActorMethod<A> {

  /**
   * Invoke the operation.
   *
   * @param actor The actor state.
   * @param args The call arguments, already checked against the declared arity.
   * @param block The block passed with the call, or null if none is available to the receiver.
   * @return The result of the operation, may be null.
   */
  Object invoke(A actor, List<Object> args, Block block) throws Exception;
}
