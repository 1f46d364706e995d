package io.relay.api;

/**
 * A callback closure passed along with a call. Depending on its {@link BlockExecution}, invoking it
 * from inside the callee may transparently run it on the caller's side.
 */
@FunctionalInterface
public interface Block {

  Object call(Object... args);
}
