package io.relay.runtime.context;

import java.util.Optional;
import java.util.UUID;

/**
 * Access to the call chain id of the current task. A chain id links a call with the calls it makes
 * in turn. It's set while a call is dispatched and cleared afterwards.
 */
public final class CallChain {

  private CallChain() {}

  /** The chain id of the current task, empty outside of a dispatch. */
  public static Optional<String> currentId() {
    return TaskContext.currentIfPresent().flatMap(TaskContext::getChainId);
  }

  public static void setCurrentId(String chainId) {
    TaskContext.current().setChainId(chainId);
  }

  public static void clear() {
    TaskContext.currentIfPresent().ifPresent(context -> context.setChainId(null));
  }

  /** Generate a new unique chain id. */
  public static String generate() {
    return UUID.randomUUID().toString();
  }
}
