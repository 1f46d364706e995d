package io.relay.runtime.actor;

import io.relay.api.id.ActorId;

/** What the tasks of an actor need from it. */
public interface CallTarget {

  ActorId getId();

  /** The actor's state and operations, which calls are dispatched against. */
  ActorInstance<?> getInstance();

  /** Whether the actor still dispatches calls. */
  boolean isAlive();

  void handleSystemEvent(SystemEvent event);

  /** Terminate the actor because one of its tasks failed. */
  void crash(Throwable cause);
}
