package io.relay.runtime.actor;

/** Asks an actor to terminate. */
public final class TerminationRequest implements SystemEvent {

  @Override
  public String toString() {
    return "TerminationRequest";
  }
}
