package io.relay.api.exception;

/**
 * Indicates that a call was sent to an actor that no longer exists.
 *
 * <p>This happens either because the actor was already terminated when the call was sent, or
 * because it terminated (or crashed) with the call still in its mailbox.
 */
public class DeadActorException extends RelayException {

  public DeadActorException() {
    super("attempted to call a dead actor");
  }

  public DeadActorException(String message) {
    super(message);
  }

  public DeadActorException(String message, Throwable cause) {
    super(message, cause);
  }
}
