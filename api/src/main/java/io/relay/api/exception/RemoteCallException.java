package io.relay.api.exception;

/**
 * Carries a checked exception raised by a callee back into the caller. Unchecked exceptions are
 * re-raised as they are; this wrapper is only used where Java forbids it.
 */
public class RemoteCallException extends RelayException {

  public RemoteCallException(Throwable cause) {
    super("Remote call failed: " + cause, cause);
  }
}
