package io.relay.api.exception;

/** Base class of all exceptions raised by the Relay runtime. */
public class RelayException extends RuntimeException {

  public RelayException(String message) {
    super(message);
  }

  public RelayException(String message, Throwable cause) {
    super(message, cause);
  }
}
