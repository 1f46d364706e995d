package io.relay.api.exception;

/**
 * Indicates that a call was rejected because the caller broke the call protocol, e.g. it named an
 * operation the target doesn't have or passed the wrong number of arguments.
 *
 * <p>An abort is the caller's fault. The callee reports it back to the sender but its own task
 * keeps running. The original error is available as {@link #getCause()}.
 */
public class AbortException extends RelayException {

  public AbortException(Throwable cause) {
    super("Call aborted: " + cause.getMessage(), cause);
  }
}
