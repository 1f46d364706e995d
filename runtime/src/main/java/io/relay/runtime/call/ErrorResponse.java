package io.relay.runtime.call;

import com.google.common.base.Throwables;
import com.google.common.collect.ObjectArrays;
import io.relay.api.exception.AbortException;
import io.relay.api.exception.RemoteCallException;

/** The call failed, either because the sender broke the protocol or because the callee raised. */
public class ErrorResponse extends Response {

  /** Marks where the trace of a failure crosses from the callee into the caller. */
  static final StackTraceElement REMOTE_CALL_FRAME =
      new StackTraceElement("<relay>", "remote procedure call", null, -1);

  public ErrorResponse(SyncCall call, Throwable exception) {
    super(call.getTask(), exception);
  }

  /** The failure as sent by the callee. */
  public Throwable getException() {
    return (Throwable) super.value();
  }

  /**
   * Re-raise the failure in the caller. An abort is unwrapped to its cause. The failure's trace is
   * extended with a remote call frame and the caller's own stack.
   */
  @Override
  public Object value() {
    Throwable exception = getException();
    if (exception instanceof AbortException && exception.getCause() != null) {
      exception = exception.getCause();
    }

    StackTraceElement[] trace = exception.getStackTrace();
    if (trace.length > 0) {
      StackTraceElement[] local = new Throwable().getStackTrace();
      exception.setStackTrace(
          ObjectArrays.concat(
              ObjectArrays.concat(trace, REMOTE_CALL_FRAME), local, StackTraceElement.class));
    }

    Throwables.throwIfUnchecked(exception);
    throw new RemoteCallException(exception);
  }
}
