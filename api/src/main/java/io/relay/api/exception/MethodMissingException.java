package io.relay.api.exception;

/** The target actor has no operation with the requested name. */
public class MethodMissingException extends RelayException {

  public final String methodName;

  public MethodMissingException(String methodName, String targetDescription) {
    super(String.format("undefined method `%s' for %s", methodName, targetDescription));
    this.methodName = methodName;
  }
}
