package io.relay.api.exception;

/** The number of arguments passed to an operation doesn't match its declared arity. */
public class ArgumentCountException extends RelayException {

  public final int given;

  public ArgumentCountException(int given, String expected) {
    super(String.format("wrong number of arguments (%d for %s)", given, expected));
    this.given = given;
  }
}
