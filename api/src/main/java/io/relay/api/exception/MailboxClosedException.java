package io.relay.api.exception;

/** Raised when receiving from a mailbox whose actor has terminated. */
public class MailboxClosedException extends RelayException {

  public MailboxClosedException(String message) {
    super(message);
  }
}
