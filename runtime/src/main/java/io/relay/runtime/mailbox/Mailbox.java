package io.relay.runtime.mailbox;

import java.util.function.Predicate;

/** The inbound queue of an actor (or of a thread that isn't an actor but makes calls). */
public interface Mailbox {

  /**
   * Deliver a message. Delivering to a closed mailbox hands the message to the mailbox's dead
   * letter handler instead.
   */
  void send(Object message);

  /**
   * Take the oldest message matching the predicate, blocking the current task until one arrives.
   * Messages that don't match stay in the mailbox, in order.
   *
   * @throws io.relay.api.exception.MailboxClosedException If the mailbox is closed.
   */
  Object receive(Predicate<Object> predicate);

  /** Close the mailbox and hand all pending messages to the dead letter handler. */
  void close();

  boolean isClosed();
}
