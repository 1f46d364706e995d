package io.relay.api;

/** Where the block of a call is made available. */
public enum BlockExecution {

  /**
   * The block stays with the sender. The invoked operation doesn't receive it; only the sender's
   * own tasks may run it.
   */
  SENDER,

  /**
   * The invoked operation receives the block. Calling it from the receiver performs a synchronous
   * round trip that runs the closure on the sender's task, where its captured state lives.
   */
  RECEIVER
}
