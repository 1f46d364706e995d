package io.relay.runtime.call;

import com.google.common.base.MoreObjects;
import io.relay.api.exception.DeadActorException;
import io.relay.api.id.TaskId;
import io.relay.runtime.mailbox.Mailbox;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A request to run a block on the side that supplied it. */
public class BlockCall {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlockCall.class);

  private final BlockProxy proxy;

  /** Mailbox of the task that invoked the block. */
  private final Mailbox sender;

  private final List<Object> arguments;

  /** The task that invoked the block, waiting for the result. */
  private final TaskId task;

  BlockCall(BlockProxy proxy, Mailbox sender, List<Object> arguments, TaskId task) {
    this.proxy = proxy;
    this.sender = sender;
    this.arguments = Collections.unmodifiableList(arguments);
    this.task = task;
  }

  /** Run the block and send the result back to the task that invoked it. */
  public void dispatch() {
    Object result;
    try {
      result = proxy.getBlock().call(arguments.toArray());
    } catch (Throwable e) {
      // Errors included. The invoking task stays suspended until a response arrives.
      LOGGER.debug("Block invoked by task {} failed.", task, e);
      sender.send(BlockResponse.failed(this, e));
      return;
    }
    sender.send(new BlockResponse(this, result));
  }

  /** Called when the block's owner is dead, so the invoking task isn't left waiting. */
  public void cleanup() {
    sender.send(BlockResponse.failed(this, new DeadActorException("block owner is dead")));
  }

  public TaskId getTask() {
    return task;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("task", task)
        .add("arguments", arguments.size())
        .toString();
  }
}
