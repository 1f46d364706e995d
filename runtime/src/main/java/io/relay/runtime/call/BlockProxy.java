package io.relay.runtime.call;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import io.relay.api.Block;
import io.relay.api.BlockExecution;
import io.relay.api.exception.RemoteCallException;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.Mailbox;
import java.util.Arrays;

/**
 * Wraps the block of a call. Called by the task that supplied it, the block runs right away.
 * Called from any other task, the proxy sends a {@link BlockCall} to the owner and suspends the
 * calling task until the {@link BlockResponse} comes back.
 */
public class BlockProxy implements Block {

  static final String SUSPEND_TAG = "invokeblock";

  private final Block block;

  private final BlockExecution execution;

  /** Mailbox of the task that supplied the block. */
  private final Mailbox mailbox;

  BlockProxy(Block block, BlockExecution execution, Mailbox mailbox) {
    this.block = Preconditions.checkNotNull(block);
    this.execution = execution;
    this.mailbox = mailbox;
  }

  @Override
  public Object call(Object... args) {
    TaskContext caller = TaskContext.current();
    if (caller.getMailbox() == mailbox) {
      return block.call(args);
    }
    BlockCall call =
        new BlockCall(this, caller.getMailbox(), Arrays.asList(args), caller.getTaskId());
    mailbox.send(call);
    Object result = caller.getScheduler().suspend(SUSPEND_TAG, call);
    if (result instanceof BlockResponse.Failure) {
      Throwable cause = ((BlockResponse.Failure) result).cause;
      Throwables.throwIfUnchecked(cause);
      throw new RemoteCallException(cause);
    }
    return result;
  }

  public Block getBlock() {
    return block;
  }

  public BlockExecution getExecution() {
    return execution;
  }

  public Mailbox getMailbox() {
    return mailbox;
  }
}
