package io.relay.runtime.call;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import io.relay.api.Block;
import io.relay.api.BlockExecution;
import io.relay.api.exception.AbortException;
import io.relay.api.exception.DeadActorException;
import io.relay.api.exception.MailboxClosedException;
import io.relay.api.id.TaskId;
import io.relay.runtime.actor.ActorInstance;
import io.relay.runtime.actor.SystemEvent;
import io.relay.runtime.context.CallChain;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.Mailbox;
import io.relay.runtime.task.MessageRouter;
import java.util.List;

/**
 * A call whose sender waits for the result.
 *
 * <p>The callee answers with a {@link SuccessResponse} or an {@link ErrorResponse} addressed to the
 * waiting task. Failures are re-raised in the sender by {@link #value()}. A failure that isn't an
 * {@link AbortException} is also re-raised in the callee, since it's the callee's bug.
 */
public class SyncCall extends Call {

  static final String SUSPEND_TAG = "callwait";

  private final Mailbox sender;

  private final TaskId task;

  private final String chainId;

  /**
   * Create a sync call.
   *
   * @param sender Mailbox the response is sent to.
   * @param task The task waiting for the response.
   * @param chainId The call chain this call belongs to, or null to start a new chain.
   */
  public SyncCall(
      Mailbox sender,
      TaskId task,
      String chainId,
      String method,
      List<?> arguments,
      Block block,
      BlockExecution execution) {
    super(method, arguments, block, execution);
    this.sender = Preconditions.checkNotNull(sender);
    this.task = Preconditions.checkNotNull(task);
    this.chainId = chainId != null ? chainId : CallChain.generate();
  }

  /** Create a sync call from the current task, continuing its call chain. */
  public static SyncCall create(
      String method, List<?> arguments, Block block, BlockExecution execution) {
    TaskContext context = TaskContext.current();
    return new SyncCall(
        context.getMailbox(),
        context.getTaskId(),
        CallChain.currentId().orElse(null),
        method,
        arguments,
        block,
        execution);
  }

  @Override
  public Object dispatch(ActorInstance<?> target) throws Exception {
    CallChain.setCurrentId(chainId);
    try {
      Object result = super.dispatch(target);
      respond(new SuccessResponse(task, result));
      return result;
    } catch (Throwable e) {
      respond(new ErrorResponse(this, e));
      if (e instanceof AbortException) {
        // The sender broke the protocol. It gets the error, this actor carries on.
        return null;
      }
      Throwables.throwIfInstanceOf(e, Exception.class);
      Throwables.throwIfUnchecked(e);
      throw new AssertionError(e);
    } finally {
      CallChain.clear();
    }
  }

  @Override
  public void cleanup() {
    respond(new ErrorResponse(this, new DeadActorException()));
  }

  private void respond(Object message) {
    sender.send(message);
  }

  /** Suspend the current task until the response arrives. */
  public Response response() {
    return (Response) TaskContext.current().getScheduler().suspend(SUSPEND_TAG, this);
  }

  /**
   * Wait for the response and unwrap it.
   *
   * @return The result of the operation.
   * @throws RuntimeException The failure of the call, re-raised in the caller.
   */
  public Object value() {
    Response response = TaskContext.current().isExclusive() ? awaitResponse() : response();
    return response.value();
  }

  /**
   * Receive from the current task's mailbox until the response arrives, dispatching block calls
   * and handling system events in the meantime.
   */
  public Response awaitResponse() {
    TaskContext context = TaskContext.current();
    while (true) {
      Object message;
      try {
        message = context.getMailbox().receive(m -> MessageRouter.accepts(context, task, m));
      } catch (MailboxClosedException e) {
        throw new DeadActorException("Actor terminated while waiting on call `" + method + "`", e);
      }
      if (message instanceof SystemEvent) {
        context.getActor().handleSystemEvent((SystemEvent) message);
      } else if (message instanceof Response) {
        return (Response) message;
      } else {
        MessageRouter.route(context, message);
      }
    }
  }

  public TaskId getTask() {
    return task;
  }

  public String getChainId() {
    return chainId;
  }
}
