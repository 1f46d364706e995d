package io.relay.runtime.task;

import com.google.common.base.Preconditions;
import io.relay.api.id.TaskId;
import io.relay.runtime.actor.CallTarget;
import io.relay.runtime.actor.SystemEvent;
import io.relay.runtime.call.BlockCall;
import io.relay.runtime.call.Call;
import io.relay.runtime.call.Resumption;
import io.relay.runtime.context.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Decides which messages a task takes from its mailbox, and dispatches them. */
public final class MessageRouter {

  private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

  private MessageRouter() {}

  /**
   * Whether a task waiting to be resumed as {@code waiting} takes this message.
   *
   * <p>It takes resumptions addressed to it, block calls, and, if it runs on an actor, system
   * events. Inbound calls are taken too unless the task is in exclusive mode.
   */
  public static boolean accepts(TaskContext task, TaskId waiting, Object message) {
    if (message instanceof Resumption) {
      return ((Resumption) message).getTask().equals(waiting);
    }
    if (message instanceof BlockCall) {
      return true;
    }
    if (message instanceof SystemEvent) {
      return task.getActor() != null;
    }
    if (message instanceof Call) {
      return task.getActor() != null && !task.isExclusive();
    }
    return false;
  }

  /** Dispatch a message received by a task. Calls and block calls run in a child task. */
  public static void route(TaskContext task, Object message) {
    if (message instanceof SystemEvent) {
      CallTarget actor = task.getActor();
      Preconditions.checkState(actor != null, "System event %s outside of an actor.", message);
      actor.handleSystemEvent((SystemEvent) message);
    } else if (message instanceof Resumption) {
      Resumption resumption = (Resumption) message;
      if (!task.getScheduler().isSuspended(resumption.getTask())) {
        LOGGER.warn(
            "Discarding {}, task {} isn't waiting for it.", resumption, resumption.getTask());
        return;
      }
      resumption.dispatch();
    } else if (message instanceof BlockCall) {
      TaskContext previous = TaskContext.enter(task.newChild());
      try {
        ((BlockCall) message).dispatch();
      } finally {
        TaskContext.restore(previous);
      }
    } else if (message instanceof Call) {
      dispatchCall(task, (Call) message);
    } else {
      LOGGER.warn("Discarding unknown message {}.", message);
    }
  }

  private static void dispatchCall(TaskContext task, Call call) {
    CallTarget actor = task.getActor();
    Preconditions.checkState(actor != null, "Call %s outside of an actor.", call);
    if (!actor.isAlive()) {
      call.cleanup();
      return;
    }
    TaskContext previous = TaskContext.enter(task.newChild());
    try {
      call.dispatch(actor.getInstance());
    } catch (Throwable e) {
      // The failure ends the task it was raised in, and takes the actor down with it.
      actor.crash(e);
    } finally {
      TaskContext.restore(previous);
    }
  }
}
