package io.relay.runtime.task;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.SettableFuture;
import io.relay.api.exception.DeadActorException;
import io.relay.api.exception.MailboxClosedException;
import io.relay.api.id.TaskId;
import io.relay.runtime.context.TaskContext;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A scheduler whose suspended tasks keep draining their mailbox.
 *
 * <p>Each suspension registers a one-shot channel under the task's id. While the channel is empty,
 * the suspended task receives the messages it accepts (see {@link MessageRouter#accepts}) and
 * routes them, so the actor stays responsive to the messages that may eventually resume it.
 */
public class MailboxTaskScheduler implements TaskScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(MailboxTaskScheduler.class);

  /** Suspended tasks, keyed by task id. */
  private final ConcurrentMap<TaskId, SettableFuture<Object>> suspendedTasks =
      new ConcurrentHashMap<>();

  @Override
  public TaskId current() {
    return TaskContext.current().getTaskId();
  }

  @Override
  public Object suspend(String tag, Object payload) {
    TaskContext task = TaskContext.current();
    TaskId taskId = task.getTaskId();
    SettableFuture<Object> channel = SettableFuture.create();
    Preconditions.checkState(
        suspendedTasks.putIfAbsent(taskId, channel) == null,
        "Task %s is already suspended.",
        taskId);
    LOGGER.debug("Task {} suspended on {}: {}", taskId, tag, payload);
    try {
      while (!channel.isDone()) {
        Object message = task.getMailbox().receive(m -> MessageRouter.accepts(task, taskId, m));
        MessageRouter.route(task, message);
      }
    } catch (MailboxClosedException e) {
      throw new DeadActorException(
          String.format("Actor terminated while task %s was waiting on %s.", taskId, tag), e);
    } finally {
      suspendedTasks.remove(taskId, channel);
    }
    LOGGER.debug("Task {} resumed from {}.", taskId, tag);
    return Futures.getUnchecked(channel);
  }

  @Override
  public void resume(TaskId taskId, Object value) {
    SettableFuture<Object> channel = suspendedTasks.remove(taskId);
    Preconditions.checkState(
        channel != null, "Task %s is not suspended, it can't be resumed.", taskId);
    channel.set(value);
  }

  @Override
  public boolean isSuspended(TaskId taskId) {
    return suspendedTasks.containsKey(taskId);
  }
}
