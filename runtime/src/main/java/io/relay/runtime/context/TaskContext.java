package io.relay.runtime.context;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.relay.api.id.TaskId;
import io.relay.runtime.actor.CallTarget;
import io.relay.runtime.mailbox.Mailbox;
import io.relay.runtime.task.TaskScheduler;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * The context of the task running on the current thread.
 *
 * <p>Every message an actor dispatches runs in a task of its own. A task knows the mailbox it
 * receives from, the actor it runs on (null for threads that aren't actors), and owns the call
 * chain id slot.
 */
public final class TaskContext {

  private static final ThreadLocal<TaskContext> CURRENT = new ThreadLocal<>();

  private final TaskId taskId;

  private final Mailbox mailbox;

  private final CallTarget actor;

  private final TaskScheduler scheduler;

  private String chainId = null;

  private boolean exclusive = false;

  public TaskContext(TaskId taskId, Mailbox mailbox, CallTarget actor, TaskScheduler scheduler) {
    this.taskId = Preconditions.checkNotNull(taskId);
    this.mailbox = Preconditions.checkNotNull(mailbox);
    this.actor = actor;
    this.scheduler = Preconditions.checkNotNull(scheduler);
  }

  /** Get the context of the current task. */
  public static TaskContext current() {
    TaskContext context = CURRENT.get();
    Preconditions.checkState(
        context != null,
        "Current task is not set. Calls can only be made from actors or from threads that have "
            + "entered a task context.");
    return context;
  }

  public static Optional<TaskContext> currentIfPresent() {
    return Optional.ofNullable(CURRENT.get());
  }

  /**
   * Make a context the current one of this thread.
   *
   * @return The previous context, to be passed to {@link #restore}.
   */
  public static TaskContext enter(TaskContext context) {
    TaskContext previous = CURRENT.get();
    CURRENT.set(context);
    return previous;
  }

  public static void restore(TaskContext previous) {
    if (previous == null) {
      CURRENT.remove();
    } else {
      CURRENT.set(previous);
    }
  }

  /** Create the context of a new task on the same actor and mailbox. */
  public TaskContext newChild() {
    return new TaskContext(TaskId.fromRandom(), mailbox, actor, scheduler);
  }

  /** Run a body in exclusive mode. */
  public <T> T exclusive(Callable<T> body) throws Exception {
    boolean previous = exclusive;
    exclusive = true;
    try {
      return body.call();
    } finally {
      exclusive = previous;
    }
  }

  public TaskId getTaskId() {
    return taskId;
  }

  public Mailbox getMailbox() {
    return mailbox;
  }

  /** The actor this task runs on, or null. */
  public CallTarget getActor() {
    return actor;
  }

  public TaskScheduler getScheduler() {
    return scheduler;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  Optional<String> getChainId() {
    return Optional.ofNullable(chainId);
  }

  void setChainId(String chainId) {
    this.chainId = chainId;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("taskId", taskId)
        .add("mailbox", mailbox)
        .add("exclusive", exclusive)
        .toString();
  }
}
