package io.relay.runtime.call;

import com.google.common.base.MoreObjects;
import io.relay.api.id.TaskId;
import io.relay.runtime.context.TaskContext;

/** The answer to a {@link SyncCall}. */
public abstract class Response implements Resumption {

  private final TaskId task;

  private final Object value;

  protected Response(TaskId task, Object value) {
    this.task = task;
    this.value = value;
  }

  @Override
  public TaskId getTask() {
    return task;
  }

  /** Resume the waiting task with this response. */
  @Override
  public void dispatch() {
    TaskContext.current().getScheduler().resume(task, this);
  }

  /** The result of the call. */
  public Object value() {
    return value;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("task", task).toString();
  }
}
