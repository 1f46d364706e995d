package io.relay.runtime.call;

import com.google.common.base.MoreObjects;
import io.relay.api.id.TaskId;
import io.relay.runtime.context.TaskContext;

/**
 * The result of a {@link BlockCall}. It resumes the task that invoked the block with the block's
 * raw result.
 */
public class BlockResponse implements Resumption {

  /** Resumption value of a block that raised. The invoking task re-raises the cause. */
  static final class Failure {

    final Throwable cause;

    Failure(Throwable cause) {
      this.cause = cause;
    }
  }

  private final TaskId task;

  private final Object result;

  BlockResponse(BlockCall call, Object result) {
    this.task = call.getTask();
    this.result = result;
  }

  static BlockResponse failed(BlockCall call, Throwable cause) {
    return new BlockResponse(call, new Failure(cause));
  }

  @Override
  public TaskId getTask() {
    return task;
  }

  @Override
  public void dispatch() {
    TaskContext.current().getScheduler().resume(task, result);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("task", task).toString();
  }
}
