package io.relay.runtime.task;

import io.relay.api.id.TaskId;

/** Suspends and resumes tasks. */
public interface TaskScheduler {

  /** Id of the current task. */
  TaskId current();

  /**
   * Suspend the current task until it's resumed with {@link #resume}.
   *
   * @param tag What the task waits for, for diagnostics.
   * @param payload The object the task waits on, for diagnostics.
   * @return The value the task was resumed with.
   */
  Object suspend(String tag, Object payload);

  /**
   * Resume a suspended task. A task is resumed exactly once per suspension.
   *
   * @throws IllegalStateException If the task isn't suspended.
   */
  void resume(TaskId taskId, Object value);

  /** Whether the task is suspended and waiting to be resumed. */
  boolean isSuspended(TaskId taskId);
}
