package io.relay.runtime.call;

import io.relay.api.id.TaskId;

/** A message that resumes a suspended task. */
public interface Resumption {

  /** The task this message resumes. */
  TaskId getTask();

  /** Resume the task. */
  void dispatch();
}
