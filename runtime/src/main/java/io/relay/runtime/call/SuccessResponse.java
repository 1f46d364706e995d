package io.relay.runtime.call;

import io.relay.api.id.TaskId;

/** The call completed. */
public class SuccessResponse extends Response {

  public SuccessResponse(TaskId task, Object value) {
    super(task, value);
  }
}
