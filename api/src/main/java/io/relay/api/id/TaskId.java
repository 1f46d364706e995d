package io.relay.api.id;

/**
 * Represents the id of a task. Every message an actor dispatches runs in its own task, and a
 * suspended task is addressed by this id when it gets resumed.
 */
public class TaskId extends BaseId {

  private static final long serialVersionUID = 3517434795617432098L;

  public static final int LENGTH = 8;

  private TaskId(byte[] id) {
    super(id);
  }

  /** Generate a TaskId with random value. */
  public static TaskId fromRandom() {
    return new TaskId(randomBytes(LENGTH));
  }

  @Override
  public int size() {
    return LENGTH;
  }
}
