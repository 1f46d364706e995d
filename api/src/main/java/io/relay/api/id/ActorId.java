package io.relay.api.id;

public class ActorId extends BaseId {

  private static final long serialVersionUID = -1496221402549128316L;

  public static final int LENGTH = 12;

  private ActorId(byte[] id) {
    super(id);
  }

  /** Generate an ActorId with random value. */
  public static ActorId fromRandom() {
    return new ActorId(randomBytes(LENGTH));
  }

  @Override
  public int size() {
    return LENGTH;
  }
}
