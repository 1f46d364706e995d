package io.relay.api.id;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;
import java.io.Serializable;
import java.util.Arrays;
import java.util.concurrent.ThreadLocalRandom;

/** Base class of fixed-length binary ids. */
public abstract class BaseId implements Serializable {

  private static final long serialVersionUID = 8588849129675565761L;

  private final byte[] id;

  private int hashCodeCache = 0;

  protected BaseId(byte[] id) {
    Preconditions.checkArgument(
        id.length == size(), "Failed to construct %s, expect %s bytes, but got %s bytes.",
        getClass().getSimpleName(), size(), id.length);
    this.id = id;
  }

  /** Size of this id in bytes. */
  public abstract int size();

  public String toHex() {
    return BaseEncoding.base16().lowerCase().encode(id);
  }

  protected static byte[] randomBytes(int length) {
    byte[] b = new byte[length];
    ThreadLocalRandom.current().nextBytes(b);
    return b;
  }

  @Override
  public int hashCode() {
    // Lazy evaluation.
    if (hashCodeCache == 0) {
      hashCodeCache = Arrays.hashCode(id);
    }
    return hashCodeCache;
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == null) {
      return false;
    }
    if (!this.getClass().equals(obj.getClass())) {
      return false;
    }
    BaseId r = (BaseId) obj;
    return Arrays.equals(id, r.id);
  }

  @Override
  public String toString() {
    return toHex();
  }
}
