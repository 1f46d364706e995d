package io.relay.api.function;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.relay.api.exception.ArgumentCountException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The operations an actor type exposes, with their declared arity. Calls are checked against this
 * table before they are dispatched, so no reflection happens on the call path.
 *
 * <pre>{@code
 * ActorMethodTable<Counter> methods =
 *     ActorMethodTable.<Counter>builder()
 *         .method("increase", 1, (counter, args, block) -> counter.increase((int) args.get(0)))
 *         .method("value", 0, (counter, args, block) -> counter.value)
 *         .build();
 * }</pre>
 *
 * @param <A> Type of the actor state.
 */
public final class ActorMethodTable<A> {

  /** Marks an entry that accepts any number of arguments beyond its minimum. */
  public static final int VARIADIC = -1;

  /** One operation and its arity. */
  public static final class Entry<A> {

    public final String name;
    public final int minArgs;
    /** Maximum number of arguments, or {@link #VARIADIC}. */
    public final int maxArgs;

    public final ActorMethod<A> handler;

    Entry(String name, int minArgs, int maxArgs, ActorMethod<A> handler) {
      this.name = name;
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
      this.handler = handler;
    }

    public boolean isVariadic() {
      return maxArgs == VARIADIC;
    }

    /**
     * Check the number of given arguments against this entry's arity.
     *
     * @throws ArgumentCountException If the count doesn't fit.
     */
    public void checkArity(int given) {
      if (isVariadic()) {
        if (given < minArgs) {
          throw new ArgumentCountException(given, minArgs + "+");
        }
      } else if (minArgs == maxArgs) {
        if (given != minArgs) {
          throw new ArgumentCountException(given, String.valueOf(minArgs));
        }
      } else if (given < minArgs || given > maxArgs) {
        throw new ArgumentCountException(given, minArgs + ".." + maxArgs);
      }
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("name", name)
          .add("minArgs", minArgs)
          .add("maxArgs", maxArgs)
          .toString();
    }
  }

  private final ImmutableMap<String, Entry<A>> entries;

  private ActorMethodTable(ImmutableMap<String, Entry<A>> entries) {
    this.entries = entries;
  }

  public static <A> Builder<A> builder() {
    return new Builder<>();
  }

  public Optional<Entry<A>> lookup(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  public Set<String> names() {
    return entries.keySet();
  }

  @Override
  public String toString() {
    return entries.values().toString();
  }

  public static final class Builder<A> {

    private final Map<String, Entry<A>> entries = new LinkedHashMap<>();

    private Builder() {}

    /** Add an operation taking exactly {@code arity} arguments. */
    public Builder<A> method(String name, int arity, ActorMethod<A> handler) {
      return method(name, arity, arity, handler);
    }

    /** Add an operation taking between {@code minArgs} and {@code maxArgs} arguments. */
    public Builder<A> method(String name, int minArgs, int maxArgs, ActorMethod<A> handler) {
      Preconditions.checkArgument(
          maxArgs >= minArgs, "Max arity %s of %s is less than its min arity %s.",
          maxArgs, name, minArgs);
      return add(name, minArgs, maxArgs, handler);
    }

    /** Add an operation taking at least {@code minArgs} arguments. */
    public Builder<A> variadic(String name, int minArgs, ActorMethod<A> handler) {
      return add(name, minArgs, VARIADIC, handler);
    }

    private Builder<A> add(String name, int minArgs, int maxArgs, ActorMethod<A> handler) {
      Preconditions.checkNotNull(name);
      Preconditions.checkNotNull(handler);
      Preconditions.checkArgument(minArgs >= 0, "Negative arity of %s.", name);
      Preconditions.checkArgument(
          !entries.containsKey(name), "Method %s is already defined.", name);
      entries.put(name, new Entry<>(name, minArgs, maxArgs, handler));
      return this;
    }

    public ActorMethodTable<A> build() {
      return new ActorMethodTable<>(ImmutableMap.copyOf(entries));
    }
  }
}
