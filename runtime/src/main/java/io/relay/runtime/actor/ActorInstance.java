package io.relay.runtime.actor;

import com.google.common.base.Preconditions;
import io.relay.api.function.ActorMethodTable;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import org.apache.commons.lang3.reflect.FieldUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The state of an actor together with its operations.
 *
 * @param <A> Type of the actor state.
 */
public final class ActorInstance<A> {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActorInstance.class);

  private final A state;

  private final ActorMethodTable<A> methods;

  public ActorInstance(A state, ActorMethodTable<A> methods) {
    this.state = Preconditions.checkNotNull(state);
    this.methods = Preconditions.checkNotNull(methods);
  }

  public A getState() {
    return state;
  }

  public ActorMethodTable<A> getMethods() {
    return methods;
  }

  public String getTypeName() {
    return state.getClass().getName();
  }

  /**
   * Describe the state for diagnostics. Falls back to a dump of its fields when the state can't
   * render itself.
   */
  public String describe() {
    try {
      return String.valueOf(state);
    } catch (RuntimeException e) {
      LOGGER.debug("Failed to render the state of {}.", getTypeName(), e);
      return dumpFields();
    }
  }

  String dumpFields() {
    StringBuilder builder =
        new StringBuilder("#<")
            .append(getTypeName())
            .append(":0x")
            .append(Integer.toHexString(System.identityHashCode(state)));
    for (Field field : FieldUtils.getAllFieldsList(state.getClass())) {
      if (Modifier.isStatic(field.getModifiers())) {
        continue;
      }
      try {
        String value = String.valueOf(FieldUtils.readField(field, state, true));
        builder.append(' ').append(field.getName()).append('=').append(value);
      } catch (IllegalAccessException | RuntimeException e) {
        // Leave out fields that can't be read or rendered.
        LOGGER.debug("Skipping field {} of {}.", field.getName(), getTypeName(), e);
      }
    }
    return builder.append('>').toString();
  }
}
