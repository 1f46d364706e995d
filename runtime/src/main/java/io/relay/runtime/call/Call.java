package io.relay.runtime.call;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.relay.api.Block;
import io.relay.api.BlockExecution;
import io.relay.api.exception.AbortException;
import io.relay.api.exception.MethodMissingException;
import io.relay.api.function.ActorMethodTable;
import io.relay.runtime.actor.ActorInstance;
import io.relay.runtime.context.TaskContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A request to invoke an operation of an actor. Calls are immutable. */
public abstract class Call {

  protected final String method;

  protected final List<Object> arguments;

  protected final BlockProxy block;

  /**
   * Create a call.
   *
   * @param method Name of the operation.
   * @param arguments Arguments of the operation.
   * @param block Closure passed along with the call, or null. A call with a block can only be
   *     created in a task, and not in exclusive mode.
   * @param execution Where the block is made available.
   */
  protected Call(String method, List<?> arguments, Block block, BlockExecution execution) {
    this.method = Preconditions.checkNotNull(method);
    this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    if (block != null) {
      Preconditions.checkNotNull(execution);
      TaskContext owner = TaskContext.current();
      Preconditions.checkState(
          !owner.isExclusive(), "Cannot execute blocks on sender in exclusive mode");
      this.block = new BlockProxy(block, execution, owner.getMailbox());
    } else {
      this.block = null;
    }
  }

  /**
   * Check the call against a target, and invoke the operation.
   *
   * @return The result of the operation.
   * @throws AbortException If the call doesn't fit the target.
   * @throws Exception Whatever the operation raises.
   */
  public Object dispatch(ActorInstance<?> target) throws Exception {
    return invoke(target);
  }

  private <A> Object invoke(ActorInstance<A> target) throws Exception {
    ActorMethodTable.Entry<A> entry = check(target);
    // A block that stays on the sender isn't handed to the operation.
    Block receiverBlock =
        block != null && block.getExecution() == BlockExecution.RECEIVER ? block : null;
    return entry.handler.invoke(target.getState(), arguments, receiverBlock);
  }

  /**
   * Find the operation this call names and check the argument count against it.
   *
   * @throws AbortException Wrapping a {@link MethodMissingException} or an {@link
   *     io.relay.api.exception.ArgumentCountException}.
   */
  public <A> ActorMethodTable.Entry<A> check(ActorInstance<A> target) {
    try {
      ActorMethodTable.Entry<A> entry =
          target
              .getMethods()
              .lookup(method)
              .orElseThrow(() -> new MethodMissingException(method, target.describe()));
      entry.checkArity(arguments.size());
      return entry;
    } catch (RuntimeException e) {
      throw new AbortException(e);
    }
  }

  /** Called instead of {@link #dispatch} when the target is dead. */
  public abstract void cleanup();

  public String getMethod() {
    return method;
  }

  public List<Object> getArguments() {
    return arguments;
  }

  /** The proxy of the call's block, or null. */
  public BlockProxy getBlock() {
    return block;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("method", method)
        .add("arguments", arguments.size())
        .add("block", block != null ? block.getExecution() : null)
        .toString();
  }
}
