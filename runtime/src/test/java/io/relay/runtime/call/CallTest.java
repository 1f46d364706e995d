package io.relay.runtime.call;

import com.google.common.collect.ImmutableList;
import io.relay.api.BlockExecution;
import io.relay.api.exception.AbortException;
import io.relay.api.exception.ArgumentCountException;
import io.relay.api.exception.MethodMissingException;
import io.relay.api.id.TaskId;
import io.relay.runtime.Counter;
import io.relay.runtime.actor.ActorInstance;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.LocalMailbox;
import io.relay.runtime.task.MailboxTaskScheduler;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class CallTest {

  private TaskContext context;

  private TaskContext previous;

  @BeforeMethod
  public void setUp() {
    context =
        new TaskContext(
            TaskId.fromRandom(), new LocalMailbox("test"), null, new MailboxTaskScheduler());
    previous = TaskContext.enter(context);
  }

  @AfterMethod
  public void tearDown() {
    TaskContext.restore(previous);
  }

  @Test
  public void testCheckFindsMethod() {
    ActorInstance<Counter> target = new ActorInstance<>(new Counter(), Counter.METHODS);
    Assert.assertEquals(new AsyncCall("add", ImmutableList.of(1)).check(target).name, "add");
    Assert.assertEquals(new AsyncCall("sum", ImmutableList.of(1, 2, 3)).check(target).name, "sum");
  }

  @Test
  public void testCheckWrapsProtocolErrors() {
    ActorInstance<Counter> target = new ActorInstance<>(new Counter(), Counter.METHODS);

    AbortException abort =
        Assert.expectThrows(
            AbortException.class, () -> new AsyncCall("reset", ImmutableList.of()).check(target));
    Assert.assertTrue(abort.getCause() instanceof MethodMissingException);
    Assert.assertEquals(
        abort.getCause().getMessage(), "undefined method `reset' for Counter{value=0}");

    abort =
        Assert.expectThrows(
            AbortException.class, () -> new AsyncCall("add", ImmutableList.of(1, 2)).check(target));
    ArgumentCountException arity = (ArgumentCountException) abort.getCause();
    Assert.assertEquals(arity.given, 2);
    Assert.assertEquals(arity.getMessage(), "wrong number of arguments (2 for 1)");

    abort =
        Assert.expectThrows(
            AbortException.class,
            () -> new AsyncCall("range", ImmutableList.of(1, 2, 3)).check(target));
    Assert.assertEquals(abort.getCause().getMessage(), "wrong number of arguments (3 for 1..2)");
  }

  @Test
  public void testArgumentsAreCopied() {
    List<Object> arguments = new ArrayList<>(Arrays.asList(1, null));
    AsyncCall call = new AsyncCall("range", arguments);
    arguments.add(3);
    Assert.assertEquals(call.getArguments(), Arrays.asList(1, null));
    Assert.expectThrows(UnsupportedOperationException.class, () -> call.getArguments().add(4));
  }

  @Test
  public void testBlockIsWrappedWithOwner() {
    AsyncCall call = new AsyncCall("each", ImmutableList.of(), args -> 1, BlockExecution.SENDER);
    Assert.assertSame(call.getBlock().getMailbox(), context.getMailbox());
    Assert.assertEquals(call.getBlock().getExecution(), BlockExecution.SENDER);
    // Called by its owner, the block runs in place.
    Assert.assertEquals(call.getBlock().call(), 1);
    Assert.assertNull(new AsyncCall("get", ImmutableList.of()).getBlock());
  }

  @Test
  public void testBlockDispatch() throws Exception {
    ActorInstance<Counter> target = new ActorInstance<>(new Counter(), Counter.METHODS);
    SyncCall sender =
        SyncCall.create("hasBlock", ImmutableList.of(), args -> null, BlockExecution.SENDER);
    SyncCall receiver =
        SyncCall.create("hasBlock", ImmutableList.of(), args -> null, BlockExecution.RECEIVER);
    Assert.assertEquals(sender.dispatch(target), false);
    Assert.assertEquals(receiver.dispatch(target), true);
  }

  @Test
  public void testNoBlockInExclusiveMode() throws Exception {
    IllegalStateException e =
        Assert.expectThrows(
            IllegalStateException.class,
            () ->
                context.exclusive(
                    () ->
                        new AsyncCall(
                            "each", ImmutableList.of(), args -> null, BlockExecution.RECEIVER)));
    Assert.assertEquals(e.getMessage(), "Cannot execute blocks on sender in exclusive mode");
    Assert.assertFalse(context.isExclusive());
    // Calls without a block are fine.
    Assert.assertNotNull(context.exclusive(() -> new AsyncCall("get", ImmutableList.of())));
  }
}
