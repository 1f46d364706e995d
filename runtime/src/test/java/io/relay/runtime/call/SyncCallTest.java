package io.relay.runtime.call;

import com.google.common.collect.ImmutableList;
import io.relay.api.exception.AbortException;
import io.relay.api.exception.DeadActorException;
import io.relay.api.exception.MethodMissingException;
import io.relay.api.function.ActorMethodTable;
import io.relay.api.id.TaskId;
import io.relay.runtime.Counter;
import io.relay.runtime.actor.ActorInstance;
import io.relay.runtime.context.CallChain;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.LocalMailbox;
import io.relay.runtime.task.MailboxTaskScheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class SyncCallTest {

  private LocalMailbox sender;

  private TaskId task;

  private TaskContext previous;

  private final List<Optional<String>> seenChainIds = new ArrayList<>();

  private ActorInstance<Counter> target;

  @BeforeMethod
  public void setUp() {
    sender = new LocalMailbox("sender");
    task = TaskId.fromRandom();
    // The callee runs in a task of its own.
    previous =
        TaskContext.enter(
            new TaskContext(
                TaskId.fromRandom(), new LocalMailbox("callee"), null, new MailboxTaskScheduler()));
    seenChainIds.clear();
    target =
        new ActorInstance<>(
            new Counter(),
            ActorMethodTable.<Counter>builder()
                .method("chain", 0, (c, args, block) -> record())
                .method(
                    "fault",
                    0,
                    (c, args, block) -> {
                      record();
                      throw new IllegalStateException("fault");
                    })
                .build());
  }

  @AfterMethod
  public void tearDown() {
    TaskContext.restore(previous);
  }

  private Object record() {
    seenChainIds.add(CallChain.currentId());
    return null;
  }

  private SyncCall newCall(String method, Object... args) {
    return new SyncCall(sender, task, null, method, ImmutableList.copyOf(args), null, null);
  }

  private Response takeResponse() {
    Response response = (Response) sender.receive(m -> true);
    Assert.assertEquals(response.getTask(), task);
    Assert.assertEquals(sender.size(), 0);
    return response;
  }

  @Test
  public void testSuccessResponse() throws Exception {
    ActorInstance<Counter> counter = new ActorInstance<>(new Counter(), Counter.METHODS);
    Assert.assertEquals(newCall("add", 3).dispatch(counter), 3);
    Response response = takeResponse();
    Assert.assertTrue(response instanceof SuccessResponse);
    Assert.assertEquals(response.value(), 3);
  }

  @Test
  public void testAbortIsReportedAndSwallowed() throws Exception {
    ActorInstance<Counter> counter = new ActorInstance<>(new Counter(), Counter.METHODS);
    Assert.assertNull(newCall("reset").dispatch(counter));
    ErrorResponse response = (ErrorResponse) takeResponse();
    Assert.assertTrue(response.getException() instanceof AbortException);
    Assert.expectThrows(MethodMissingException.class, response::value);
  }

  @Test
  public void testFaultIsReportedAndRethrown() {
    IllegalStateException e =
        Assert.expectThrows(
            IllegalStateException.class, () -> newCall("fault").dispatch(target));
    ErrorResponse response = (ErrorResponse) takeResponse();
    Assert.assertSame(response.getException(), e);
  }

  @Test
  public void testCleanupRespondsOnce() {
    newCall("chain").cleanup();
    ErrorResponse response = (ErrorResponse) takeResponse();
    Assert.assertTrue(response.getException() instanceof DeadActorException);
    Assert.assertEquals(response.getException().getMessage(), "attempted to call a dead actor");
  }

  @Test
  public void testChainIdDuringDispatch() throws Exception {
    SyncCall call = newCall("chain");
    call.dispatch(target);
    Assert.assertEquals(seenChainIds, ImmutableList.of(Optional.of(call.getChainId())));
    Assert.assertEquals(CallChain.currentId(), Optional.empty());

    Assert.expectThrows(IllegalStateException.class, () -> newCall("fault").dispatch(target));
    Assert.assertTrue(seenChainIds.get(1).isPresent());
    Assert.assertEquals(CallChain.currentId(), Optional.empty());

    newCall("chain", 1).dispatch(target);
    Assert.assertEquals(CallChain.currentId(), Optional.empty());
  }

  @Test
  public void testChainIdIsInherited() {
    CallChain.setCurrentId("outer-chain");
    try {
      Assert.assertEquals(
          SyncCall.create("chain", ImmutableList.of(), null, null).getChainId(), "outer-chain");
    } finally {
      CallChain.clear();
    }
    SyncCall call = SyncCall.create("chain", ImmutableList.of(), null, null);
    Assert.assertNotNull(call.getChainId());
    Assert.assertNotEquals(call.getChainId(), "outer-chain");
    Assert.assertNotEquals(
        SyncCall.create("chain", ImmutableList.of(), null, null).getChainId(), call.getChainId());
  }
}
