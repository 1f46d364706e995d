package io.relay.runtime.task;

import io.relay.api.exception.DeadActorException;
import io.relay.api.id.TaskId;
import io.relay.runtime.call.Response;
import io.relay.runtime.call.SuccessResponse;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.LocalMailbox;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class MailboxTaskSchedulerTest {

  private MailboxTaskScheduler scheduler;

  private LocalMailbox mailbox;

  private TaskContext context;

  private TaskContext previous;

  @BeforeMethod
  public void setUp() {
    scheduler = new MailboxTaskScheduler();
    mailbox = new LocalMailbox("test");
    context = new TaskContext(TaskId.fromRandom(), mailbox, null, scheduler);
    previous = TaskContext.enter(context);
  }

  @AfterMethod
  public void tearDown() {
    TaskContext.restore(previous);
  }

  @Test
  public void testSuspendUntilResumed() {
    TaskId other = TaskId.fromRandom();
    // Resumptions for other tasks and unknown messages stay in the mailbox.
    mailbox.send(new SuccessResponse(other, "not mine"));
    mailbox.send("noise");
    mailbox.send(new SuccessResponse(context.getTaskId(), "mine"));

    Assert.assertEquals(scheduler.current(), context.getTaskId());
    Response response = (Response) scheduler.suspend("test", null);
    Assert.assertEquals(response.value(), "mine");
    Assert.assertFalse(scheduler.isSuspended(context.getTaskId()));
    Assert.assertEquals(mailbox.size(), 2);
  }

  @Test
  public void testResumeIsOneShot() {
    mailbox.send(new SuccessResponse(context.getTaskId(), 1));
    scheduler.suspend("test", null);
    IllegalStateException e =
        Assert.expectThrows(
            IllegalStateException.class, () -> scheduler.resume(context.getTaskId(), 2));
    Assert.assertTrue(e.getMessage().contains("is not suspended"));
  }

  @Test
  public void testStaleResumptionIsDropped() {
    MessageRouter.route(context, new SuccessResponse(TaskId.fromRandom(), 1));
    Assert.assertFalse(scheduler.isSuspended(context.getTaskId()));
  }

  @Test
  public void testResumedFromAnotherThread() throws Exception {
    CompletableFuture<Void> sender =
        CompletableFuture.runAsync(
            () -> {
              while (!scheduler.isSuspended(context.getTaskId())) {
                Thread.yield();
              }
              mailbox.send(new SuccessResponse(context.getTaskId(), "late"));
            });
    Response response = (Response) scheduler.suspend("test", null);
    Assert.assertEquals(response.value(), "late");
    sender.get(5, TimeUnit.SECONDS);
  }

  @Test
  public void testClosedMailboxFailsSuspendedTask() throws Exception {
    CompletableFuture<Void> closer =
        CompletableFuture.runAsync(
            () -> {
              while (!scheduler.isSuspended(context.getTaskId())) {
                Thread.yield();
              }
              mailbox.close();
            });
    Assert.expectThrows(DeadActorException.class, () -> scheduler.suspend("test", null));
    Assert.assertFalse(scheduler.isSuspended(context.getTaskId()));
    closer.get(5, TimeUnit.SECONDS);
  }

  @Test
  public void testAccepts() {
    TaskId waiting = context.getTaskId();
    Assert.assertTrue(MessageRouter.accepts(context, waiting, new SuccessResponse(waiting, 1)));
    Assert.assertFalse(
        MessageRouter.accepts(context, waiting, new SuccessResponse(TaskId.fromRandom(), 1)));
    Assert.assertFalse(MessageRouter.accepts(context, waiting, "noise"));
  }
}
