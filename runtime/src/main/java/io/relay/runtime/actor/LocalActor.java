package io.relay.runtime.actor;

import com.google.common.base.MoreObjects;
import io.relay.api.exception.MailboxClosedException;
import io.relay.api.id.ActorId;
import io.relay.api.id.TaskId;
import io.relay.runtime.call.BlockCall;
import io.relay.runtime.call.Call;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.LocalMailbox;
import io.relay.runtime.task.MessageRouter;
import io.relay.runtime.task.TaskScheduler;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An actor of the local runtime. Its loop runs on a thread of its own and dispatches one message at
 * a time, each in a new task.
 */
public class LocalActor<A> implements CallTarget, Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalActor.class);

  private final ActorId id = ActorId.fromRandom();

  private final ActorInstance<A> instance;

  private final LocalMailbox mailbox;

  private final TaskScheduler scheduler;

  private final CountDownLatch terminated = new CountDownLatch(1);

  private volatile boolean alive = true;

  private volatile Throwable exitReason = null;

  public LocalActor(ActorInstance<A> instance, TaskScheduler scheduler) {
    this.instance = instance;
    this.scheduler = scheduler;
    this.mailbox = new LocalMailbox("actor-" + id, LocalActor::onDeadLetter);
  }

  /** Messages that can't be delivered any more still owe their sender an answer. */
  private static void onDeadLetter(Object message) {
    if (message instanceof Call) {
      ((Call) message).cleanup();
    } else if (message instanceof BlockCall) {
      ((BlockCall) message).cleanup();
    } else {
      LOGGER.debug("Discarding message {} sent to a dead actor.", message);
    }
  }

  @Override
  public void run() {
    TaskContext root = new TaskContext(TaskId.fromRandom(), mailbox, this, scheduler);
    TaskContext previous = TaskContext.enter(root);
    LOGGER.debug("Actor {} of type {} started.", id, instance.getTypeName());
    try {
      while (alive) {
        Object message;
        try {
          message = mailbox.receive(m -> true);
        } catch (MailboxClosedException e) {
          break;
        }
        MessageRouter.route(root, message);
      }
    } finally {
      TaskContext.restore(previous);
      terminate();
      terminated.countDown();
      LOGGER.debug("Actor {} stopped.", id);
    }
  }

  @Override
  public void handleSystemEvent(SystemEvent event) {
    if (event instanceof TerminationRequest) {
      LOGGER.debug("Actor {} received {}.", id, event);
      terminate();
    } else {
      LOGGER.warn("Actor {} ignores unknown system event {}.", id, event);
    }
  }

  @Override
  public void crash(Throwable cause) {
    if (!alive) {
      LOGGER.debug("Actor {} is already terminated, ignoring failure.", id, cause);
      return;
    }
    LOGGER.error("Actor {} of type {} crashed.", id, instance.getTypeName(), cause);
    exitReason = cause;
    terminate();
  }

  /** Stop dispatching calls. Whatever is still queued gets a dead actor error. */
  public void terminate() {
    alive = false;
    mailbox.close();
  }

  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return terminated.await(timeout, unit);
  }

  @Override
  public ActorId getId() {
    return id;
  }

  @Override
  public ActorInstance<A> getInstance() {
    return instance;
  }

  @Override
  public boolean isAlive() {
    return alive;
  }

  public LocalMailbox getMailbox() {
    return mailbox;
  }

  public Throwable getExitReason() {
    return exitReason;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("type", instance.getTypeName())
        .add("alive", alive)
        .toString();
  }
}
