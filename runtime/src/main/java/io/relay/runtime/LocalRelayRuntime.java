package io.relay.runtime;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.relay.api.ActorHandle;
import io.relay.api.exception.RelayException;
import io.relay.api.function.ActorMethodTable;
import io.relay.api.id.ActorId;
import io.relay.api.id.TaskId;
import io.relay.api.runtime.RelayRuntime;
import io.relay.runtime.actor.ActorInstance;
import io.relay.runtime.actor.LocalActor;
import io.relay.runtime.actor.LocalActorHandle;
import io.relay.runtime.config.RelayConfig;
import io.relay.runtime.context.CallChain;
import io.relay.runtime.context.TaskContext;
import io.relay.runtime.mailbox.LocalMailbox;
import io.relay.runtime.task.MailboxTaskScheduler;
import io.relay.runtime.task.TaskScheduler;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Relay runtime running all actors in this process, one thread per actor. */
public class LocalRelayRuntime implements RelayRuntime {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalRelayRuntime.class);

  private final RelayConfig relayConfig;

  private final TaskScheduler scheduler = new MailboxTaskScheduler();

  private final Map<ActorId, LocalActor<?>> actors = new ConcurrentHashMap<>();

  /** Tasks this runtime created for threads that aren't actors. */
  private final Set<TaskContext> driverTasks = ConcurrentHashMap.newKeySet();

  /// The thread pool running actor loops.
  private final ExecutorService actorExecutorService;

  private volatile boolean shutdown = false;

  public LocalRelayRuntime(RelayConfig relayConfig) {
    this.relayConfig = relayConfig;
    this.actorExecutorService =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat(relayConfig.actorThreadNamePrefix + "-%d")
                .setDaemon(true)
                .build());
  }

  @Override
  public <A> ActorHandle<A> createActor(A state, ActorMethodTable<A> methods) {
    Preconditions.checkState(!shutdown, "Relay runtime is shut down.");
    LocalActor<A> actor = new LocalActor<>(new ActorInstance<>(state, methods), scheduler);
    actors.put(actor.getId(), actor);
    actorExecutorService.execute(
        () -> {
          try {
            actor.run();
          } finally {
            actors.remove(actor.getId());
          }
        });
    LOGGER.debug("Created actor {}.", actor);
    return new LocalActorHandle<>(this, actor);
  }

  /**
   * Get the context of the current task. A thread that isn't an actor gets a task and a mailbox of
   * its own the first time it asks, so it can make calls and receive their responses. A driver task
   * left behind by another runtime is replaced.
   */
  public TaskContext currentTask() {
    Optional<TaskContext> current = TaskContext.currentIfPresent();
    if (current.isPresent()
        && (current.get().getScheduler() == scheduler || current.get().getActor() != null)) {
      return current.get();
    }
    TaskContext context =
        new TaskContext(
            TaskId.fromRandom(),
            new LocalMailbox("thread-" + Thread.currentThread().getName()),
            null,
            scheduler);
    TaskContext.enter(context);
    driverTasks.add(context);
    return context;
  }

  @Override
  public <T> T exclusive(Callable<T> body) {
    try {
      return currentTask().exclusive(body);
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new RelayException("Exclusive body failed", e);
    }
  }

  @Override
  public Optional<String> currentChainId() {
    return CallChain.currentId();
  }

  @Override
  public void shutdown() {
    if (shutdown) {
      return;
    }
    shutdown = true;
    actors.values().forEach(LocalActor::terminate);
    // Responses still on their way to drivers are dropped with the mailboxes.
    driverTasks.forEach(task -> task.getMailbox().close());
    driverTasks.clear();
    actorExecutorService.shutdown();
    try {
      if (!actorExecutorService.awaitTermination(
          relayConfig.shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
        LOGGER.warn(
            "Actors didn't stop in {}ms, interrupting them.", relayConfig.shutdownTimeoutMs);
        actorExecutorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      actorExecutorService.shutdownNow();
    }
  }
}
