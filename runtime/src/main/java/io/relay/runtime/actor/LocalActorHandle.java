package io.relay.runtime.actor;

import io.relay.api.ActorHandle;
import io.relay.api.Block;
import io.relay.api.BlockExecution;
import io.relay.api.id.ActorId;
import io.relay.runtime.LocalRelayRuntime;
import io.relay.runtime.call.AsyncCall;
import io.relay.runtime.call.SyncCall;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/** Handle of an actor of the local runtime. */
public class LocalActorHandle<A> implements ActorHandle<A> {

  private final LocalRelayRuntime runtime;

  private final LocalActor<A> actor;

  public LocalActorHandle(LocalRelayRuntime runtime, LocalActor<A> actor) {
    this.runtime = runtime;
    this.actor = actor;
  }

  @Override
  public ActorId getId() {
    return actor.getId();
  }

  @Override
  public Object call(String method, Object... args) {
    return call(method, Arrays.asList(args), null, null);
  }

  @Override
  public Object call(String method, List<Object> args, Block block, BlockExecution execution) {
    runtime.currentTask();
    SyncCall call = SyncCall.create(method, args, block, execution);
    actor.getMailbox().send(call);
    return call.value();
  }

  @Override
  public void async(String method, Object... args) {
    runtime.currentTask();
    actor.getMailbox().send(new AsyncCall(method, Arrays.asList(args)));
  }

  @Override
  public boolean isAlive() {
    return actor.isAlive();
  }

  @Override
  public void terminate() {
    actor.getMailbox().send(new TerminationRequest());
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    return actor.awaitTermination(timeout, unit);
  }

  @Override
  public Optional<Throwable> getExitReason() {
    return Optional.ofNullable(actor.getExitReason());
  }

  @Override
  public String toString() {
    return actor.toString();
  }
}
