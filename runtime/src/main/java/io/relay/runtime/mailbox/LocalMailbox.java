package io.relay.runtime.mailbox;

import com.google.common.base.MoreObjects;
import io.relay.api.exception.MailboxClosedException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** An in-process mailbox with selective receive. */
public class LocalMailbox implements Mailbox {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalMailbox.class);

  private final String name;

  private final ReentrantLock lock = new ReentrantLock();

  private final Condition messageArrived = lock.newCondition();

  private final LinkedList<Object> messages = new LinkedList<>();

  /** Receives messages sent after close, and the ones still pending at close. */
  private final Consumer<Object> deadLetterHandler;

  private boolean closed = false;

  public LocalMailbox(String name) {
    this(name, message -> LOGGER.debug("Discarding message {} sent to closed mailbox.", message));
  }

  public LocalMailbox(String name, Consumer<Object> deadLetterHandler) {
    this.name = name;
    this.deadLetterHandler = deadLetterHandler;
  }

  @Override
  public void send(Object message) {
    lock.lock();
    try {
      if (!closed) {
        messages.add(message);
        messageArrived.signalAll();
        return;
      }
    } finally {
      lock.unlock();
    }
    deadLetterHandler.accept(message);
  }

  @Override
  public Object receive(Predicate<Object> predicate) {
    lock.lock();
    try {
      while (true) {
        if (closed) {
          throw new MailboxClosedException("Mailbox " + name + " is closed.");
        }
        Iterator<Object> iterator = messages.iterator();
        while (iterator.hasNext()) {
          Object message = iterator.next();
          if (predicate.test(message)) {
            iterator.remove();
            return message;
          }
        }
        try {
          messageArrived.await();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new MailboxClosedException("Interrupted while receiving from mailbox " + name);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    List<Object> pending;
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      pending = new ArrayList<>(messages);
      messages.clear();
      messageArrived.signalAll();
    } finally {
      lock.unlock();
    }
    LOGGER.debug("Mailbox {} closed with {} pending messages.", name, pending.size());
    pending.forEach(deadLetterHandler);
  }

  @Override
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /** Number of messages waiting to be received. */
  public int size() {
    lock.lock();
    try {
      return messages.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).toString();
  }
}
