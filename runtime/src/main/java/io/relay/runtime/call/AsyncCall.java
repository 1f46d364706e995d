package io.relay.runtime.call;

import io.relay.api.Block;
import io.relay.api.BlockExecution;
import io.relay.api.exception.AbortException;
import io.relay.runtime.actor.ActorInstance;
import io.relay.runtime.context.CallChain;
import java.util.List;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A call nobody waits for. Its result is dropped, and so are the sender's protocol errors. */
public class AsyncCall extends Call {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncCall.class);

  public AsyncCall(String method, List<?> arguments) {
    this(method, arguments, null, null);
  }

  public AsyncCall(String method, List<?> arguments, Block block, BlockExecution execution) {
    super(method, arguments, block, execution);
  }

  @Override
  public Object dispatch(ActorInstance<?> target) throws Exception {
    CallChain.setCurrentId(CallChain.generate());
    try {
      super.dispatch(target);
    } catch (AbortException e) {
      LOGGER.debug(
          "{}: async call `{}` aborted!\n{}",
          target.getTypeName(),
          method,
          ExceptionUtils.getStackTrace(e.getCause()));
    } finally {
      CallChain.clear();
    }
    return null;
  }

  @Override
  public void cleanup() {
    LOGGER.debug("Dropping async call `{}` to a dead actor.", method);
  }
}
