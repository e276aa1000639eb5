package ai.agentcap.router.spi;

import ai.agentcap.router.model.ExecutionContext;
import ai.agentcap.router.model.ExecutionOutcome;

/**
 * A backend that runs capabilities. The router asks each registered executor, in
 * registration order, whether it accepts a capability id and uses the first that does.
 *
 * <p>Implementations may report failure either by returning a failed outcome or by throwing;
 * both are classified the same way by the retry engine.</p>
 */
public interface CapabilityExecutor {

    String name();

    boolean canExecute(String capabilityId);

    ExecutionOutcome execute(ExecutionContext context) throws Exception;
}
