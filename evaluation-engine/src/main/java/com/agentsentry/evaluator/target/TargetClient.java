package com.agentsentry.evaluator.target;

import java.util.Map;

/**
 * Black-box collaborator: the agent under evaluation.
 *
 * @author Naveed Gung
 */
public interface TargetClient {

    /**
     * Fetch the target's self-description.
     *
     * @return the discovery document
     * @throws TargetUnreachableException if the target cannot be reached
     */
    DiscoveryDocument discover();

    /**
     * Invoke one command on the target. Implementations apply the timeout and
     * retry policy themselves.
     *
     * @param command    command text
     * @param parameters command parameters
     * @return the target's response
     * @throws TargetUnreachableException when every try failed
     */
    AgentResponse invoke(String command, Map<String, Object> parameters);
}
