package com.agentsentry.evaluator.target;

/**
 * Coarse classification of the system under evaluation.
 *
 * @author Naveed Gung
 */
public enum AgentType {
    /** Plans and executes tool calls or commands on its own. */
    AUTONOMOUS_AGENT,
    /** Exposes callable tools but does not act on its own. */
    TOOL_SERVICE,
    /** Answers messages without side effects. */
    CONVERSATIONAL
}
