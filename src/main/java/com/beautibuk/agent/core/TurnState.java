package com.beautibuk.agent.core;

/**
 * States of one orchestration turn.
 * START → AWAITING_COMPLETION → (EXECUTING_TOOLS → AWAITING_COMPLETION)* → DONE
 */
public enum TurnState {
    START,
    AWAITING_COMPLETION,
    EXECUTING_TOOLS,
    DONE
}
