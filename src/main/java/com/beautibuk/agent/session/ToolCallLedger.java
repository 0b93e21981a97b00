package com.beautibuk.agent.session;

import com.beautibuk.agent.exception.ProtocolViolationException;
import com.beautibuk.agent.model.Message;
import com.beautibuk.agent.model.ToolCall;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Bookkeeping for the pairing between assistant tool calls and tool-result messages.
 *
 * A well-formed sequence answers every call of an assistant tool request, each exactly once,
 * before any other message follows it.
 */
public final class ToolCallLedger {

    private ToolCallLedger() {
    }

    /**
     * Validates a whole turn's batch of messages before it is persisted.
     *
     * @throws ProtocolViolationException on an orphan or duplicate tool result, a duplicated call id,
     *         or a call left unanswered at the end of the batch
     */
    public static void validateTurn(List<Message> messages) {
        Set<String> open = scan(messages);
        if (!open.isEmpty()) {
            throw new ProtocolViolationException("Tool calls left without a result: " + open);
        }
    }

    /**
     * Length of the longest prefix of {@code messages} in which every tool request is fully answered.
     */
    public static int consistentPrefixLength(List<Message> messages) {
        Set<String> open = new LinkedHashSet<>();
        int consistent = 0;
        for (int i = 0; i < messages.size(); i++) {
            Message m = messages.get(i);
            if (m.requestsTools()) {
                m.getToolCalls().forEach(tc -> open.add(tc.getId()));
            } else if (m.getRole() == Message.Role.tool) {
                open.remove(m.getToolCallId());
            }
            if (open.isEmpty()) {
                consistent = i + 1;
            }
        }
        return consistent;
    }

    private static Set<String> scan(List<Message> messages) {
        Set<String> open = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();

        for (Message m : messages) {
            if (m.requestsTools()) {
                requireClosed(open);
                for (ToolCall tc : m.getToolCalls()) {
                    if (tc.getId() == null || tc.getId().isBlank()) {
                        throw new ProtocolViolationException(
                                "Tool call '" + tc.getToolName() + "' has no call id");
                    }
                    if (!seen.add(tc.getId())) {
                        throw new ProtocolViolationException("Duplicate tool call id '" + tc.getId() + "'");
                    }
                    open.add(tc.getId());
                }
            } else if (m.getRole() == Message.Role.tool) {
                if (!open.remove(m.getToolCallId())) {
                    throw new ProtocolViolationException(
                            "Tool result references unknown or already answered call id '"
                                    + m.getToolCallId() + "'");
                }
            } else {
                requireClosed(open);
            }
        }
        return open;
    }

    private static void requireClosed(Set<String> open) {
        if (!open.isEmpty()) {
            throw new ProtocolViolationException("Tool calls not answered before the next message: " + open);
        }
    }
}
