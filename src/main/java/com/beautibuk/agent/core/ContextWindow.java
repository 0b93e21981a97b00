package com.beautibuk.agent.core;

import com.beautibuk.agent.model.Message;

import java.util.List;

/**
 * Bounds the history sent to the model. The stored session is never truncated.
 *
 * The window keeps the last {@code maxMessages} messages, then moves its start forward to the
 * next user message so a tool result is never separated from the request that produced it.
 * If no user message follows the cut, the window starts at the last user message instead,
 * so the current turn always goes out whole.
 */
public final class ContextWindow {

    private ContextWindow() {
    }

    public static List<Message> trim(List<Message> conversation, int maxMessages) {
        if (maxMessages <= 0 || conversation.size() <= maxMessages) {
            return conversation;
        }

        int cut = conversation.size() - maxMessages;
        for (int i = cut; i < conversation.size(); i++) {
            if (conversation.get(i).getRole() == Message.Role.user) {
                return conversation.subList(i, conversation.size());
            }
        }
        for (int i = cut - 1; i >= 0; i--) {
            if (conversation.get(i).getRole() == Message.Role.user) {
                return conversation.subList(i, conversation.size());
            }
        }
        return conversation;
    }
}
