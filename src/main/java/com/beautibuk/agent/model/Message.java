package com.beautibuk.agent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One turn in a conversation. Insertion order inside a session is conversational order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    /** {@code tool} is the tool-result role. */
    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    /** May be empty when the message is a pure tool invocation */
    private String content;

    /** Present only on assistant messages that request tools, in the order the model returned them */
    private List<ToolCall> toolCalls;

    /** Present only when role = tool: the id of the ToolCall this result answers */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message toolRequest(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(Role.assistant)
                .content(content != null ? content : "")
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    public static Message toolResult(ToolCall call, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(call.getId())
                .name(call.getToolName())
                .content(content)
                .build();
    }

    @JsonIgnore
    public boolean requestsTools() {
        return role == Role.assistant && toolCalls != null && !toolCalls.isEmpty();
    }
}
