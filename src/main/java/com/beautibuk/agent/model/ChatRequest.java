package com.beautibuk.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    private String message;

    /**
     * Optional. If absent a fresh session id is generated.
     */
    @JsonProperty("session_id")
    private String sessionId;
}
