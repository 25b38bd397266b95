package com.scout.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Role-tagged conversation message.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    @JsonProperty("role")
    private MessageRole role;

    @JsonProperty("content")
    private String content;

    public static Message user(String content) {
        return new Message(MessageRole.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(MessageRole.ASSISTANT, content);
    }
}
