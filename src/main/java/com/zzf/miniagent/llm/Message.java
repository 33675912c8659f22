package com.zzf.miniagent.llm;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Objects;

/**
 * A single conversation entry. Immutable, so snapshots can be shared freely.
 */
@Value
public class Message {
    Role role;
    String content;

    @JsonCreator
    public Message(@JsonProperty("role") Role role, @JsonProperty("content") String content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content == null ? "" : content;
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content);
    }

    public Message withContent(String newContent) {
        return new Message(role, newContent);
    }
}
