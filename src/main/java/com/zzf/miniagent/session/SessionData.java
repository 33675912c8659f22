package com.zzf.miniagent.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zzf.miniagent.llm.Message;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionData {
    private String id;
    private List<Message> messages = new ArrayList<>();
    @JsonProperty("created_at")
    private String createdAt;
}
