package com.zzf.miniagent.directive;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
public class ToolCall {
    String name;
    JsonNode args;
}
