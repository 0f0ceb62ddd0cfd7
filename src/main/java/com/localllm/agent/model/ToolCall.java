package com.localllm.agent.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Assigned by the LLM; echoed back in the tool result message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;

    /** Set when the LLM's argument text was not a JSON object; the call is answered with a failure. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String argumentError;
}
