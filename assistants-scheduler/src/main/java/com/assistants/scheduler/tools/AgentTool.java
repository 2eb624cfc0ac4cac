package com.assistants.scheduler.tools;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Tool exposed to the assistant: a name, a description, a JSON parameter
 * schema and an asynchronous execute method returning a {@link ToolResult}.
 */
public interface AgentTool {

    String getName();

    /** Human-readable description for the model. */
    String getDescription();

    /** JSON Schema of the input parameters. */
    JsonNode getParameterSchema();

    CompletableFuture<ToolResult> execute(ToolContext context);

    // --- Supporting types ---

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolResult {
        private boolean success;
        private String output;
        private String error;

        public static ToolResult ok(String output) {
            return ToolResult.builder().success(true).output(output).build();
        }

        public static ToolResult fail(String error) {
            return ToolResult.builder().success(false).error(error).build();
        }

        /** Text shown to the model: the output, or the error for failures. */
        public String text() {
            return success ? output : error;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    class ToolContext {
        private JsonNode parameters;
        /** Session the call originates from, may be null. */
        private String sessionId;
        private String cwd;
    }
}
