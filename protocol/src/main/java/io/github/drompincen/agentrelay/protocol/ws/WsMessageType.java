package io.github.drompincen.agentrelay.protocol.ws;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum WsMessageType {
    // Client -> Server
    @JsonProperty("auth") AUTH,
    @JsonProperty("message") MESSAGE,
    @JsonProperty("cancel") CANCEL,
    @JsonProperty("tool_answer") TOOL_ANSWER,

    // Server -> Client
    @JsonProperty("auth_ok") AUTH_OK,
    @JsonProperty("auth_error") AUTH_ERROR,
    @JsonProperty("thinking") THINKING,
    @JsonProperty("text") TEXT,
    @JsonProperty("tool_use") TOOL_USE,
    @JsonProperty("tool_result") TOOL_RESULT,
    @JsonProperty("done") DONE,
    @JsonProperty("error") ERROR,
    @JsonProperty("streaming_restore") STREAMING_RESTORE,
    @JsonProperty("sync_user_message") SYNC_USER_MESSAGE,
    @JsonProperty("sync_cancel") SYNC_CANCEL;

    /** Client actions that are rejected with a soft error until the connection has authenticated. */
    public boolean requiresAuth() {
        return this == MESSAGE || this == CANCEL || this == TOOL_ANSWER;
    }
}
