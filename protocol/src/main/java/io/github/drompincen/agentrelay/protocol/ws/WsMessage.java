package io.github.drompincen.agentrelay.protocol.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.agentrelay.protocol.api.OutputChunk;
import io.github.drompincen.agentrelay.protocol.api.PartialResponse;
import io.github.drompincen.agentrelay.protocol.api.ToolActivity;
import io.github.drompincen.agentrelay.protocol.api.ToolAnswer;
import io.github.drompincen.agentrelay.protocol.api.ToolResult;
import io.github.drompincen.agentrelay.protocol.api.ToolUse;

import java.util.List;

/**
 * Decrypted plaintext of one socket frame. The shape is flat: only the fields relevant to
 * {@link #type()} are populated, everything else is omitted from the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WsMessage(
        WsMessageType type,
        String projectId,
        String text,
        String pin,
        String error,
        String code,
        List<String> activeProjectIds,
        String thinking,
        List<ToolActivity> activity,
        List<OutputChunk> chunks,
        ToolUse toolUse,
        ToolResult toolResult,
        List<ToolAnswer> answers,
        Long retryAfterMs
) {
    public static final String CODE_INVALID_PIN = "invalid_pin";
    public static final String CODE_RATE_LIMITED = "rate_limited";

    private static WsMessage of(WsMessageType type, String projectId) {
        return new WsMessage(type, projectId, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    private static WsMessage withText(WsMessageType type, String projectId, String text) {
        return new WsMessage(type, projectId, text, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    public static WsMessage auth(String pin) {
        return new WsMessage(WsMessageType.AUTH, null, null, pin, null, null, null, null,
                null, null, null, null, null, null);
    }

    public static WsMessage message(String projectId, String text) {
        return withText(WsMessageType.MESSAGE, projectId, text);
    }

    public static WsMessage cancel(String projectId) {
        return of(WsMessageType.CANCEL, projectId);
    }

    public static WsMessage toolAnswer(String projectId, List<ToolAnswer> answers) {
        return new WsMessage(WsMessageType.TOOL_ANSWER, projectId, null, null, null, null, null, null,
                null, null, null, null, answers, null);
    }

    public static WsMessage authOk(List<String> activeProjectIds) {
        return new WsMessage(WsMessageType.AUTH_OK, null, null, null, null, null, activeProjectIds, null,
                null, null, null, null, null, null);
    }

    public static WsMessage authError(String code, String error, Long retryAfterMs) {
        return new WsMessage(WsMessageType.AUTH_ERROR, null, null, null, error, code, null, null,
                null, null, null, null, null, retryAfterMs);
    }

    public static WsMessage thinking(String projectId, String text) {
        return withText(WsMessageType.THINKING, projectId, text);
    }

    public static WsMessage text(String projectId, String text) {
        return withText(WsMessageType.TEXT, projectId, text);
    }

    public static WsMessage toolUse(String projectId, ToolUse toolUse) {
        return new WsMessage(WsMessageType.TOOL_USE, projectId, null, null, null, null, null, null,
                null, null, toolUse, null, null, null);
    }

    public static WsMessage toolResult(String projectId, ToolResult toolResult) {
        return new WsMessage(WsMessageType.TOOL_RESULT, projectId, null, null, null, null, null, null,
                null, null, null, toolResult, null, null);
    }

    public static WsMessage done(String projectId) {
        return of(WsMessageType.DONE, projectId);
    }

    public static WsMessage error(String projectId, String error) {
        return new WsMessage(WsMessageType.ERROR, projectId, null, null, error, null, null, null,
                null, null, null, null, null, null);
    }

    public static WsMessage streamingRestore(String projectId, PartialResponse partial) {
        return new WsMessage(WsMessageType.STREAMING_RESTORE, projectId, partial.text(), null, null, null, null,
                partial.thinking(), partial.activity(), partial.chunks(), null, null, null, null);
    }

    public static WsMessage syncUserMessage(String projectId, String text) {
        return withText(WsMessageType.SYNC_USER_MESSAGE, projectId, text);
    }

    public static WsMessage syncCancel(String projectId) {
        return of(WsMessageType.SYNC_CANCEL, projectId);
    }
}
