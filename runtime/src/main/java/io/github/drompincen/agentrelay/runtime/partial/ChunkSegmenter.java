package io.github.drompincen.agentrelay.runtime.partial;

import io.github.drompincen.agentrelay.protocol.api.OutputChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a response's text into display chunks. A new chunk opens after tool activity, at a
 * blank-line paragraph break, or when the text starts with a transition phrase.
 * Not thread-safe; owned by one accumulator.
 */
final class ChunkSegmenter {

    private static final Pattern TRANSITION = Pattern.compile(
            "^(now|next|let me|i'll|here|based on|first|finally|done)\\b", Pattern.CASE_INSENSITIVE);

    private final List<OutputChunk> chunks = new ArrayList<>();
    private String lastTool;

    void onText(String text, long timestamp) {
        if (text.isEmpty()) return;
        if (opensChunk(text)) {
            chunks.add(new OutputChunk(text, lastTool, timestamp));
        } else {
            int last = chunks.size() - 1;
            chunks.set(last, chunks.get(last).append(text));
        }
        lastTool = null;
    }

    void onTool(String tool) {
        lastTool = tool != null ? tool : "unknown";
    }

    List<OutputChunk> chunks() {
        return List.copyOf(chunks);
    }

    private boolean opensChunk(String text) {
        return chunks.isEmpty()
                || lastTool != null
                || text.startsWith("\n\n")
                || TRANSITION.matcher(text.strip()).find();
    }
}
