package io.github.drompincen.agentrelay.runtime.partial;

import io.github.drompincen.agentrelay.protocol.api.OutputChunk;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkSegmenterTest {

    private final ChunkSegmenter segmenter = new ChunkSegmenter();

    @Test
    void plainContinuationExtendsTheCurrentChunk() {
        segmenter.onText("The build ", 1);
        segmenter.onText("passed.", 2);

        assertThat(segmenter.chunks()).extracting(OutputChunk::text).containsExactly("The build passed.");
    }

    @Test
    void transitionPhrasesOpenNewChunksCaseInsensitively() {
        segmenter.onText("Reading the file.", 1);
        segmenter.onText("  let me check the tests", 2);
        segmenter.onText("BASED ON that, all good", 3);
        segmenter.onText("Nowhere near done", 4);

        assertThat(segmenter.chunks()).extracting(OutputChunk::text).containsExactly(
                "Reading the file.", "  let me check the tests", "BASED ON that, all goodNowhere near done");
    }

    @Test
    void paragraphBreakOpensNewChunk() {
        segmenter.onText("one", 1);
        segmenter.onText("\n\ntwo", 2);

        assertThat(segmenter.chunks()).hasSize(2);
    }

    @Test
    void textAfterToolActivityRecordsTheTool() {
        segmenter.onText("Looking", 1);
        segmenter.onTool("Grep");
        segmenter.onText("found it", 2);
        segmenter.onText(" twice", 3);

        assertThat(segmenter.chunks()).containsExactly(
                new OutputChunk("Looking", null, 1),
                new OutputChunk("found it twice", "Grep", 2));
    }
}
