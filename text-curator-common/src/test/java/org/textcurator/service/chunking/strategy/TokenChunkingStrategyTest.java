package org.textcurator.service.chunking.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.chunking.CancellationToken;
import org.textcurator.service.language.ChineseLanguageProfile;
import org.textcurator.service.language.EnglishLanguageProfile;
import org.textcurator.service.language.LanguageProfile;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class TokenChunkingStrategyTest {

    private final TokenChunkingStrategy strategy = new TokenChunkingStrategy();
    private final LanguageProfile english = new EnglishLanguageProfile();

    private static ChunkOptions.ChunkOptionsBuilder sized(int min, int target, int max, int overlap) {
        return ChunkOptions.builder()
                .strategy(StrategyType.TOKEN)
                .minChunkSize(min)
                .targetChunkSize(target)
                .maxChunkSize(max)
                .overlapSize(overlap);
    }

    private static String words(String prefix, int count, String format) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> prefix + String.format(format, i))
                .collect(Collectors.joining(" "));
    }

    @Test
    @DisplayName("Long text is split into several chunks within the max size")
    void respectsMax() {
        String text = words("word", 100, "%d");

        List<Chunk> chunks = strategy.chunk(text, english, sized(10, 50, 60, 50).build(), CancellationToken.none());

        assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
        assertThat(chunks).allMatch(c -> c.getEstimatedTokenCount() <= 60);
        assertThat(chunks).allMatch(c -> c.getMetadata().getStrategy() == StrategyType.TOKEN);
        assertThat(chunks.get(0).getContent()).startsWith("word1 word2");
        assertThat(chunks.get(chunks.size() - 1).getContent()).endsWith("word100");
    }

    @Test
    @DisplayName("preserveSentences moves the cut back to the last sentence end")
    void snapsToSentenceEnd() {
        String text = "Aaaa bbbb cccc. Dddd eeee ffff gggg hhhh.";

        List<Chunk> chunks = strategy.chunk(text, english, sized(1, 5, 10, 0).preserveSentences(true).build(),
                CancellationToken.none());

        assertThat(chunks).extracting(Chunk::getContent)
                .containsExactly("Aaaa bbbb cccc.", "Dddd eeee ffff gggg", "hhhh.");
    }

    @Test
    @DisplayName("Without preserveSentences the cut falls on the target word count")
    void cutsAtTarget() {
        String text = "Aaaa bbbb cccc. Dddd eeee ffff gggg hhhh.";

        List<Chunk> chunks = strategy.chunk(text, english, sized(1, 5, 10, 0).preserveSentences(false).build(),
                CancellationToken.none());

        assertThat(chunks.get(0).getContent()).isEqualTo("Aaaa bbbb cccc. Dddd");
    }

    @Test
    @DisplayName("Overlap repeats the trailing words of the previous chunk")
    void overlapRepeatsWords() {
        String text = words("w", 40, "%02d");

        List<Chunk> chunks = strategy.chunk(text, english, sized(1, 10, 20, 2).preserveSentences(false).build(),
                CancellationToken.none());

        assertThat(chunks.get(0).getContent()).endsWith("w12 w13");
        assertThat(chunks.get(1).getContent()).startsWith("w12 w13 w14");
        assertThat(chunks.get(1).getLocation().getStartPosition())
                .isLessThan(chunks.get(0).getLocation().getEndPosition());
        assertThat(chunks.get(chunks.size() - 1).getContent()).endsWith("w40");
    }

    @Test
    @DisplayName("Text without spaces is cut between characters")
    void unspacedScript() {
        String text = "天".repeat(300);

        List<Chunk> chunks = strategy.chunk(text, new ChineseLanguageProfile(),
                sized(10, 50, 60, 0).preserveSentences(false).build(), CancellationToken.none());

        assertThat(chunks).hasSize(4);
        assertThat(chunks).allMatch(c -> c.getContent().length() == 75);
        assertThat(chunks).allMatch(c -> c.getEstimatedTokenCount() == 50);
    }

    @Test
    @DisplayName("Estimate caps overlap at half the target")
    void estimate() {
        String text = "word ".repeat(400);

        assertThat(strategy.estimateChunkCount(text, english, sized(10, 100, 200, 90).build())).isEqualTo(8);
        assertThat(strategy.estimateChunkCount("tiny", english, ChunkOptions.defaults())).isEqualTo(1);
        assertThat(strategy.estimateChunkCount(" ", english, ChunkOptions.defaults())).isZero();
    }
}
