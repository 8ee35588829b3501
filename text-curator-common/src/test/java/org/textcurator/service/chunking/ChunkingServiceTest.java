package org.textcurator.service.chunking;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.language.LanguageProfileRegistry;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkingServiceTest {

    private static final String PARAGRAPH = "aaaa bbbb cccc dddd eeee ffff gggg hhhh iiii jjjj.";

    private ChunkingService service;

    @BeforeEach
    void setUp() {
        LanguageProfileRegistry registry = new LanguageProfileRegistry();
        service = new ChunkingService(registry, new ChunkBalancer(registry));
    }

    private static ChunkOptions.ChunkOptionsBuilder small() {
        return ChunkOptions.builder()
                .minChunkSize(5)
                .targetChunkSize(20)
                .maxChunkSize(40)
                .overlapSize(0);
    }

    private static String sentences(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "Aaaa bbbb cccc dddd eeee.")
                .collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("Automatic strategy selection")
    class Auto {

        @Test
        @DisplayName("Short text uses sentence chunking")
        void shortText() {
            List<Chunk> chunks = service.chunk("Hello world. This is a test.", ChunkOptions.defaults());

            assertThat(chunks).hasSize(1);
            assertThat(chunks.get(0).getMetadata().getStrategy()).isEqualTo(StrategyType.SENTENCE);
            assertThat(chunks.get(0).getMetadata().getLanguageCode()).isEqualTo("en");
        }

        @Test
        @DisplayName("Long text with many paragraphs uses paragraph chunking")
        void paragraphs() {
            String text = IntStream.range(0, 5).mapToObj(i -> PARAGRAPH).collect(Collectors.joining("\n\n"));

            assertThat(service.resolveStrategy(text, small().build())).isEqualTo(StrategyType.PARAGRAPH);
            assertThat(service.chunk(text, small().build()))
                    .allMatch(c -> c.getMetadata().getStrategy() == StrategyType.PARAGRAPH);
        }

        @Test
        @DisplayName("Long single paragraph with many sentences uses sentence chunking")
        void sentencesInOneParagraph() {
            assertThat(service.resolveStrategy(sentences(10), small().build())).isEqualTo(StrategyType.SENTENCE);
        }

        @Test
        @DisplayName("Long unstructured text uses token chunking")
        void unstructured() {
            String text = "abcd ".repeat(200);

            assertThat(service.resolveStrategy(text, small().build())).isEqualTo(StrategyType.TOKEN);
            List<Chunk> chunks = service.chunk(text, small().build());
            assertThat(chunks).hasSizeGreaterThan(1);
            assertThat(chunks).allMatch(c -> c.getMetadata().getStrategy() == StrategyType.TOKEN);
        }

        @Test
        @DisplayName("An explicit strategy is never overridden")
        void explicit() {
            assertThat(service.resolveStrategy("Short.", small().strategy(StrategyType.TOKEN).build()))
                    .isEqualTo(StrategyType.TOKEN);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Semantic chunking needs a similarity oracle")
        void semanticUnavailable() {
            ChunkOptions options = ChunkOptions.builder().strategy(StrategyType.SEMANTIC).build();

            assertThat(service.isStrategyAvailable(StrategyType.SEMANTIC)).isFalse();
            assertThatThrownBy(() -> service.chunk("Some text.", options))
                    .isInstanceOf(ChunkingConfigurationException.class)
                    .hasMessageContaining("similarity oracle");
            assertThatThrownBy(() -> service.chunkStream("Some text.", options))
                    .isInstanceOf(ChunkingConfigurationException.class);
            assertThatThrownBy(() -> service.estimateChunkCount("Some text.", options))
                    .isInstanceOf(ChunkingConfigurationException.class);
        }

        @Test
        @DisplayName("Semantic chunking is available once an oracle is configured")
        void semanticAvailable() {
            LanguageProfileRegistry registry = new LanguageProfileRegistry();
            ChunkingService withOracle = new ChunkingService(registry, new ChunkBalancer(registry),
                    text -> new float[]{1f, 0f});

            assertThat(withOracle.isStrategyAvailable(StrategyType.SEMANTIC)).isTrue();
            List<Chunk> chunks = withOracle.chunk("One idea. Same idea.",
                    ChunkOptions.builder().strategy(StrategyType.SEMANTIC).build());
            assertThat(chunks).hasSize(1);
        }

        @Test
        @DisplayName("Contradictory sizes are rejected before any work")
        void invalidSizes() {
            ChunkOptions options = small().minChunkSize(30).build();

            assertThatThrownBy(() -> service.chunk("Text.", options))
                    .isInstanceOf(ChunkingConfigurationException.class);
            assertThatThrownBy(() -> service.chunk("", options))
                    .isInstanceOf(ChunkingConfigurationException.class);
            assertThatThrownBy(() -> service.validate(null))
                    .isInstanceOf(ChunkingConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Hierarchical")
    class Hierarchical {

        private final ChunkOptions options = ChunkOptions.builder().strategy(StrategyType.HIERARCHICAL).build();

        @Test
        @DisplayName("Sections survive default options, which enable balancing")
        void sectionsKeptWithDefaultBalancing() {
            String text = "# Title\nIntro.\n## Sub\nBody text.";

            List<Chunk> chunks = service.chunk(text, options);

            assertThat(options.isEnableChunkBalancing()).isTrue();
            assertThat(chunks).hasSizeGreaterThanOrEqualTo(2);
            Chunk sub = chunks.stream()
                    .filter(c -> c.getMetadata().getSectionTitle().filter("Sub"::equals).isPresent())
                    .findFirst()
                    .orElseThrow();
            assertThat(sub.getMetadata().getHierarchyLevel()).contains(2);
            assertThat(sub.getLocation().getSectionPath()).isEqualTo("Title/Sub");
            assertThat(sub.getMetadata().getParentId()).contains(chunks.get(0).getId());
        }

        @Test
        @DisplayName("Streaming keeps the same sections")
        void streamKeepsSections() {
            String text = "# Title\nIntro.\n## Sub\nBody text.";

            List<Chunk> streamed = service.chunkStream(text, options).toList();

            assertThat(streamed).extracting(c -> c.getLocation().getSectionPath())
                    .containsExactly("Title", "Title/Sub");
            assertThat(streamed.get(1).getMetadata().getHierarchyLevel()).contains(2);
        }

        @Test
        @DisplayName("Every parent id resolves to an earlier chunk whose path prefixes the child's")
        void parentLinksResolve() {
            String text = "# A\nAlpha intro.\n## A1\nFirst part.\n### A1x\nDeep detail.\n## A2\nSecond part.";

            List<Chunk> listed = service.chunk(text, options);
            List<Chunk> streamed = service.chunkStream(text, options).toList();

            assertThat(listed).extracting(c -> c.getLocation().getSectionPath())
                    .containsExactly("A", "A/A1", "A/A1/A1x", "A/A2");
            assertThat(streamed).extracting(Chunk::getContent)
                    .containsExactlyElementsOf(listed.stream().map(Chunk::getContent).toList());
            assertParentLinks(listed);
            assertParentLinks(streamed);
        }

        private void assertParentLinks(List<Chunk> chunks) {
            for (Chunk chunk : chunks) {
                chunk.getMetadata().getParentId().ifPresent(parentId -> {
                    Chunk parent = chunks.stream()
                            .filter(c -> c.getId().equals(parentId))
                            .findFirst()
                            .orElseThrow(() -> new AssertionError("Dangling parent id " + parentId));
                    assertThat(parent.getIndex()).isLessThan(chunk.getIndex());
                    assertThat(chunk.getLocation().getSectionPath())
                            .startsWith(parent.getLocation().getSectionPath() + "/");
                });
            }
        }
    }

    @Test
    @DisplayName("Blank text yields nothing")
    void blankText() {
        assertThat(service.chunk("   ", ChunkOptions.defaults())).isEmpty();
        assertThat(service.chunk(null, ChunkOptions.defaults())).isEmpty();
        assertThat(service.chunkStream("\n\n", ChunkOptions.defaults())).isEmpty();
        assertThat(service.estimateChunkCount("", ChunkOptions.defaults())).isZero();
    }

    @Test
    @DisplayName("Language is detected unless set explicitly")
    void languageResolution() {
        String korean = "안녕하세요. 오늘 날씨가 좋습니다.";

        assertThat(service.chunk(korean, ChunkOptions.defaults()).get(0).getMetadata().getLanguageCode())
                .isEqualTo("ko");
        assertThat(service.chunk(korean, ChunkOptions.forRag().toBuilder().languageCode("ja").build())
                .get(0).getMetadata().getLanguageCode()).isEqualTo("ja");
    }

    @Test
    @DisplayName("normalizeWhitespace collapses whitespace inside chunks")
    void normalizeWhitespace() {
        List<Chunk> chunks = service.chunk("Hello   world.\nNext line here.",
                ChunkOptions.defaults().toBuilder().normalizeWhitespace(true).build());

        assertThat(chunks.get(0).getContent()).isEqualTo("Hello world. Next line here.");
    }

    @Test
    @DisplayName("Chunks stay ordered and within max after balancing")
    void balancedOutput() {
        List<Chunk> chunks = service.chunk(sentences(30), small().strategy(StrategyType.SENTENCE).build());

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).extracting(Chunk::getIndex)
                .containsExactlyElementsOf(IntStream.range(0, chunks.size()).boxed().toList());
        assertThat(chunks).allMatch(c -> c.getTotalChunks() == chunks.size());
        assertThat(chunks).allMatch(c -> c.getEstimatedTokenCount() <= 40);
        assertThat(service.calculateStats(chunks, small().build()).oversizedChunkCount()).isZero();
    }

    @Test
    @DisplayName("The stream produces the same chunks with running positions")
    void streamMatchesList() {
        ChunkOptions options = small().strategy(StrategyType.SENTENCE).build();
        String text = sentences(30);

        List<Chunk> listed = service.chunk(text, options);
        List<Chunk> streamed = service.chunkStream(text, options).toList();

        assertThat(streamed).extracting(Chunk::getContent)
                .containsExactlyElementsOf(listed.stream().map(Chunk::getContent).toList());
        for (int i = 0; i < streamed.size(); i++) {
            assertThat(streamed.get(i).getIndex()).isEqualTo(i);
            assertThat(streamed.get(i).getTotalChunks()).isEqualTo(i + 1);
        }
    }

    @Test
    @DisplayName("A cancelled token aborts chunking and streaming")
    void cancellation() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        String text = sentences(30);

        assertThatThrownBy(() -> service.chunk(text, small().build(), token))
                .isInstanceOf(CancellationException.class);
        assertThatThrownBy(() -> service.chunkStream(text, small().build(), token).toList())
                .isInstanceOf(CancellationException.class);
    }

    @Test
    @DisplayName("Estimates follow the resolved strategy")
    void estimate() {
        assertThat(service.estimateChunkCount("Hello world.", ChunkOptions.defaults())).isEqualTo(1);
        assertThat(service.estimateChunkCount("abcd ".repeat(200),
                small().strategy(StrategyType.TOKEN).build())).isEqualTo(10);
    }
}
