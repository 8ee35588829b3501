package org.textcurator.service.chunking.strategy;

import org.textcurator.model.Chunk;
import org.textcurator.model.ChunkLocation;
import org.textcurator.model.ChunkMetadata;
import org.textcurator.model.ChunkOptions;
import org.textcurator.model.StrategyType;
import org.textcurator.service.language.LanguageProfile;

import java.util.Arrays;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Turns source ranges into {@link Chunk}s for one chunking run.
 *
 * <p>Ranges are trimmed to their non-whitespace extent so that a chunk's
 * location always covers exactly its content (before optional whitespace
 * normalisation). Not thread-safe; one instance per run.</p>
 */
final class ChunkAssembler {

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\x0B\\f\\r\\u00A0]+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\s*\\n\\s*\\n\\s*");
    private static final Pattern SINGLE_LINE_BREAK = Pattern.compile("(?<!\\n) ?\\n ?(?!\\n)");

    private final String text;
    private final LanguageProfile profile;
    private final ChunkOptions options;
    private final StrategyType strategy;

    private int[] lineBreaks;
    private int sequence;

    ChunkAssembler(String text, LanguageProfile profile, ChunkOptions options, StrategyType strategy) {
        this.text = text;
        this.profile = profile;
        this.options = options;
        this.strategy = strategy;
    }

    String text() {
        return text;
    }

    LanguageProfile profile() {
        return profile;
    }

    ChunkOptions options() {
        return options;
    }

    /**
     * Assembles the chunk covering {@code text[start, end)}.
     *
     * @return the chunk, or {@code null} when the range is blank
     */
    Chunk assemble(int start, int end) {
        return assemble(start, end, null, null);
    }

    /**
     * Assembles a hierarchical chunk.
     *
     * @param tag section data
     * @param id  explicit id, or {@code null} for a generated one
     */
    Chunk assemble(int start, int end, HierarchyTag tag, String id) {
        int s = Math.max(0, start);
        int e = Math.min(end, text.length());
        while (s < e && Character.isWhitespace(text.charAt(s))) {
            s++;
        }
        while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
            e--;
        }
        if (s >= e) {
            return null;
        }

        String content = text.substring(s, e);
        if (options.isNormalizeWhitespace()) {
            content = normalizeWhitespace(content);
        }

        ChunkMetadata.ChunkMetadataBuilder metadata = ChunkMetadata.builder()
                .estimatedTokenCount(profile.estimateTokenCount(content))
                .strategy(strategy)
                .languageCode(profile.getLanguageCode());
        ChunkLocation.ChunkLocationBuilder location = ChunkLocation.builder()
                .startPosition(s)
                .endPosition(e)
                .startLine(lineOf(s))
                .endLine(lineOf(e - 1));

        if (tag != null) {
            metadata.hierarchyLevel(tag.level())
                    .parentId(tag.parentId())
                    .sectionTitle(tag.title());
            location.sectionPath(tag.sectionPath());
        }

        int position = sequence++;
        return Chunk.builder()
                .id(id != null ? id : UUID.randomUUID().toString())
                .index(position)
                .totalChunks(position + 1)
                .content(content)
                .metadata(metadata.build())
                .location(location.build())
                .build();
    }

    /**
     * 1-based line number of the character at {@code offset}.
     */
    int lineOf(int offset) {
        if (lineBreaks == null) {
            lineBreaks = indexLineBreaks(text);
        }
        int found = Arrays.binarySearch(lineBreaks, offset);
        int breaksBefore = found >= 0 ? found : -found - 1;
        return breaksBefore + 1;
    }

    static String normalizeWhitespace(String content) {
        String normalized = PARAGRAPH_BREAK.matcher(content).replaceAll("\n\n");
        normalized = HORIZONTAL_WHITESPACE.matcher(normalized).replaceAll(" ");
        return SINGLE_LINE_BREAK.matcher(normalized).replaceAll(" ");
    }

    private static int[] indexLineBreaks(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        int[] breaks = new int[count];
        int k = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                breaks[k++] = i;
            }
        }
        return breaks;
    }
}
