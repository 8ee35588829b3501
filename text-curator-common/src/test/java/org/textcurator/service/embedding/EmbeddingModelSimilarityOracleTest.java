package org.textcurator.service.embedding;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.retry.TransientAiException;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingModelSimilarityOracle Tests")
class EmbeddingModelSimilarityOracleTest {

    private static final String TOO_LARGE = "the input (812 tokens) is too large to process";

    @Mock
    private EmbeddingModel embeddingModel;

    private EmbeddingModelSimilarityOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new EmbeddingModelSimilarityOracle(embeddingModel, "test-model");
    }

    private static EmbeddingResponse responseOf(float[]... vectors) {
        List<Embedding> embeddings = new ArrayList<>();
        for (int i = 0; i < vectors.length; i++) {
            embeddings.add(new Embedding(vectors[i], i));
        }
        return new EmbeddingResponse(embeddings);
    }

    private static float[] topicVector(String text) {
        return text.contains("Right") ? new float[]{0f, 1f} : new float[]{1f, 0f};
    }

    @Test
    @DisplayName("Should embed a batch in a single request")
    void shouldEmbedBatchInOneRequest() {
        when(embeddingModel.call(any(EmbeddingRequest.class))).thenReturn(
                responseOf(new float[]{1f, 0f}, new float[]{0f, 1f}));

        List<float[]> vectors = oracle.embedBatch(List.of("First sentence.", "Second sentence."));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(1)).containsExactly(0f, 1f);
        verify(embeddingModel, times(1)).call(any(EmbeddingRequest.class));
        assertThat(oracle.getModelName()).isEqualTo("test-model");
    }

    @Test
    @DisplayName("Should fall back to one request per text when the batch is too large")
    void shouldFallBackWhenBatchTooLarge() {
        when(embeddingModel.call(any(EmbeddingRequest.class))).thenAnswer(invocation -> {
            EmbeddingRequest request = invocation.getArgument(0);
            if (request.getInstructions().size() > 1) {
                throw new TransientAiException(TOO_LARGE);
            }
            return responseOf(topicVector(request.getInstructions().get(0)));
        });

        List<float[]> vectors = oracle.embedBatch(List.of("Left one.", "Right one."));

        assertThat(vectors.get(0)).containsExactly(1f, 0f);
        assertThat(vectors.get(1)).containsExactly(0f, 1f);
        verify(embeddingModel, times(3)).call(any(EmbeddingRequest.class));
    }

    @Test
    @DisplayName("Should average the halves of a text the model rejects as too large")
    void shouldSplitAndAverage() {
        String text = "Left" + " word".repeat(29) + "\n" + "Right" + " word".repeat(29);
        when(embeddingModel.call(any(EmbeddingRequest.class))).thenAnswer(invocation -> {
            EmbeddingRequest request = invocation.getArgument(0);
            String input = request.getInstructions().get(0);
            if (input.length() > 250) {
                throw new TransientAiException(TOO_LARGE);
            }
            return responseOf(topicVector(input));
        });

        float[] vector = oracle.embed(text);

        assertThat(vector).containsExactly(0.5f, 0.5f);
    }

    @Test
    @DisplayName("Should rethrow transient errors unrelated to input size")
    void shouldRethrowOtherErrors() {
        when(embeddingModel.call(any(EmbeddingRequest.class)))
                .thenThrow(new TransientAiException("connection refused"));

        assertThatThrownBy(() -> oracle.embed("Some text."))
                .isInstanceOf(TransientAiException.class)
                .hasMessage("connection refused");
    }

    @Test
    @DisplayName("Should truncate inputs beyond the safety cap")
    void shouldTruncateHugeInput() {
        when(embeddingModel.call(any(EmbeddingRequest.class))).thenReturn(responseOf(new float[]{1f}));

        oracle.embed("x".repeat(5000));

        ArgumentCaptor<EmbeddingRequest> captor = ArgumentCaptor.forClass(EmbeddingRequest.class);
        verify(embeddingModel).call(captor.capture());
        assertThat(captor.getValue().getInstructions().get(0)).hasSize(3000);
    }

    @Test
    @DisplayName("Should not call the model for blank text")
    void shouldSkipBlankText() {
        assertThat(oracle.embed("  \u0000 ")).isEmpty();
        assertThat(oracle.embedBatch(List.of())).isEmpty();
        verifyNoInteractions(embeddingModel);
    }
}
