package com.flamingo.ai.pdfchat.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private RagConfig ragConfig;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient().when(meterRegistry.counter(anyString())).thenReturn(counter);
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    ragConfig = new RagConfig();
    embeddingService = new EmbeddingService(embeddingModel, ragConfig, meterRegistry);
  }

  private void answerWith(float[] vector) {
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(segments.stream().map(s -> Embedding.from(vector)).toList());
            });
  }

  @Test
  @DisplayName("Should return a unit-length query vector")
  void shouldNormalizeQueryVector() {
    answerWith(new float[] {3f, 4f});

    float[] result = embeddingService.embedQuery("What is the capital of France?");

    assertThat(result[0]).isCloseTo(0.6f, within(1e-6f));
    assertThat(result[1]).isCloseTo(0.8f, within(1e-6f));
    verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should embed passages in batches and keep their order")
  void shouldEmbedPassagesInBatches() {
    ragConfig.getEmbedding().setBatchSize(2);
    answerWith(new float[] {1f, 0f});

    List<float[]> vectors = embeddingService.embedPassages(List.of("a", "b", "c", "d", "e"));

    assertThat(vectors).hasSize(5);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<TextSegment>> batches = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel, times(3)).embedAll(batches.capture());
    assertThat(batches.getAllValues()).extracting(List::size).containsExactly(2, 2, 1);
    assertThat(batches.getAllValues().get(2).get(0).text()).isEqualTo("e");
  }

  @Test
  @DisplayName("Should not call the model for an empty passage list")
  void shouldSkipEmptyPassageList() {
    assertThat(embeddingService.embedPassages(List.of())).isEmpty();

    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  @DisplayName("Should truncate text longer than the configured limit")
  void shouldTruncateLongText() {
    ragConfig.getEmbedding().setMaxChars(100);
    answerWith(new float[] {1f});

    embeddingService.embedPassages(List.of("x".repeat(500)));

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<TextSegment>> batch = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel).embedAll(batch.capture());
    assertThat(batch.getValue().get(0).text()).hasSize(100);
  }

  @Test
  @DisplayName("Should report an unreachable model as unavailable")
  void shouldWrapModelFailure() {
    when(embeddingModel.embedAll(anyList())).thenThrow(new RuntimeException("connect timed out"));

    assertThatThrownBy(() -> embeddingService.embedQuery("hello"))
        .isInstanceOf(EmbeddingUnavailableException.class)
        .hasMessageContaining("connect timed out")
        .hasRootCauseMessage("connect timed out");
  }

  @Test
  @DisplayName("Should report a vector count mismatch as unavailable")
  void shouldRejectCountMismatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

    assertThatThrownBy(() -> embeddingService.embedPassages(List.of("one", "two")))
        .isInstanceOf(EmbeddingUnavailableException.class)
        .hasMessageContaining("1 vectors for 2 inputs");
  }

  @Test
  @DisplayName("Identical text should give identical vectors")
  void shouldBeDeterministic() {
    answerWith(new float[] {0.2f, 0.5f, 0.1f});

    float[] first = embeddingService.embedQuery("same text");
    float[] second = embeddingService.embedQuery("same text");

    assertThat(second).containsExactly(first);
  }

  @Test
  @DisplayName("Should leave a zero vector unchanged")
  void shouldLeaveZeroVectorUnchanged() {
    assertThat(EmbeddingService.normalize(new float[] {0f, 0f})).containsExactly(0f, 0f);
  }
}
