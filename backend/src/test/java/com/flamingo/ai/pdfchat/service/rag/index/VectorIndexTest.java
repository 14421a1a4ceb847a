package com.flamingo.ai.pdfchat.service.rag.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorIndex Tests")
class VectorIndexTest {

  private VectorIndex index;

  @BeforeEach
  void setUp() {
    index = new VectorIndex();
  }

  private static DocumentChunk chunk(String id, float... embedding) {
    return DocumentChunk.builder().id(id).documentId("doc-1").text(id).embedding(embedding).build();
  }

  private static RetrievalQuery query(float... embedding) {
    return new RetrievalQuery("q", embedding);
  }

  @Test
  @DisplayName("Should rank chunks by dot product similarity")
  void shouldRankBySimilarity() {
    index.add(chunk("east", 1f, 0f));
    index.add(chunk("north", 0f, 1f));
    index.add(chunk("north-east", 0.7071f, 0.7071f));

    List<ScoredCandidate> results = index.search(query(0f, 1f), 3);

    assertThat(results)
        .extracting(c -> c.chunk().getId())
        .containsExactly("north", "north-east", "east");
    assertThat(results.get(0).score()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Equal scores should keep insertion order")
  void shouldBreakTiesByInsertionOrder() {
    index.add(chunk("first", 1f, 0f));
    index.add(chunk("second", 1f, 0f));
    index.add(chunk("third", 1f, 0f));

    assertThat(index.search(query(1f, 0f), 3))
        .extracting(c -> c.chunk().getId())
        .containsExactly("first", "second", "third");
  }

  @Test
  @DisplayName("Should return at most k candidates")
  void shouldLimitToK() {
    for (int i = 0; i < 30; i++) {
      index.add(chunk("c" + i, 1f, i));
    }

    assertThat(index.search(query(1f, 0f), 20)).hasSize(20);
    assertThat(index.search(query(1f, 0f), 0)).isEmpty();
  }

  @Test
  @DisplayName("Adding the same chunk id twice should be a no-op")
  void shouldIgnoreDuplicateIds() {
    assertThat(index.add(chunk("dup", 1f, 0f))).isTrue();
    assertThat(index.add(chunk("dup", 0f, 1f))).isFalse();

    assertThat(index.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should return nothing when empty or when the query has no vector")
  void shouldReturnEmptyForEmptyIndexOrKeywordOnlyQuery() {
    assertThat(index.search(query(1f, 0f), 5)).isEmpty();

    index.add(chunk("a", 1f, 0f));
    assertThat(index.search(RetrievalQuery.keywordOnly("q"), 5)).isEmpty();
  }

  @Test
  @DisplayName("Should reject vectors of a different dimension")
  void shouldRejectDimensionMismatch() {
    index.add(chunk("a", 1f, 0f));

    assertThatThrownBy(() -> index.add(chunk("b", 1f, 0f, 0f)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> index.search(query(1f), 1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Clear should drop all chunks and the fixed dimension")
  void shouldClear() {
    index.add(chunk("a", 1f, 0f));
    index.clear();

    assertThat(index.size()).isZero();
    assertThat(index.add(chunk("b", 1f, 0f, 0f))).isTrue();
  }
}
