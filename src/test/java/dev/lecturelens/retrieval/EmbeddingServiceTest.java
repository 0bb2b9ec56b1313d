package dev.lecturelens.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.lecturelens.model.LazyModel;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {

  private final RetrievalProperties properties = new RetrievalProperties();

  @Test
  void prependsQueryPrefixBeforeEmbedding() {
    List<String> seen = new ArrayList<>();
    EmbeddingModel model = fixedDimension(384, seen);
    EmbeddingService service = new EmbeddingService(LazyModel.ready("q", model), properties);

    Embedding embedding = service.embedQuery("entropy increases");

    assertThat(embedding.dimension()).isEqualTo(384);
    assertThat(seen).containsExactly(RetrievalProperties.BGE_QUERY_PREFIX + "entropy increases");
  }

  @Test
  void dimensionMismatchIsFatal() {
    EmbeddingService service =
        new EmbeddingService(
            LazyModel.ready("q", fixedDimension(768, new ArrayList<>())), properties);

    assertThatThrownBy(() -> service.embedQuery("entropy"))
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("384")
        .hasMessageContaining("768");
  }

  @Test
  void verifyDimensionAcceptsMatchingModel() {
    EmbeddingService service =
        new EmbeddingService(
            LazyModel.ready("q", fixedDimension(384, new ArrayList<>())), properties);

    assertThat(service.verifyDimension()).isTrue();
  }

  @Test
  void verifyDimensionRejectsMisconfiguredIndex() {
    properties.setDimension(768);
    EmbeddingService service =
        new EmbeddingService(
            LazyModel.ready("q", fixedDimension(384, new ArrayList<>())), properties);

    assertThatThrownBy(service::verifyDimension)
        .isInstanceOf(EmbeddingDimensionMismatchException.class)
        .hasMessageContaining("768")
        .hasMessageContaining("384");
  }

  @Test
  void verifyDimensionSkipsUnavailableModel() {
    LazyModel<EmbeddingModel> broken =
        new LazyModel<>(
            "q",
            () -> {
              throw new IllegalStateException("no model");
            });

    assertThat(new EmbeddingService(broken, properties).verifyDimension()).isFalse();
  }

  @Test
  void unavailableModelIsEmbeddingError() {
    LazyModel<EmbeddingModel> broken =
        new LazyModel<>(
            "q",
            () -> {
              throw new IllegalStateException("no model");
            });

    assertThatThrownBy(() -> new EmbeddingService(broken, properties).embedQuery("entropy"))
        .isInstanceOf(EmbeddingException.class);
  }

  @Test
  void inferenceFailureIsEmbeddingError() {
    EmbeddingModel failing =
        segments -> {
          throw new IllegalStateException("ort session closed");
        };

    assertThatThrownBy(
            () ->
                new EmbeddingService(LazyModel.ready("q", failing), properties)
                    .embedQuery("entropy"))
        .isInstanceOf(EmbeddingException.class)
        .hasMessageContaining("ort session closed");
  }

  private static EmbeddingModel fixedDimension(int dimension, List<String> seen) {
    return segments -> {
      segments.stream().map(TextSegment::text).forEach(seen::add);
      return Response.from(
          segments.stream().map(s -> Embedding.from(new float[dimension])).toList());
    };
  }
}
