package dev.lecturelens.enrichment;

import dev.lecturelens.model.LazyModel;
import dev.lecturelens.model.ModelUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Keyword extractor that ranks candidate keyphrases by embedding similarity to the whole text.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Generate unigram and bigram candidates with stop-words removed ({@link
 *       KeyphraseCandidates})
 *   <li>Embed the text and every candidate with the keyword model (all-MiniLM-L6-v2)
 *   <li>Keep the {@code candidatePoolSize} candidates most similar to the text
 *   <li>Choose {@code topN} of them with the configured {@link DiversityStrategy}
 *   <li>Return the chosen phrases by text similarity descending
 * </ol>
 *
 * <p>Never throws: a missing model or an inference error yields an empty list.
 */
@Service
public class EmbeddingKeywordExtractor implements KeywordExtractor {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingKeywordExtractor.class);

  private final LazyModel<EmbeddingModel> keywordModel;
  private final KeywordProperties properties;

  public EmbeddingKeywordExtractor(
      @Qualifier("keywordEmbeddingModel") LazyModel<EmbeddingModel> keywordModel,
      KeywordProperties properties) {
    this.keywordModel = keywordModel;
    this.properties = properties;
  }

  @Override
  public List<String> extract(String text, int topN) {
    if (text == null || text.strip().length() < properties.getMinTextLength() || topN < 1) {
      return List.of();
    }
    List<String> candidates = KeyphraseCandidates.from(text);
    if (candidates.isEmpty()) {
      return List.of();
    }
    try {
      EmbeddingModel model = keywordModel.get();
      Embedding document = model.embed(text).content();
      List<Embedding> candidateEmbeddings =
          model.embedAll(candidates.stream().map(TextSegment::from).toList()).content();

      List<Scored> pool =
          IntStream.range(0, candidates.size())
              .mapToObj(
                  i ->
                      new Scored(
                          candidates.get(i),
                          candidateEmbeddings.get(i),
                          CosineSimilarity.between(document, candidateEmbeddings.get(i))))
              .sorted(Comparator.comparingDouble(Scored::similarity).reversed())
              .limit(properties.getCandidatePoolSize())
              .toList();

      List<Scored> chosen =
          pool.size() <= topN
              ? pool
              : switch (properties.getDiversityStrategy()) {
                case MAX_SUM -> maxSum(pool, topN);
                case MMR -> maximalMarginalRelevance(pool, topN, properties.getDiversity());
              };

      List<String> keywords =
          chosen.stream()
              .sorted(Comparator.comparingDouble(Scored::similarity).reversed())
              .map(Scored::phrase)
              .toList();
      log.debug("Extracted keywords {} from {} candidates", keywords, candidates.size());
      return keywords;
    } catch (ModelUnavailableException e) {
      log.warn("Keyword model unavailable, continuing without keywords");
      return List.of();
    } catch (RuntimeException e) {
      log.error("Keyword extraction failed: {}", e.getMessage());
      return List.of();
    }
  }

  /** Exhaustive search for the subset of size {@code topN} with minimal pairwise similarity. */
  static List<Scored> maxSum(List<Scored> pool, int topN) {
    int n = pool.size();
    double[][] pairwise = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        pairwise[i][j] = CosineSimilarity.between(pool.get(i).embedding(), pool.get(j).embedding());
        pairwise[j][i] = pairwise[i][j];
      }
    }
    int[] current = new int[topN];
    int[] best = new int[topN];
    double[] bestSum = {Double.POSITIVE_INFINITY};
    searchCombinations(pairwise, current, 0, 0, 0.0, best, bestSum);

    List<Scored> chosen = new ArrayList<>(topN);
    for (int index : best) {
      chosen.add(pool.get(index));
    }
    return chosen;
  }

  private static void searchCombinations(
      double[][] pairwise,
      int[] current,
      int depth,
      int start,
      double sum,
      int[] best,
      double[] bestSum) {
    if (depth == current.length) {
      if (sum < bestSum[0]) {
        bestSum[0] = sum;
        System.arraycopy(current, 0, best, 0, current.length);
      }
      return;
    }
    for (int i = start; i <= pairwise.length - (current.length - depth); i++) {
      double added = 0.0;
      for (int d = 0; d < depth; d++) {
        added += pairwise[current[d]][i];
      }
      current[depth] = i;
      searchCombinations(pairwise, current, depth + 1, i + 1, sum + added, best, bestSum);
    }
  }

  /** Greedy MMR: {@code (1 - diversity) * sim(doc) - diversity * max sim(selected)}. */
  static List<Scored> maximalMarginalRelevance(List<Scored> pool, int topN, double diversity) {
    List<Scored> remaining = new ArrayList<>(pool);
    List<Scored> selected = new ArrayList<>(topN);
    selected.add(remaining.remove(0));
    while (selected.size() < topN && !remaining.isEmpty()) {
      Scored bestCandidate = null;
      double bestScore = Double.NEGATIVE_INFINITY;
      for (Scored candidate : remaining) {
        double redundancy =
            selected.stream()
                .mapToDouble(s -> CosineSimilarity.between(s.embedding(), candidate.embedding()))
                .max()
                .orElse(0.0);
        double score = (1 - diversity) * candidate.similarity() - diversity * redundancy;
        if (score > bestScore) {
          bestScore = score;
          bestCandidate = candidate;
        }
      }
      selected.add(bestCandidate);
      remaining.remove(bestCandidate);
    }
    return selected;
  }

  record Scored(String phrase, Embedding embedding, double similarity) {}
}
