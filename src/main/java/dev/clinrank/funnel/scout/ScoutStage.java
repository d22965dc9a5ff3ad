package dev.clinrank.funnel.scout;

import static dev.clinrank.funnel.ParallelScoring.FUNNEL_WORKER_POOL;
import static java.lang.Double.NaN;

import dev.clinrank.corpus.Chunk;
import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.funnel.FunnelConfig;
import dev.clinrank.funnel.ParallelScoring;
import dev.clinrank.funnel.RankOrdering;
import dev.clinrank.funnel.ScoreFusion;
import dev.clinrank.funnel.StageException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * First funnel stage: wide, cheap candidate generation.
 *
 * <p>Pipeline: query the lexical and dense indexes concurrently -> merge hits by chunk id (a chunk
 * missing from one mechanism gets raw score 0 there) -> min-max normalise each mechanism over the
 * merged set -> fuse with the configured weights -> rank by fusion score, ties by chunk id ->
 * keep K_A.
 *
 * <p>Both indexes returning nothing yields an empty candidate list, not an error.
 */
@Service
public class ScoutStage {

  private static final Logger log = LoggerFactory.getLogger(ScoutStage.class);

  public static final String NAME = "scout";

  private final ExecutorService workerPool;

  public ScoutStage(@Qualifier(FUNNEL_WORKER_POOL) ExecutorService workerPool) {
    this.workerPool = workerPool;
  }

  /**
   * Runs the stage.
   *
   * @param query the free-text query
   * @param lexicalIndex lexical retrieval mechanism
   * @param denseIndex dense retrieval mechanism
   * @param corpus corpus snapshot, used to attach source note ids
   * @param config funnel configuration
   * @return at most K_A candidates in canonical order, with hit counts and phase timings
   * @throws dev.clinrank.funnel.ScorerFailureException if an index query fails
   * @throws StageException if an index returns a chunk id unknown to the corpus or a non-finite
   *     score
   */
  public ScoutResult run(
      String query,
      LexicalIndex lexicalIndex,
      DenseIndex denseIndex,
      ChunkCorpus corpus,
      FunnelConfig config) {
    try (MDC.MDCCloseable ignored = MDC.putCloseable(ParallelScoring.MDC_STAGE, NAME)) {
      int fetch = config.candidatesPerMechanism();
      List<TimedHits> hitsByMechanism =
          ParallelScoring.scoreAll(
              workerPool,
              NAME,
              List.of(Mechanism.LEXICAL, Mechanism.DENSE),
              mechanism -> {
                long started = System.nanoTime();
                List<IndexHit> hits =
                    mechanism == Mechanism.LEXICAL
                        ? lexicalIndex.search(query, fetch)
                        : denseIndex.search(query, fetch);
                return new TimedHits(hits, millisSince(started));
              });

      TimedHits lexical = hitsByMechanism.get(0);
      TimedHits dense = hitsByMechanism.get(1);
      log.debug(
          "Lexical hits: {} in {} ms, dense hits: {} in {} ms",
          lexical.hits().size(),
          lexical.millis(),
          dense.hits().size(),
          dense.millis());

      long fusionStarted = System.nanoTime();
      List<Candidate> candidates = fuse(lexical.hits(), dense.hits(), corpus, config);
      List<Candidate> ranked =
          RankOrdering.topK(
              candidates,
              RankOrdering.byScoreThenId(Candidate::fusionScore, Candidate::chunkId),
              config.kA());
      long fusionMillis = millisSince(fusionStarted);

      log.info(
          "Scout kept {} of {} merged candidates (K_A={})",
          ranked.size(),
          candidates.size(),
          config.kA());
      return new ScoutResult(
          ranked,
          lexical.hits().size(),
          dense.hits().size(),
          lexical.millis(),
          dense.millis(),
          fusionMillis);
    }
  }

  /**
   * Merges both hit lists by chunk id, normalises each mechanism over the merged set and fuses.
   * Output order is unspecified; callers rank it.
   */
  List<Candidate> fuse(
      List<IndexHit> lexicalHits,
      List<IndexHit> denseHits,
      ChunkCorpus corpus,
      FunnelConfig config) {
    Map<String, double[]> rawById = new LinkedHashMap<>();
    collect(rawById, lexicalHits, 0, Mechanism.LEXICAL);
    collect(rawById, denseHits, 1, Mechanism.DENSE);
    if (rawById.isEmpty()) {
      return List.of();
    }

    List<String> ids = new ArrayList<>(rawById.keySet());
    double[] rawLexical = new double[ids.size()];
    double[] rawDense = new double[ids.size()];
    for (int i = 0; i < ids.size(); i++) {
      double[] raw = rawById.get(ids.get(i));
      rawLexical[i] = Double.isNaN(raw[0]) ? 0.0 : raw[0];
      rawDense[i] = Double.isNaN(raw[1]) ? 0.0 : raw[1];
    }
    double[] lexical = ScoreFusion.normalise(rawLexical);
    double[] dense = ScoreFusion.normalise(rawDense);

    List<Candidate> candidates = new ArrayList<>(ids.size());
    for (int i = 0; i < ids.size(); i++) {
      String chunkId = ids.get(i);
      Chunk chunk = corpus.find(chunkId);
      if (chunk == null) {
        throw new StageException(NAME, "index returned chunk_id not in corpus: " + chunkId);
      }
      double fused =
          ScoreFusion.fuse(
              lexical[i], dense[i], config.fusionWeightLexical(), config.fusionWeightDense());
      candidates.add(new Candidate(chunkId, lexical[i], dense[i], fused, chunk.sourceNoteId()));
    }
    return candidates;
  }

  private static void collect(
      Map<String, double[]> rawById, List<IndexHit> hits, int column, Mechanism mechanism) {
    for (IndexHit hit : hits) {
      if (!Double.isFinite(hit.score())) {
        throw new StageException(
            NAME, mechanism.label + " index returned non-finite score for " + hit.chunkId());
      }
      double[] raw = rawById.computeIfAbsent(hit.chunkId(), id -> new double[] {NaN, NaN});
      raw[column] = Double.isNaN(raw[column]) ? hit.score() : Math.max(raw[column], hit.score());
    }
  }

  private static long millisSince(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }

  private record TimedHits(List<IndexHit> hits, long millis) {}

  private enum Mechanism {
    LEXICAL("lexical"),
    DENSE("dense");

    private final String label;

    Mechanism(String label) {
      this.label = label;
    }
  }
}
