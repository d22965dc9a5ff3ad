package dev.clinrank.funnel.inspect;

import static dev.clinrank.funnel.ParallelScoring.FUNNEL_WORKER_POOL;

import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.funnel.FunnelConfig;
import dev.clinrank.funnel.ParallelScoring;
import dev.clinrank.funnel.RankOrdering;
import dev.clinrank.funnel.StageException;
import dev.clinrank.funnel.scout.Candidate;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Second funnel stage: re-scores Scout candidates with a token-level interaction signal.
 *
 * <p>The Scout fusion score is carried through unchanged and only used to break ties. Ranking is
 * by interaction score descending, then fusion score descending, then chunk id ascending, and the
 * result is truncated to K_B. When evidence is enabled each candidate lists its top contributing
 * chunk tokens by descending weight (position ascending on ties).
 */
@Service
public class InspectorStage {

  private static final Logger log = LoggerFactory.getLogger(InspectorStage.class);

  public static final String NAME = "inspect";

  private static final Comparator<Evidence> EVIDENCE_ORDER =
      Comparator.comparingDouble(Evidence::weight)
          .reversed()
          .thenComparingInt(Evidence::position);

  private final InteractionScorer interactionScorer;
  private final ExecutorService workerPool;

  public InspectorStage(
      InteractionScorer interactionScorer,
      @Qualifier(FUNNEL_WORKER_POOL) ExecutorService workerPool) {
    this.interactionScorer = interactionScorer;
    this.workerPool = workerPool;
  }

  /**
   * Runs the stage.
   *
   * @param query the free-text query
   * @param candidates Scout output; duplicate chunk ids keep their first occurrence
   * @param corpus corpus snapshot supplying chunk text
   * @param config funnel configuration
   * @return at most {@code min(K_B, |candidates|)} rescored candidates in stage order
   * @throws StageException if a candidate's chunk is missing from the corpus
   * @throws dev.clinrank.funnel.ScorerFailureException if the interaction scorer fails
   */
  public List<RescoredCandidate> run(
      String query, List<Candidate> candidates, ChunkCorpus corpus, FunnelConfig config) {
    try (MDC.MDCCloseable ignored = MDC.putCloseable(ParallelScoring.MDC_STAGE, NAME)) {
      if (candidates.isEmpty()) {
        log.info("Inspector received no candidates");
        return List.of();
      }

      List<Candidate> unique = RankOrdering.distinctById(candidates, Candidate::chunkId);
      if (unique.size() < candidates.size()) {
        log.warn("Dropped {} duplicate candidate(s)", candidates.size() - unique.size());
      }
      for (Candidate candidate : unique) {
        if (!corpus.contains(candidate.chunkId())) {
          throw new StageException(
              NAME, "candidate chunk_id not in corpus: " + candidate.chunkId());
        }
      }

      List<RescoredCandidate> rescored =
          ParallelScoring.scoreAll(
              workerPool, NAME, unique, candidate -> rescore(query, candidate, corpus, config));

      List<RescoredCandidate> ranked =
          RankOrdering.topK(
              rescored,
              RankOrdering.byScoresThenId(
                  RescoredCandidate::interactionScore,
                  RescoredCandidate::fusionScore,
                  RescoredCandidate::chunkId),
              config.kB());

      log.info(
          "Inspector kept {} of {} candidates (K_B={})", ranked.size(), unique.size(), config.kB());
      return ranked;
    }
  }

  private RescoredCandidate rescore(
      String query, Candidate candidate, ChunkCorpus corpus, FunnelConfig config) {
    String text = corpus.require(candidate.chunkId()).text();
    InteractionScore result = interactionScorer.score(query, text);
    double score = result.score();
    if (!Double.isFinite(score) || score < 0.0 || score > 1.0) {
      throw new IllegalStateException(
          "interaction score out of [0, 1] for " + candidate.chunkId() + ": " + score);
    }
    return new RescoredCandidate(
        candidate.chunkId(),
        score,
        candidate.fusionScore(),
        candidate.sourceNoteId(),
        evidence(result, config.evidenceSize()));
  }

  private static @Nullable List<Evidence> evidence(InteractionScore result, int size) {
    if (size == 0) {
      return null;
    }
    return result.contributions().stream().sorted(EVIDENCE_ORDER).limit(size).toList();
  }
}
