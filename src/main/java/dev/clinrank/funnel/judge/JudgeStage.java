package dev.clinrank.funnel.judge;

import static dev.clinrank.funnel.ParallelScoring.FUNNEL_WORKER_POOL;

import dev.clinrank.corpus.Chunk;
import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.corpus.NoteLinkTable;
import dev.clinrank.funnel.FunnelConfig;
import dev.clinrank.funnel.ParallelScoring;
import dev.clinrank.funnel.RankOrdering;
import dev.clinrank.funnel.StageException;
import dev.clinrank.funnel.inspect.RescoredCandidate;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Final funnel stage: precise pairwise scoring, calibration and patient attachment.
 *
 * <p>Each Inspector candidate is scored against the query with the {@link ScoringModel}. Raw
 * scores go through the fitted calibration with monotonicity enforced, so a higher raw score never
 * ends up with a lower calibrated score. Every result carries the patient linked to its source
 * note (null when the link table is absent or has no entry) and a pointer back into the note.
 * Results are ranked by calibrated score, ties by chunk id, and truncated to K_C.
 */
@Service
public class JudgeStage {

  private static final Logger log = LoggerFactory.getLogger(JudgeStage.class);

  public static final String NAME = "judge";

  private final ScoringModel scoringModel;
  private final ExecutorService workerPool;

  public JudgeStage(
      ScoringModel scoringModel, @Qualifier(FUNNEL_WORKER_POOL) ExecutorService workerPool) {
    this.scoringModel = scoringModel;
    this.workerPool = workerPool;
  }

  /**
   * Runs the stage.
   *
   * @param query the free-text query
   * @param candidates Inspector output; duplicate chunk ids keep their first occurrence
   * @param corpus corpus snapshot supplying chunk text and pointers
   * @param links note-to-patient links, or null when none were supplied
   * @param calibration fitted calibration mapping
   * @param config funnel configuration
   * @return at most {@code min(K_C, |candidates|)} results in canonical order
   * @throws StageException if a candidate's chunk is missing from the corpus
   * @throws dev.clinrank.funnel.ScorerFailureException if the scoring model fails
   */
  public List<FinalResult> run(
      String query,
      List<RescoredCandidate> candidates,
      ChunkCorpus corpus,
      @Nullable NoteLinkTable links,
      CalibrationFit calibration,
      FunnelConfig config) {
    try (MDC.MDCCloseable ignored = MDC.putCloseable(ParallelScoring.MDC_STAGE, NAME)) {
      if (candidates.isEmpty()) {
        log.info("Judge received no candidates");
        return List.of();
      }

      List<RescoredCandidate> unique =
          RankOrdering.distinctById(candidates, RescoredCandidate::chunkId);
      if (unique.size() < candidates.size()) {
        log.warn("Dropped {} duplicate candidate(s)", candidates.size() - unique.size());
      }
      List<Chunk> chunks = new ArrayList<>(unique.size());
      for (RescoredCandidate candidate : unique) {
        Chunk chunk = corpus.find(candidate.chunkId());
        if (chunk == null) {
          throw new StageException(
              NAME, "candidate chunk_id not in corpus: " + candidate.chunkId());
        }
        chunks.add(chunk);
      }

      List<Double> raw =
          ParallelScoring.scoreAll(workerPool, NAME, chunks, chunk -> rawScore(query, chunk));
      double[] rawScores = raw.stream().mapToDouble(Double::doubleValue).toArray();
      double[] calibrated = Calibration.applyMonotone(calibration.calibrator(), rawScores);
      if (!calibration.calibrated()) {
        log.warn("Judge scores are uncalibrated: {}", calibration.description());
      }

      List<FinalResult> results = new ArrayList<>(chunks.size());
      int unlinked = 0;
      for (int i = 0; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        String patientUid = links == null ? null : links.patientFor(chunk.sourceNoteId());
        if (patientUid == null) {
          unlinked++;
        }
        results.add(
            new FinalResult(
                chunk.chunkId(),
                calibrated[i],
                patientUid,
                new Pointer(chunk.sourceNoteId(), chunk.offset())));
      }
      if (unlinked > 0) {
        log.debug("{} result(s) have no linked patient", unlinked);
      }

      List<FinalResult> ranked =
          RankOrdering.topK(
              results,
              RankOrdering.byScoreThenId(FinalResult::calibratedScore, FinalResult::chunkId),
              config.kC());
      log.info(
          "Judge kept {} of {} candidates (K_C={})", ranked.size(), unique.size(), config.kC());
      return ranked;
    }
  }

  private double rawScore(String query, Chunk chunk) {
    Response<Double> response = scoringModel.score(TextSegment.from(chunk.text()), query);
    Double score = response.content();
    if (score == null || !Double.isFinite(score)) {
      throw new IllegalStateException("non-finite pairwise score for " + chunk.chunkId());
    }
    return score;
  }
}
