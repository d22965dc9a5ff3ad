package dev.clinrank.funnel.judge;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;

import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.corpus.NoteLink;
import dev.clinrank.corpus.NoteLinkTable;
import dev.clinrank.fixture.FunnelConfigBuilder;
import dev.clinrank.fixture.SampleCorpus;
import dev.clinrank.funnel.FunnelConfig;
import dev.clinrank.funnel.ScorerFailureException;
import dev.clinrank.funnel.StageException;
import dev.clinrank.funnel.inspect.RescoredCandidate;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JudgeStageTest {

  @Mock ScoringModel scoringModel;

  private final ExecutorService pool = Executors.newFixedThreadPool(2);
  private final ChunkCorpus corpus = SampleCorpus.corpus();
  private final FunnelConfig config = FunnelConfig.defaults();
  private final CalibrationFit identity = CalibrationFit.identity("test");
  private JudgeStage stage;

  @BeforeEach
  void setUp() {
    stage = new JudgeStage(scoringModel, pool);
  }

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  private static RescoredCandidate rescored(String id) {
    return new RescoredCandidate(id, 0.5, 0.5, "note", null);
  }

  private void givenRawScore(String chunkId, double score) {
    String text = corpus.require(chunkId).text();
    given(
            scoringModel.score(
                argThat((TextSegment s) -> s != null && text.equals(s.text())), anyString()))
        .willReturn(Response.from(score));
  }

  @Test
  void ranks_by_calibrated_score() {
    givenRawScore("c1", 0.3);
    givenRawScore("c2", 0.9);

    List<FinalResult> results =
        stage.run("q", List.of(rescored("c1"), rescored("c2")), corpus, null, identity, config);

    assertThat(results).extracting(FinalResult::chunkId).containsExactly("c2", "c1");
    assertThat(results).extracting(FinalResult::calibratedScore).containsExactly(0.9, 0.3);
  }

  @Test
  void attaches_linked_patient_and_null_when_unlinked() {
    givenRawScore("c1", 0.8);
    givenRawScore("c3", 0.6);
    NoteLinkTable links = NoteLinkTable.of(List.of(new NoteLink("note-a", "patient-7")));

    List<FinalResult> results =
        stage.run("q", List.of(rescored("c1"), rescored("c3")), corpus, links, identity, config);

    assertThat(results.get(0).patientUid()).isEqualTo("patient-7");
    assertThat(results.get(1).patientUid()).isNull();
  }

  @Test
  void missing_link_table_leaves_every_patient_null() {
    givenRawScore("c1", 0.8);

    List<FinalResult> results =
        stage.run("q", List.of(rescored("c1")), corpus, null, identity, config);

    assertThat(results).singleElement().extracting(FinalResult::patientUid).isNull();
  }

  @Test
  void pointer_locates_chunk_in_its_note() {
    givenRawScore("c2", 0.5);

    List<FinalResult> results =
        stage.run("q", List.of(rescored("c2")), corpus, null, identity, config);

    assertThat(results.get(0).pointer()).isEqualTo(new Pointer("note-a", 61L));
  }

  @Test
  void calibration_is_applied_and_kept_monotone() {
    givenRawScore("c1", 0.2);
    givenRawScore("c2", 0.8);
    CalibrationFit decreasing = new CalibrationFit(raw -> 1.0 - raw, true, "decreasing");

    List<FinalResult> results =
        stage.run("q", List.of(rescored("c1"), rescored("c2")), corpus, null, decreasing, config);

    assertThat(results).extracting(FinalResult::calibratedScore).containsExactly(0.8, 0.8);
    assertThat(results).extracting(FinalResult::chunkId).containsExactly("c1", "c2");
  }

  @Test
  void raw_scores_outside_unit_interval_are_clamped() {
    givenRawScore("c1", 4.2);
    givenRawScore("c2", -1.3);

    List<FinalResult> results =
        stage.run("q", List.of(rescored("c1"), rescored("c2")), corpus, null, identity, config);

    assertThat(results).extracting(FinalResult::calibratedScore).containsExactly(1.0, 0.0);
  }

  @Test
  void output_is_truncated_to_k_c() {
    givenRawScore("c1", 0.1);
    givenRawScore("c2", 0.2);
    givenRawScore("c3", 0.3);

    List<FinalResult> results =
        stage.run(
            "q",
            List.of(rescored("c1"), rescored("c2"), rescored("c3")),
            corpus,
            null,
            identity,
            new FunnelConfigBuilder().limits(3, 3, 2).build());

    assertThat(results).extracting(FinalResult::chunkId).containsExactly("c3", "c2");
  }

  @Test
  void empty_input_yields_empty_output() {
    assertThat(stage.run("q", List.of(), corpus, null, identity, config)).isEmpty();
  }

  @Test
  void candidate_missing_from_corpus_is_a_stage_failure() {
    assertThatThrownBy(
            () -> stage.run("q", List.of(rescored("ghost")), corpus, null, identity, config))
        .isInstanceOf(StageException.class)
        .hasMessageStartingWith("judge: ")
        .hasMessageContaining("ghost");
  }

  @Test
  void non_finite_raw_score_is_a_scorer_failure() {
    givenRawScore("c1", Double.NaN);

    assertThatThrownBy(
            () -> stage.run("q", List.of(rescored("c1")), corpus, null, identity, config))
        .isInstanceOf(ScorerFailureException.class);
  }

  @Test
  void throwing_scoring_model_is_a_scorer_failure() {
    given(scoringModel.score(any(TextSegment.class), anyString()))
        .willThrow(new IllegalStateException("onnx session closed"));

    assertThatThrownBy(
            () -> stage.run("q", List.of(rescored("c1")), corpus, null, identity, config))
        .isInstanceOf(ScorerFailureException.class)
        .hasMessageContaining("onnx session closed");
  }
}
