package dev.clinrank.funnel.inspect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.fixture.FunnelConfigBuilder;
import dev.clinrank.fixture.SampleCorpus;
import dev.clinrank.funnel.FunnelConfig;
import dev.clinrank.funnel.ScorerFailureException;
import dev.clinrank.funnel.StageException;
import dev.clinrank.funnel.scout.Candidate;
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
class InspectorStageTest {

  @Mock InteractionScorer interactionScorer;

  private final ExecutorService pool = Executors.newFixedThreadPool(2);
  private final ChunkCorpus corpus = SampleCorpus.corpus();
  private final FunnelConfig config = FunnelConfig.defaults();
  private InspectorStage stage;

  @BeforeEach
  void setUp() {
    stage = new InspectorStage(interactionScorer, pool);
  }

  @AfterEach
  void shutdown() {
    pool.shutdownNow();
  }

  private static Candidate candidate(String id, double fusion) {
    return new Candidate(id, fusion, fusion, fusion, "note");
  }

  private void givenScore(String chunkText, double score) {
    given(interactionScorer.score(anyString(), eq(chunkText)))
        .willReturn(new InteractionScore(score, List.of()));
  }

  private String text(String chunkId) {
    return corpus.require(chunkId).text();
  }

  @Test
  void interaction_tie_is_broken_by_fusion_score() {
    givenScore(text("c1"), 0.7);
    givenScore(text("c2"), 0.7);

    List<RescoredCandidate> rescored =
        stage.run("q", List.of(candidate("c1", 0.6), candidate("c2", 0.8)), corpus, config);

    assertThat(rescored).extracting(RescoredCandidate::chunkId).containsExactly("c2", "c1");
    assertThat(rescored)
        .extracting(RescoredCandidate::interactionScore)
        .containsExactly(0.7, 0.7);
  }

  @Test
  void full_tie_is_broken_by_chunk_id() {
    givenScore(text("c4"), 0.5);
    givenScore(text("c2"), 0.5);

    List<RescoredCandidate> rescored =
        stage.run("q", List.of(candidate("c4", 0.3), candidate("c2", 0.3)), corpus, config);

    assertThat(rescored).extracting(RescoredCandidate::chunkId).containsExactly("c2", "c4");
  }

  @Test
  void ranks_by_interaction_not_fusion() {
    givenScore(text("c1"), 0.2);
    givenScore(text("c3"), 0.9);

    List<RescoredCandidate> rescored =
        stage.run("q", List.of(candidate("c1", 1.0), candidate("c3", 0.1)), corpus, config);

    assertThat(rescored).extracting(RescoredCandidate::chunkId).containsExactly("c3", "c1");
    assertThat(rescored)
        .extracting(RescoredCandidate::fusionScore)
        .as("fusion score is carried unchanged")
        .containsExactly(0.1, 1.0);
  }

  @Test
  void empty_input_yields_empty_output() {
    assertThat(stage.run("q", List.of(), corpus, config)).isEmpty();
    then(interactionScorer).should(never()).score(anyString(), anyString());
  }

  @Test
  void output_is_truncated_to_k_b() {
    givenScore(text("c1"), 0.1);
    givenScore(text("c2"), 0.2);
    givenScore(text("c3"), 0.3);

    List<RescoredCandidate> rescored =
        stage.run(
            "q",
            List.of(candidate("c1", 0.5), candidate("c2", 0.5), candidate("c3", 0.5)),
            corpus,
            new FunnelConfigBuilder().limits(3, 2, 1).build());

    assertThat(rescored).extracting(RescoredCandidate::chunkId).containsExactly("c3", "c2");
  }

  @Test
  void evidence_is_sorted_by_weight_then_position_and_truncated() {
    given(interactionScorer.score(anyString(), eq(text("c1"))))
        .willReturn(
            new InteractionScore(
                0.9,
                List.of(
                    new Evidence("arm", 0.1, 9),
                    new Evidence("pain", 0.3, 4),
                    new Evidence("chest", 0.3, 3),
                    new Evidence("left", 0.2, 8))));

    FunnelConfig threeTokens = new FunnelConfigBuilder().evidenceSize(3).build();

    List<RescoredCandidate> rescored =
        stage.run("q", List.of(candidate("c1", 0.5)), corpus, threeTokens);

    assertThat(rescored.get(0).evidence())
        .extracting(Evidence::token)
        .containsExactly("chest", "pain", "left");
  }

  @Test
  void zero_evidence_size_omits_evidence() {
    given(interactionScorer.score(anyString(), eq(text("c1"))))
        .willReturn(new InteractionScore(0.9, List.of(new Evidence("chest", 0.9, 3))));

    FunnelConfig noEvidence = new FunnelConfigBuilder().evidenceSize(0).build();

    List<RescoredCandidate> rescored =
        stage.run("q", List.of(candidate("c1", 0.5)), corpus, noEvidence);

    assertThat(rescored.get(0).evidence()).isNull();
  }

  @Test
  void duplicate_candidates_are_scored_once() {
    givenScore(text("c1"), 0.4);

    List<RescoredCandidate> rescored =
        stage.run("q", List.of(candidate("c1", 0.5), candidate("c1", 0.2)), corpus, config);

    assertThat(rescored).singleElement().extracting(RescoredCandidate::fusionScore).isEqualTo(0.5);
  }

  @Test
  void candidate_missing_from_corpus_is_a_stage_failure() {
    assertThatThrownBy(
            () -> stage.run("q", List.of(candidate("ghost", 0.5)), corpus, config))
        .isInstanceOf(StageException.class)
        .hasMessageContaining("ghost");
  }

  @Test
  void out_of_range_interaction_score_is_a_scorer_failure() {
    givenScore(text("c1"), 1.5);

    assertThatThrownBy(() -> stage.run("q", List.of(candidate("c1", 0.5)), corpus, config))
        .isInstanceOf(ScorerFailureException.class)
        .hasMessageStartingWith("inspect: ");
  }

  @Test
  void throwing_scorer_is_a_scorer_failure() {
    given(interactionScorer.score(anyString(), anyString()))
        .willThrow(new IllegalStateException("tokenizer crashed"));

    assertThatThrownBy(() -> stage.run("q", List.of(candidate("c1", 0.5)), corpus, config))
        .isInstanceOf(ScorerFailureException.class)
        .hasMessageContaining("tokenizer crashed");
  }
}
