package dev.clinrank;

import static org.assertj.core.api.Assertions.assertThat;

import dev.clinrank.cli.FunnelCommand;
import dev.clinrank.funnel.FunnelProperties;
import dev.clinrank.funnel.judge.TermCoverageScoringModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class ClinrankApplicationTest {

  @Autowired FunnelCommand command;

  @Autowired EmbeddingModel embeddingModel;

  @Autowired ScoringModel scoringModel;

  @Autowired FunnelProperties properties;

  @Test
  void context_starts_with_default_scorers() {
    assertThat(embeddingModel).isInstanceOf(BgeSmallEnV15QuantizedEmbeddingModel.class);
    assertThat(scoringModel).isInstanceOf(TermCoverageScoringModel.class);
    assertThat(properties.getWorkerThreads()).isEqualTo(2);
  }

  @Test
  void startup_without_command_reports_usage_error() {
    assertThat(command.getExitCode()).isEqualTo(2);
  }
}
