package dev.clinrank.config;

import dev.clinrank.funnel.ConfigurationException;
import dev.clinrank.funnel.inspect.InteractionScorer;
import dev.clinrank.funnel.inspect.MaxSimInteractionScorer;
import dev.clinrank.funnel.judge.TermCoverageScoringModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the pluggable scorers used by the three stages.
 *
 * <ul>
 *   <li>Scout embeds with the in-process ONNX bge-small-en-v1.5 quantized model (384
 *       dimensions). A serialized dense index must have been built with the same model.
 *   <li>Inspector uses MaxSim late interaction.
 *   <li>Judge uses the ONNX cross-encoder when {@code clinrank.judge.model-path} and {@code
 *       clinrank.judge.tokenizer-path} are set, otherwise the term coverage scorer.
 * </ul>
 */
@Configuration
public class ScoringConfig {

  private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

  /**
   * Provides the in-process ONNX embedding model (bge-small-en-v1.5 quantized, 384 dimensions).
   *
   * @return a ready-to-use embedding model requiring no external API
   */
  @Bean
  public EmbeddingModel embeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  /**
   * Provides the Judge pairwise scorer.
   *
   * @param modelPath path to the ONNX cross-encoder model file, blank for the default scorer
   * @param tokenizerPath path to the tokenizer JSON file
   * @return the scoring model
   * @throws ConfigurationException if a model path is given without a tokenizer path
   */
  @Bean
  public ScoringModel scoringModel(
      @Value("${clinrank.judge.model-path:}") String modelPath,
      @Value("${clinrank.judge.tokenizer-path:}") String tokenizerPath) {
    if (modelPath.isBlank()) {
      log.info("Judge scorer: term coverage");
      return new TermCoverageScoringModel();
    }
    if (tokenizerPath.isBlank()) {
      throw new ConfigurationException(
          "clinrank.judge.tokenizer-path is required when clinrank.judge.model-path is set");
    }
    log.info("Judge scorer: ONNX cross-encoder {}", modelPath);
    return new OnnxScoringModel(modelPath, tokenizerPath);
  }

  @Bean
  public InteractionScorer interactionScorer() {
    return new MaxSimInteractionScorer();
  }
}
