package dev.clinrank.eval;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.clinrank.corpus.JsonLinesReader;
import dev.clinrank.corpus.LoadResult;
import dev.clinrank.funnel.judge.FinalResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Scores a Judge output file against graded judgments and writes {@code metrics.json}. */
@Service
public class RankingEvaluator {

  private static final Logger log = LoggerFactory.getLogger(RankingEvaluator.class);

  public static final String METRICS_FILE = "metrics.json";

  private final JsonLinesReader reader;
  private final ObjectMapper objectMapper;

  public RankingEvaluator(JsonLinesReader reader, ObjectMapper objectMapper) {
    this.reader = reader;
    this.objectMapper = objectMapper;
  }

  /**
   * Evaluates the ranking in {@code resultsFile}.
   *
   * @param resultsFile Judge output, in rank order
   * @param judgmentsFile JSONL of {@code {chunk_id, grade}}
   * @param k metric cutoff
   * @param outDir directory receiving {@code metrics.json}
   * @return the computed metrics
   * @throws IOException if a file cannot be read or written
   */
  public MetricsReport evaluate(Path resultsFile, Path judgmentsFile, int k, Path outDir)
      throws IOException {
    LoadResult<List<FinalResult>> results = reader.read(resultsFile, FinalResult.class);
    LoadResult<List<RelevanceGrade>> grades = reader.read(judgmentsFile, RelevanceGrade.class);
    List<String> rankedIds = results.value().stream().map(FinalResult::chunkId).toList();

    MetricsReport report = RankingMetrics.compute(rankedIds, grades.value(), k);

    Files.createDirectories(outDir);
    objectMapper
        .writerWithDefaultPrettyPrinter()
        .writeValue(outDir.resolve(METRICS_FILE).toFile(), report);
    log.info(
        "Recall@{}={}, Precision@{}={}, RR={}, nDCG@{}={}",
        k,
        String.format("%.4f", report.recallAtK()),
        k,
        String.format("%.4f", report.precisionAtK()),
        String.format("%.4f", report.reciprocalRank()),
        k,
        String.format("%.4f", report.ndcgAtK()));
    return report;
  }
}
