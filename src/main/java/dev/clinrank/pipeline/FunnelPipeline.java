package dev.clinrank.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.corpus.CorpusLoader;
import dev.clinrank.corpus.JsonLinesReader;
import dev.clinrank.corpus.JsonLinesWriter;
import dev.clinrank.corpus.LoadResult;
import dev.clinrank.corpus.NoteLinkTable;
import dev.clinrank.funnel.FunnelConfig;
import dev.clinrank.funnel.FunnelProperties;
import dev.clinrank.funnel.inspect.InspectorStage;
import dev.clinrank.funnel.inspect.RescoredCandidate;
import dev.clinrank.funnel.judge.Calibration;
import dev.clinrank.funnel.judge.CalibrationFit;
import dev.clinrank.funnel.judge.CalibrationSample;
import dev.clinrank.funnel.judge.FinalResult;
import dev.clinrank.funnel.judge.JudgeStage;
import dev.clinrank.funnel.scout.Bm25LexicalIndex;
import dev.clinrank.funnel.scout.Candidate;
import dev.clinrank.funnel.scout.DenseIndex;
import dev.clinrank.funnel.scout.EmbeddingStoreDenseIndex;
import dev.clinrank.funnel.scout.LexicalIndex;
import dev.clinrank.funnel.scout.ScoutResult;
import dev.clinrank.funnel.scout.ScoutStage;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Orchestrates the funnel: loads stage inputs, runs one stage or all three, and writes each
 * stage's JSONL output together with its summary.
 *
 * <p>Output files are {@code candidates.jsonl}, {@code rescored.jsonl} and {@code final.jsonl} in
 * the output directory. Inspect and judge take the query from the previous stage's summary next
 * to their input file when it is not given explicitly.
 *
 * <p>The configuration is snapshotted from {@link FunnelProperties} once per call and passed
 * unchanged to every stage it runs.
 */
@Service
public class FunnelPipeline {

  private static final Logger log = LoggerFactory.getLogger(FunnelPipeline.class);

  public static final String CANDIDATES_FILE = "candidates.jsonl";
  public static final String RESCORED_FILE = "rescored.jsonl";
  public static final String FINAL_FILE = "final.jsonl";

  private final CorpusLoader corpusLoader;
  private final JsonLinesReader reader;
  private final JsonLinesWriter writer;
  private final ObjectMapper objectMapper;
  private final EmbeddingModel embeddingModel;
  private final ScoutStage scoutStage;
  private final InspectorStage inspectorStage;
  private final JudgeStage judgeStage;
  private final FunnelProperties properties;

  public FunnelPipeline(
      CorpusLoader corpusLoader,
      JsonLinesReader reader,
      JsonLinesWriter writer,
      ObjectMapper objectMapper,
      EmbeddingModel embeddingModel,
      ScoutStage scoutStage,
      InspectorStage inspectorStage,
      JudgeStage judgeStage,
      FunnelProperties properties) {
    this.corpusLoader = corpusLoader;
    this.reader = reader;
    this.writer = writer;
    this.objectMapper = objectMapper;
    this.embeddingModel = embeddingModel;
    this.scoutStage = scoutStage;
    this.inspectorStage = inspectorStage;
    this.judgeStage = judgeStage;
    this.properties = properties;
  }

  /**
   * Runs Scout over the corpus and writes {@code candidates.jsonl}.
   *
   * @param query the free-text query
   * @param chunks corpus file or directory
   * @param denseIndex serialized embedding store, or null to embed the corpus in memory
   * @param outDir output directory
   * @return the stage summary
   * @throws IOException if an input cannot be read or the output cannot be written
   */
  public StageSummary scout(String query, Path chunks, @Nullable Path denseIndex, Path outDir)
      throws IOException {
    long started = System.nanoTime();
    FunnelConfig config = properties.toConfig();
    LoadResult<ChunkCorpus> corpus = corpusLoader.loadCorpus(chunks);

    ScoutResult scouted = runScout(query, corpus.value(), denseIndex, config);

    writer.write(outDir.resolve(CANDIDATES_FILE), scouted.candidates());
    return writeSummary(
        outDir,
        StageSummary.scout(
            query,
            corpus.value().size(),
            config.kA(),
            corpus.skipped(),
            scouted,
            elapsedSince(started)));
  }

  /**
   * Runs Inspector over a Scout output file and writes {@code rescored.jsonl}.
   *
   * @param query the query, or null to reuse the one recorded by Scout
   * @param chunks corpus file or directory
   * @param candidatesFile Scout output
   * @param outDir output directory
   * @return the stage summary
   * @throws IOException if an input cannot be read or the output cannot be written
   * @throws IllegalArgumentException if no query is given and none was recorded
   */
  public StageSummary inspect(
      @Nullable String query, Path chunks, Path candidatesFile, Path outDir) throws IOException {
    long started = System.nanoTime();
    FunnelConfig config = properties.toConfig();
    String resolvedQuery = resolveQuery(query, candidatesFile, ScoutStage.NAME);
    LoadResult<ChunkCorpus> corpus = corpusLoader.loadCorpus(chunks);
    LoadResult<List<Candidate>> candidates = reader.read(candidatesFile, Candidate.class);

    List<RescoredCandidate> rescored =
        inspectorStage.run(resolvedQuery, candidates.value(), corpus.value(), config);

    writer.write(outDir.resolve(RESCORED_FILE), rescored);
    return writeSummary(
        outDir,
        StageSummary.inspect(
            resolvedQuery,
            candidates.value().size(),
            rescored.size(),
            config.kB(),
            corpus.skipped() + candidates.skipped(),
            elapsedSince(started)));
  }

  /**
   * Runs Judge over an Inspector output file and writes {@code final.jsonl}.
   *
   * @param query the query, or null to reuse the one recorded by Inspector
   * @param chunks corpus file or directory
   * @param rescoredFile Inspector output
   * @param links note-to-patient link file, or null
   * @param outDir output directory
   * @return the stage summary
   * @throws IOException if an input cannot be read or the output cannot be written
   * @throws IllegalArgumentException if no query is given and none was recorded
   */
  public StageSummary judge(
      @Nullable String query,
      Path chunks,
      Path rescoredFile,
      @Nullable Path links,
      Path outDir)
      throws IOException {
    long started = System.nanoTime();
    FunnelConfig config = properties.toConfig();
    String resolvedQuery = resolveQuery(query, rescoredFile, InspectorStage.NAME);
    LoadResult<ChunkCorpus> corpus = corpusLoader.loadCorpus(chunks);
    LoadResult<List<RescoredCandidate>> rescored =
        reader.read(rescoredFile, RescoredCandidate.class);
    LoadResult<NoteLinkTable> linkTable = loadLinks(links);
    LoadResult<CalibrationFit> calibration = fitCalibration(config);

    List<FinalResult> results =
        judgeStage.run(
            resolvedQuery,
            rescored.value(),
            corpus.value(),
            linkTable == null ? null : linkTable.value(),
            calibration.value(),
            config);

    writer.write(outDir.resolve(FINAL_FILE), results);
    int skipped =
        corpus.skipped()
            + rescored.skipped()
            + (linkTable == null ? 0 : linkTable.skipped())
            + calibration.skipped();
    return writeSummary(
        outDir,
        StageSummary.judge(
            resolvedQuery,
            rescored.value().size(),
            results.size(),
            config.kC(),
            skipped,
            patientsAttached(results),
            calibration.value(),
            elapsedSince(started)));
  }

  /**
   * Runs all three stages in memory with one configuration snapshot and writes every stage's
   * output and summary.
   *
   * @return the summaries in stage order
   * @throws IOException if an input cannot be read or an output cannot be written
   */
  public List<StageSummary> runAll(
      String query, Path chunks, @Nullable Path denseIndex, @Nullable Path links, Path outDir)
      throws IOException {
    FunnelConfig config = properties.toConfig();
    LoadResult<ChunkCorpus> corpus = corpusLoader.loadCorpus(chunks);
    ChunkCorpus snapshot = corpus.value();

    long started = System.nanoTime();
    ScoutResult scouted = runScout(query, snapshot, denseIndex, config);
    List<Candidate> candidates = scouted.candidates();
    writer.write(outDir.resolve(CANDIDATES_FILE), candidates);
    StageSummary scoutSummary =
        writeSummary(
            outDir,
            StageSummary.scout(
                query,
                snapshot.size(),
                config.kA(),
                corpus.skipped(),
                scouted,
                elapsedSince(started)));

    started = System.nanoTime();
    List<RescoredCandidate> rescored = inspectorStage.run(query, candidates, snapshot, config);
    writer.write(outDir.resolve(RESCORED_FILE), rescored);
    StageSummary inspectSummary =
        writeSummary(
            outDir,
            StageSummary.inspect(
                query,
                candidates.size(),
                rescored.size(),
                config.kB(),
                0,
                elapsedSince(started)));

    started = System.nanoTime();
    LoadResult<NoteLinkTable> linkTable = loadLinks(links);
    LoadResult<CalibrationFit> calibration = fitCalibration(config);
    List<FinalResult> results =
        judgeStage.run(
            query,
            rescored,
            snapshot,
            linkTable == null ? null : linkTable.value(),
            calibration.value(),
            config);
    writer.write(outDir.resolve(FINAL_FILE), results);
    StageSummary judgeSummary =
        writeSummary(
            outDir,
            StageSummary.judge(
                query,
                rescored.size(),
                results.size(),
                config.kC(),
                (linkTable == null ? 0 : linkTable.skipped()) + calibration.skipped(),
                patientsAttached(results),
                calibration.value(),
                elapsedSince(started)));

    return List.of(scoutSummary, inspectSummary, judgeSummary);
  }

  private ScoutResult runScout(
      String query, ChunkCorpus corpus, @Nullable Path denseIndexFile, FunnelConfig config) {
    LexicalIndex lexicalIndex =
        Bm25LexicalIndex.open(corpus, config.lexicalK1(), config.lexicalB());
    DenseIndex denseIndex =
        denseIndexFile == null
            ? EmbeddingStoreDenseIndex.inMemory(embeddingModel, corpus)
            : EmbeddingStoreDenseIndex.fromFile(embeddingModel, denseIndexFile);
    return scoutStage.run(query, lexicalIndex, denseIndex, corpus, config);
  }

  private static int patientsAttached(List<FinalResult> results) {
    return (int) results.stream().filter(result -> result.patientUid() != null).count();
  }

  private @Nullable LoadResult<NoteLinkTable> loadLinks(@Nullable Path links) throws IOException {
    if (links == null) {
      log.info("No note-link table given; patient_uid will be null");
      return null;
    }
    return corpusLoader.loadLinks(links);
  }

  private LoadResult<CalibrationFit> fitCalibration(FunnelConfig config) throws IOException {
    String reference = properties.getCalibrationReference();
    if (reference == null || reference.isBlank()) {
      return new LoadResult<>(Calibration.fit(config.calibrationMethod(), List.of()), 0);
    }
    Path referenceFile = Path.of(reference);
    if (!Files.isRegularFile(referenceFile)) {
      log.warn("Calibration reference {} not found", referenceFile);
      return new LoadResult<>(Calibration.fit(config.calibrationMethod(), List.of()), 0);
    }
    LoadResult<List<CalibrationSample>> samples =
        reader.read(referenceFile, CalibrationSample.class);
    return new LoadResult<>(
        Calibration.fit(config.calibrationMethod(), samples.value()), samples.skipped());
  }

  private String resolveQuery(@Nullable String query, Path stageInput, String previousStage)
      throws IOException {
    if (query != null && !query.isBlank()) {
      return query;
    }
    Path parent = stageInput.toAbsolutePath().getParent();
    Path summaryFile = parent.resolve(StageSummary.fileName(previousStage));
    if (!Files.isRegularFile(summaryFile)) {
      throw new IllegalArgumentException(
          "No --query given and no " + summaryFile.getFileName() + " next to " + stageInput);
    }
    StageSummary previous = objectMapper.readValue(summaryFile.toFile(), StageSummary.class);
    log.info("Using query recorded in {}", summaryFile);
    return previous.query();
  }

  private StageSummary writeSummary(Path outDir, StageSummary summary) throws IOException {
    Files.createDirectories(outDir);
    objectMapper
        .writerWithDefaultPrettyPrinter()
        .writeValue(outDir.resolve(StageSummary.fileName(summary.stage())).toFile(), summary);
    log.info(
        "{}: {} -> {} record(s) in {} ms{}",
        summary.stage(),
        summary.inputCount(),
        summary.outputCount(),
        summary.elapsedMillis(),
        summary.skippedLines() > 0 ? ", " + summary.skippedLines() + " line(s) skipped" : "");
    return summary;
  }

  private static long elapsedSince(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000;
  }
}
