package dev.clinrank.cli;

import dev.clinrank.eval.MetricsReport;
import dev.clinrank.eval.RankingEvaluator;
import dev.clinrank.funnel.ConfigurationException;
import dev.clinrank.funnel.StageException;
import dev.clinrank.pipeline.FunnelPipeline;
import dev.clinrank.pipeline.StageSummary;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line entry: {@code scout}, {@code inspect}, {@code judge} or {@code run}, plus {@code
 * evaluate} for scoring a final ranking against graded judgments.
 *
 * <p>Options use the {@code --name=value} form. Configuration overrides are ordinary Spring Boot
 * property arguments such as {@code --clinrank.funnel.judge-limit=5}. Failures are logged and
 * reported through the exit code: 2 for usage and configuration errors, 3 for I/O errors, 4 for
 * stage and scorer failures.
 */
@Component
public class FunnelCommand implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(FunnelCommand.class);

  static final String USAGE =
      """
      usage: clinrank <command> [options]
        scout    --chunks=<path> --query=<text> --out=<dir> [--dense-index=<file>]
        inspect  --chunks=<path> --candidates=<file> --out=<dir> [--query=<text>]
        judge    --chunks=<path> --rescored=<file> --out=<dir> [--query=<text>] [--links=<file>]
        run      --chunks=<path> --query=<text> --out=<dir> [--dense-index=<file>] [--links=<file>]
        evaluate --results=<file> --judgments=<file> --out=<dir> [--k=<n>]\
      """;

  static final int DEFAULT_EVALUATION_K = 10;

  private final FunnelPipeline pipeline;
  private final RankingEvaluator evaluator;
  private volatile ExitStatus status = ExitStatus.OK;

  public FunnelCommand(FunnelPipeline pipeline, RankingEvaluator evaluator) {
    this.pipeline = pipeline;
    this.evaluator = evaluator;
  }

  @Override
  public void run(ApplicationArguments args) {
    status = execute(args);
  }

  @Override
  public int getExitCode() {
    return status.code();
  }

  ExitStatus execute(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    if (commands.size() != 1) {
      log.error("Expected exactly one command\n{}", USAGE);
      return ExitStatus.USAGE;
    }

    String command = commands.get(0);
    try {
      if ("evaluate".equals(command)) {
        evaluate(args);
        return ExitStatus.OK;
      }
      List<StageSummary> summaries = dispatch(command, args);
      for (StageSummary summary : summaries) {
        log.info(
            "{} wrote {} record(s) for query '{}'",
            summary.stage(),
            summary.outputCount(),
            summary.query());
      }
      return ExitStatus.OK;
    } catch (ConfigurationException | IllegalArgumentException e) {
      log.error("{}: {}", command, e.getMessage());
      return ExitStatus.USAGE;
    } catch (IOException | UncheckedIOException e) {
      log.error("{}: I/O error: {}", command, e.getMessage(), e);
      return ExitStatus.IO_ERROR;
    } catch (StageException e) {
      log.error("{} failed: {}", command, e.getMessage(), e);
      return ExitStatus.SCORER_FAILURE;
    } catch (RuntimeException e) {
      log.error("{} failed unexpectedly", command, e);
      return ExitStatus.UNEXPECTED;
    }
  }

  private List<StageSummary> dispatch(String command, ApplicationArguments args)
      throws IOException {
    Path chunks = requiredPath(args, "chunks");
    Path out = requiredPath(args, "out");
    return switch (command) {
      case "scout" ->
          List.of(
              pipeline.scout(
                  required(args, "query"), chunks, optionalPath(args, "dense-index"), out));
      case "inspect" ->
          List.of(
              pipeline.inspect(
                  optional(args, "query"), chunks, requiredPath(args, "candidates"), out));
      case "judge" ->
          List.of(
              pipeline.judge(
                  optional(args, "query"),
                  chunks,
                  requiredPath(args, "rescored"),
                  optionalPath(args, "links"),
                  out));
      case "run" ->
          pipeline.runAll(
              required(args, "query"),
              chunks,
              optionalPath(args, "dense-index"),
              optionalPath(args, "links"),
              out);
      default -> throw new IllegalArgumentException("unknown command '" + command + "'\n" + USAGE);
    };
  }

  private void evaluate(ApplicationArguments args) throws IOException {
    String k = optional(args, "k");
    MetricsReport report =
        evaluator.evaluate(
            requiredPath(args, "results"),
            requiredPath(args, "judgments"),
            k == null ? DEFAULT_EVALUATION_K : Integer.parseInt(k),
            requiredPath(args, "out"));
    log.info(
        "Evaluated {} ranked chunk(s) against {} relevant", report.ranked(), report.relevant());
  }

  private static String required(ApplicationArguments args, String name) {
    String value = optional(args, name);
    if (value == null) {
      throw new IllegalArgumentException("missing required option --" + name + "\n" + USAGE);
    }
    return value;
  }

  private static @Nullable String optional(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(values.size() - 1);
    return value.isBlank() ? null : value;
  }

  private static Path requiredPath(ApplicationArguments args, String name) {
    return Path.of(required(args, name));
  }

  private static @Nullable Path optionalPath(ApplicationArguments args, String name) {
    String value = optional(args, name);
    return value == null ? null : Path.of(value);
  }
}
