package com.contextsmith.multimatch.cli;

import static com.contextsmith.multimatch.utils.Args.options;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.multimatch.ahocorasick.AhoCorasick;
import com.contextsmith.multimatch.dictionary.PatternDictionary;
import com.contextsmith.multimatch.utils.Args;
import com.contextsmith.multimatch.utils.FileUtil;
import com.contextsmith.multimatch.utils.ProcessUtil;
import com.google.common.base.Stopwatch;

/**
 * Command line scanner: prints every occurrence of the patterns of a
 * dictionary file in the given files, or in standard input when no file is
 * given.
 */
public class ScanMain {
  private static final Logger log = LoggerFactory.getLogger(ScanMain.class);

  public static final String STDIN_SOURCE = "-";
  public static final String USAGE =
      "Usage: ScanMain --patterns <file> [--config <file>] " +
      "[--mode batch|stream] [--format text|json] [--min-chars N] [files...]";

  String patternPath;
  String configPath;  // Null unless --config was given.
  String scanMode;
  String outputFormat;
  String minChars;
  List<String> inputPaths = new ArrayList<>();

  public static void main(String[] args) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ScanMain main = new ScanMain();
    try {
      main.parse(args);
    } catch (IllegalArgumentException e) {
      log.error(e.getMessage());
      ProcessUtil.die(USAGE);
      return;
    }

    try {
      int numMatches = main.run(System.out);
      log.info("Found {} match(es) in total in {}", numMatches, stopwatch);
    } catch (IOException | IllegalArgumentException e) {
      log.error("Scan failed: {}", e.getMessage());
      ProcessUtil.die(e);
    }
  }

  void parse(String... args) {
    Args.match()
        .on(options("--patterns", "-p"), value -> this.patternPath = value)
        .on(options("--config", "-c"), value -> this.configPath = value)
        .on(options("--mode", "-m"), value -> this.scanMode = value)
        .on(options("--format", "-f"), value -> this.outputFormat = value)
        .on("--min-chars", value -> this.minChars = value)
        .rest(rest -> this.inputPaths = rest)
        .parse(args);
    if (this.patternPath == null) {
      throw new IllegalArgumentException("--patterns is required");
    }
  }

  ScanConfiguration configure() throws IOException {
    // An explicit --config must exist; the default file is optional.
    ScanConfiguration config = (this.configPath == null)
        ? ScanConfiguration.load(ScanConfiguration.DEFAULT_PROPERTIES)
        : ScanConfiguration.load(this.configPath, true);
    if (this.scanMode != null) config.setScanMode(this.scanMode);
    if (this.outputFormat != null) config.setOutputFormat(this.outputFormat);
    if (this.minChars != null) config.setMinChars(this.minChars);
    log.debug("Using {}", config);
    return config;
  }

  int run(Appendable out) throws IOException {
    ScanConfiguration config = configure();
    AhoCorasick automaton = PatternDictionary.load(
        this.patternPath, config.getMinChars(), config.getCommentPrefix());
    TextScanner scanner = new TextScanner(automaton, config);

    if (this.inputPaths.isEmpty()) {
      return scanner.scan(STDIN_SOURCE,
          FileUtil.inputStreamToCharSource(System.in), out);
    }
    int numMatches = 0;
    for (String path : this.inputPaths) {
      numMatches += scanner.scan(path, FileUtil.fileAsCharSource(path), out);
    }
    return numMatches;
  }
}
