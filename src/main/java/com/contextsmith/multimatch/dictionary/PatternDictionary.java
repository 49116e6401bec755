package com.contextsmith.multimatch.dictionary;

import java.io.IOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.multimatch.ahocorasick.AhoCorasick;
import com.contextsmith.multimatch.utils.FileUtil;
import com.google.common.base.Stopwatch;
import com.google.common.io.CharSource;

/**
 * Builds automata from pattern files. A file is looked up on disk first and
 * then on the class path; names ending in {@code .gz} are decompressed.
 */
public class PatternDictionary {
  private static final Logger log = LoggerFactory.getLogger(PatternDictionary.class);

  public static final int DEFAULT_MIN_CHARS = 1;
  public static final String DEFAULT_COMMENT_PREFIX = "#";

  public static AhoCorasick load(String path) throws IOException {
    return load(path, DEFAULT_MIN_CHARS, DEFAULT_COMMENT_PREFIX);
  }

  public static AhoCorasick load(String path, int minChars,
                                 String commentPrefix) throws IOException {
    log.info("Loading patterns from: {}", path);
    return load(FileUtil.findResourceAsCharSource(path), minChars,
                commentPrefix);
  }

  public static AhoCorasick load(CharSource source, int minChars,
                                 String commentPrefix) throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    PatternLineProcessor lineProcessor =
        new PatternLineProcessor(minChars, commentPrefix);
    List<String> patterns = source.readLines(lineProcessor);
    log.info("Read {} pattern(s) from {} line(s), {} too short, in {}",
             patterns.size(), lineProcessor.getNumLines(),
             lineProcessor.getNumSkipped(), stopwatch);

    stopwatch.reset().start();
    log.info("Compiling aho-corasick automaton... ");
    AhoCorasick automaton = AhoCorasick.of(patterns);
    log.info("Finished compilation of {} state(s) in {}", automaton.size(),
             stopwatch);
    return automaton;
  }

  private PatternDictionary() {
  }
}
