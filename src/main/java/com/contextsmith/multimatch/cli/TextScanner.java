package com.contextsmith.multimatch.cli;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.IOException;
import java.util.Iterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.multimatch.ahocorasick.AhoCorasick;
import com.contextsmith.multimatch.ahocorasick.Match;
import com.google.common.base.Stopwatch;
import com.google.common.io.CharSource;

/**
 * Scans texts with one automaton and writes every match to an
 * {@link Appendable}, one line per match.
 */
public class TextScanner {
  private static final Logger log = LoggerFactory.getLogger(TextScanner.class);

  private final AhoCorasick automaton;
  private final ScanConfiguration config;

  public TextScanner(AhoCorasick automaton, ScanConfiguration config) {
    this.automaton = checkNotNull(automaton, "Automaton cannot be null");
    this.config = checkNotNull(config, "Configuration cannot be null");
  }

  /**
   * Scans the whole of {@code input} and returns the number of matches
   * written.
   */
  public int scan(String source, CharSource input, Appendable out)
      throws IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    String text = input.read();

    int numMatches = 0;
    Iterator<Match> matches =
        (this.config.getScanMode() == ScanConfiguration.ScanMode.stream) ?
        this.automaton.matchesOf(text) : this.automaton.search(text).iterator();
    while (matches.hasNext()) {
      Match match = matches.next();
      if (log.isTraceEnabled()) log.trace("{}: {}", source, match);
      out.append(this.config.getOutputFormat().format(source, match))
         .append(System.lineSeparator());
      ++numMatches;
    }
    log.info("Found {} match(es) in {} ({} chars) in {}", numMatches, source,
             text.length(), stopwatch);
    return numMatches;
  }
}
