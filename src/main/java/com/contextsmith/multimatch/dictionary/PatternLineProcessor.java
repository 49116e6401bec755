package com.contextsmith.multimatch.dictionary;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.contextsmith.multimatch.utils.ProcessUtil;
import com.contextsmith.multimatch.utils.StringUtil;
import com.google.common.io.LineProcessor;

/**
 * Reads a pattern dictionary, one pattern per line. Lines are trimmed; blank
 * lines, comment lines and patterns shorter than the minimum number of code
 * points are skipped. A byte order mark opening the first line is dropped.
 * Duplicates are kept in file order.
 */
public class PatternLineProcessor implements LineProcessor<List<String>> {
  private static final Logger log = LoggerFactory.getLogger(PatternLineProcessor.class);

  static final int PROGRESS_UPDATE_GAP = 10000;
  static final char BYTE_ORDER_MARK = '\uFEFF';

  private final List<String> patterns;
  private final int minChars;
  private final String commentPrefix;
  private int numLines;
  private int numSkipped;

  public PatternLineProcessor(int minChars, String commentPrefix) {
    checkArgument(minChars >= 1, "Minimum pattern length must be positive: %s",
                  minChars);
    checkNotNull(commentPrefix, "Comment prefix cannot be null");
    this.patterns = new ArrayList<>();
    this.minChars = minChars;
    this.commentPrefix = commentPrefix;
  }

  public int getNumSkipped() {
    return this.numSkipped;
  }

  @Override
  public List<String> getResult() {
    return this.patterns;
  }

  @Override
  public boolean processLine(String line) {
    ++this.numLines;
    // String.trim() keeps the byte order mark some editors write first.
    if (this.numLines == 1 && !line.isEmpty() &&
        line.charAt(0) == BYTE_ORDER_MARK) {
      line = line.substring(1);
    }
    line = line.trim();
    if (line.isEmpty()) return true;
    if (!this.commentPrefix.isEmpty() &&
        line.startsWith(this.commentPrefix)) {
      return true;
    }

    if (StringUtil.codePointLength(line) < this.minChars) {
      log.trace("\"{}\" is too short, not loading it.", line);
      ++this.numSkipped;
      return true;
    }
    this.patterns.add(line);

    if (this.patterns.size() % PROGRESS_UPDATE_GAP == 0) {
      log.info("{}. {}, Storing: {}", this.patterns.size(),
               ProcessUtil.getHeapConsumption(),
               StringUtils.abbreviate(line, 40));
    }
    return true;
  }

  public int getNumLines() {
    return this.numLines;
  }
}
