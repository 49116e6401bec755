package com.contextsmith.multimatch.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Comparator;

import com.google.common.base.Objects;

/**
 * One occurrence of a pattern in a searched text.
 *
 * <p>All positions are 1-based and inclusive, counted in code points, so
 * {@code getStop() - getStart() + 1} is always the code point length of
 * {@link #getPattern()}. {@link #getPatternIndex()} is the 1-based position of
 * the pattern in the list the automaton was built from.</p>
 */
public final class Match {

  /** The order {@link AhoCorasick#search(String)} returns matches in. */
  public static final Comparator<Match> BY_START_THEN_INDEX =
      Comparator.comparingInt(Match::getStart)
                .thenComparingInt(Match::getPatternIndex);

  private final String pattern;
  private final int patternIndex;
  private final int start;
  private final int stop;

  public Match(String pattern, int patternIndex, int start, int stop) {
    checkNotNull(pattern, "Pattern cannot be null");
    checkArgument(patternIndex >= 1, "Pattern index must be 1-based: %s",
                  patternIndex);
    checkArgument(start >= 1 && stop >= start,
                  "Invalid match span %s:%s", start, stop);
    this.pattern = pattern;
    this.patternIndex = patternIndex;
    this.start = start;
    this.stop = stop;
  }

  public String getPattern() {
    return this.pattern;
  }

  public int getPatternIndex() {
    return this.patternIndex;
  }

  public int getStart() {
    return this.start;
  }

  public int getStop() {
    return this.stop;
  }

  /**
   * Returns the code point length of the matched span.
   */
  public int length() {
    return this.stop - this.start + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Match)) return false;
    Match other = (Match) o;
    return this.patternIndex == other.patternIndex &&
           this.start == other.start &&
           this.stop == other.stop &&
           this.pattern.equals(other.pattern);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(this.pattern, this.patternIndex, this.start,
                            this.stop);
  }

  @Override
  public String toString() {
    return String.format("Match(\"%s\", %d:%d)", this.pattern, this.start,
                         this.stop);
  }
}
