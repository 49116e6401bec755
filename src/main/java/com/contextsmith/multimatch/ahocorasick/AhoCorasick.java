package com.contextsmith.multimatch.ahocorasick;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Streams;

/**
   <p>An implementation of the Aho-Corasick string searching
   automaton, working on Unicode code points. It finds every occurrence of
   every pattern in a text in one pass, in time linear in the text length
   plus the number of matches.</p>

   <p>An instance is immutable once built, so it can be shared between
   threads and searched concurrently. Patterns and positions use a 1-based
   convention: the first pattern has index 1 and the first code point of a
   text has position 1.</p>

   <p>
   Example usage:
   <code><pre>
       AhoCorasick automaton = AhoCorasick.of("he", "she", "his", "hers");

       for (Match match : automaton.search("ushers")) {
           System.out.println(match.getPattern() + " at " + match.getStart());
       }

       Searcher searcher = automaton.matchesOf("ushers");
       while (searcher.hasNext()) {
           System.out.println(searcher.next());
       }
   </pre></code>
   </p>
 */
public final class AhoCorasick {
  private static final Logger log = LoggerFactory.getLogger(AhoCorasick.class);

  /** Handle of the root state. */
  public static final int ROOT = 0;

  /** Returned by {@link State#get(int)} when there is no transition. */
  public static final int NO_STATE = -1;

  public static Builder builder() {
    return new Builder();
  }

  public static AhoCorasick of(Iterable<String> patterns) {
    checkNotNull(patterns, "Patterns cannot be null");
    return builder().addAll(patterns).build();
  }

  public static AhoCorasick of(String... patterns) {
    checkNotNull(patterns, "Patterns cannot be null");
    return of(Arrays.asList(patterns));
  }

  private final State[] states;
  private final ImmutableList<String> patterns;
  private final int[] patternLengths;  // In code points, 0-based by list.

  private AhoCorasick(State[] states, ImmutableList<String> patterns,
                      int[] patternLengths) {
    this.states = states;
    this.patterns = patterns;
    this.patternLengths = patternLengths;
  }

  /**
   * Returns true if at least one pattern occurs in {@code text}. Stops at
   * the first match.
   */
  public boolean matchesAny(String text) {
    return matchesOf(text).hasNext();
  }

  public boolean contains(String pattern) {
    return indexOf(pattern) != -1;
  }

  public String getPattern(int patternIndex) {
    checkElementIndex(patternIndex - 1, this.patterns.size(), "Pattern index");
    return this.patterns.get(patternIndex - 1);
  }

  public ImmutableList<String> getPatterns() {
    return this.patterns;
  }

  public State getState(int state) {
    return this.states[state];
  }

  /**
   * Returns true if {@code s} is a prefix of one of the patterns.
   */
  public boolean hasPrefix(String s) {
    checkNotNull(s, "Prefix cannot be null");
    return walk(s) != NO_STATE;
  }

  /**
   * Returns the 1-based index of the first pattern equal to {@code pattern},
   * or -1 if there is none.
   */
  public int indexOf(String pattern) {
    if (pattern == null || pattern.isEmpty()) return -1;
    int state = walk(pattern);
    if (state == NO_STATE) return -1;

    // Own patterns are the ones as long as the state is deep.
    State s = this.states[state];
    for (int patternIndex : s.outputs()) {
      if (patternLength(patternIndex) == s.getDepth()) return patternIndex;
    }
    return -1;
  }

  /**
   * Returns a lazy iterator over the matches in {@code text}, in discovery
   * order. Each call starts a fresh search.
   */
  public Searcher matchesOf(String text) {
    return resume(text, SearchState.INITIAL);
  }

  /**
   * The automaton's transition function: follows fail links until a
   * transition on {@code codePoint} exists or the root is reached, then takes
   * the transition if there is one. Total work over a whole text is linear.
   */
  public int nextState(int state, int codePoint) {
    int next;
    while ((next = this.states[state].get(codePoint)) == NO_STATE) {
      if (state == ROOT) return ROOT;
      state = this.states[state].getFail();
    }
    return next;
  }

  /**
   * Continues a streaming search from a state captured by
   * {@link Searcher#getState()} on the same text and the same automaton.
   *
   * @throws IllegalArgumentException if {@code state} was produced by a
   *     different automaton or does not fit within {@code text}
   */
  public Searcher resume(String text, SearchState state) {
    checkNotNull(text, "Text cannot be null");
    checkNotNull(state, "Search state cannot be null");
    checkArgument(state.belongsTo(this),
                  "Search state was produced by another automaton");
    checkArgument(state.getTextOffset() <= text.length(),
                  "Search state offset %s is beyond the text length %s",
                  state.getTextOffset(), text.length());
    checkArgument(state.getCurrentState() >= 0 &&
                  state.getCurrentState() < this.states.length,
                  "Unknown state %s", state.getCurrentState());
    return new Searcher(this, text, state);
  }

  /**
   * Finds all matches in {@code text}, sorted by start position and then by
   * pattern index. The order is part of the contract.
   */
  public ImmutableList<Match> search(String text) {
    checkNotNull(text, "Text cannot be null");
    List<Match> matches = new ArrayList<>();

    int state = ROOT;
    int position = 0;
    for (int offset = 0; offset < text.length(); ) {
      int codePoint = text.codePointAt(offset);
      offset += Character.charCount(codePoint);
      ++position;

      state = nextState(state, codePoint);
      if (!this.states[state].hasOutputs()) continue;
      for (int patternIndex : this.states[state].outputs()) {
        matches.add(newMatch(patternIndex, position));
      }
    }

    matches.sort(Match.BY_START_THEN_INDEX);
    if (log.isTraceEnabled()) {
      log.trace("Found {} match(es) in {} code point(s)", matches.size(),
                position);
    }
    return ImmutableList.copyOf(matches);
  }

  /**
   * Returns the number of states, root included.
   */
  public int size() {
    return this.states.length;
  }

  public Stream<Match> stream(String text) {
    return Streams.stream(matchesOf(text));
  }

  Match newMatch(int patternIndex, int stop) {
    int start = stop - patternLength(patternIndex) + 1;
    return new Match(this.patterns.get(patternIndex - 1), patternIndex, start,
                     stop);
  }

  int patternLength(int patternIndex) {
    return this.patternLengths[patternIndex - 1];
  }

  // Follows explicit transitions only.
  private int walk(String s) {
    int state = ROOT;
    for (int offset = 0; offset < s.length(); ) {
      int codePoint = s.codePointAt(offset);
      offset += Character.charCount(codePoint);
      state = this.states[state].get(codePoint);
      if (state == NO_STATE) return NO_STATE;
    }
    return state;
  }

  /**
   * Collects patterns and builds an {@link AhoCorasick}. A builder is single
   * use and not thread-safe.
   */
  public static final class Builder {
    private final List<State> states;
    private final List<String> patterns;
    private final List<Integer> patternLengths;
    private boolean isBuilt;

    private Builder() {
      this.states = new ArrayList<>();
      this.states.add(new RootState());
      this.patterns = new ArrayList<>();
      this.patternLengths = new ArrayList<>();
      this.isBuilt = false;
    }

    /**
     * Adds a new pattern. Its index is one more than the number of patterns
     * added before it. Empty patterns are rejected, since they would match
     * at every position.
     */
    public Builder add(String pattern) {
      checkState(!this.isBuilt, "Can't add patterns after build() is called.");
      checkNotNull(pattern, "Pattern cannot be null");
      checkArgument(!pattern.isEmpty(), "Pattern must be non empty");

      int state = ROOT;  // Start extending from the root.
      int length = 0;
      for (int offset = 0; offset < pattern.length(); ) {
        int codePoint = pattern.codePointAt(offset);
        offset += Character.charCount(codePoint);
        ++length;
        state = extend(state, codePoint, length);
      }
      this.patterns.add(pattern);
      this.patternLengths.add(length);
      this.states.get(state).addOutput(this.patterns.size());
      return this;
    }

    public Builder addAll(Iterable<String> patterns) {
      for (String pattern : patterns) {
        add(pattern);
      }
      return this;
    }

    /**
     * Computes the fail links and merged outputs, and returns the automaton.
     *
     * Initializes the fail transitions of all states except for the root,
     * breadth first, so a state's fail target (always shallower) is final
     * before the state itself is expanded.
     */
    public AhoCorasick build() {
      checkState(!this.isBuilt, "build() can only be called once.");
      Stopwatch stopwatch = Stopwatch.createStarted();

      Queue<Integer> queue = new ArrayDeque<>();
      State root = this.states.get(ROOT);
      for (int c : root.keys()) {
        int child = root.get(c);
        this.states.get(child).setFail(ROOT);
        queue.add(child);
      }

      while (!queue.isEmpty()) {
        State currState = this.states.get(queue.remove());

        for (int c : currState.keys()) {
          int nextState = currState.get(c);
          queue.add(nextState);

          int failState = currState.getFail();
          while (failState != ROOT && !this.states.get(failState).hasTransition(c)) {
            failState = this.states.get(failState).getFail();
          }
          int nextStateFail = this.states.get(failState).get(c);
          if (nextStateFail == NO_STATE) nextStateFail = ROOT;

          State next = this.states.get(nextState);
          next.setFail(nextStateFail);
          if (nextStateFail != nextState) {
            next.addOutputs(this.states.get(nextStateFail).outputs());
          }
        }
      }
      for (State state : this.states) {
        state.sealOutputs();
      }
      this.isBuilt = true;

      AhoCorasick automaton = new AhoCorasick(
          this.states.toArray(new State[this.states.size()]),
          ImmutableList.copyOf(this.patterns),
          this.patternLengths.stream().mapToInt(Integer::intValue).toArray());
      log.debug("Built {} state(s) from {} pattern(s) in {}",
                automaton.size(), this.patterns.size(), stopwatch);
      return automaton;
    }

    private int extend(int state, int codePoint, int depth) {
      int next = this.states.get(state).get(codePoint);
      if (next != NO_STATE) return next;
      this.states.add(new RegularState(depth));
      next = this.states.size() - 1;
      this.states.get(state).put(codePoint, next);
      return next;
    }
  }
}
