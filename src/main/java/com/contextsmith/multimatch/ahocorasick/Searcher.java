package com.contextsmith.multimatch.ahocorasick;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
   Iterator returning the matches of one text, one at a time.

   <p>Matches come out in discovery order: all patterns ending at a position
   are emitted before the scan moves on, in the order they are stored in the
   state's outputs. Unlike {@link AhoCorasick#search(String)} the result is
   not sorted by start position.</p>

   <p>A searcher is not thread-safe and cannot be restarted; call
   {@link AhoCorasick#matchesOf(String)} again for a fresh one.</p>
 */
public class Searcher implements Iterator<Match> {

  /**
   * Continues the search from {@code lastState} and returns the state right
   * after the next emitted match, or null when the text is exhausted.
   * Package protected.
   */
  static SearchState continueSearch(AhoCorasick automaton, String text,
                                    SearchState lastState) {
    // Drain what was captured at the last position before reading on.
    if (lastState.hasPendingOutputs()) return lastState.advanceCursor();

    int state = lastState.getCurrentState();
    int position = lastState.getTextPosition();
    int offset = lastState.getTextOffset();

    while (offset < text.length()) {
      int codePoint = text.codePointAt(offset);
      offset += Character.charCount(codePoint);
      ++position;
      state = automaton.nextState(state, codePoint);

      // Continue lookup if no pattern ends at current position.
      State s = automaton.getState(state);
      if (!s.hasOutputs()) continue;

      return new SearchState(automaton, offset, position, state, s.outputs(),
                             1);
    }
    return null;
  }

  private final AhoCorasick automaton;
  private final String text;
  private SearchState currentState;  // Right after the last returned match.
  private SearchState nextState;     // Looked ahead by hasNext().
  private boolean isExhausted;

  Searcher(AhoCorasick automaton, String text, SearchState state) {
    this.automaton = automaton;
    this.text = text;
    this.currentState = state;
    this.nextState = null;
    this.isExhausted = false;
  }

  /**
   * Returns the state right after the last match returned by
   * {@link #next()}. Resuming from it yields the remaining matches.
   */
  public SearchState getState() {
    return this.currentState;
  }

  @Override
  public boolean hasNext() {
    if (this.nextState == null && !this.isExhausted) {
      this.nextState = continueSearch(this.automaton, this.text,
                                      this.currentState);
      this.isExhausted = (this.nextState == null);
    }
    return (this.nextState != null);
  }

  @Override
  public Match next() {
    if (!hasNext()) throw new NoSuchElementException();
    this.currentState = this.nextState;
    this.nextState = null;
    return this.automaton.newMatch(this.currentState.lastEmittedOutput(),
                                   this.currentState.getTextPosition());
  }

  @Override
  public void remove() {
    throw new UnsupportedOperationException();
  }
}
