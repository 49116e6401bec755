package com.contextsmith.multimatch.ahocorasick;

import java.util.Arrays;

import com.google.common.base.MoreObjects;

/**
   <p>Holds the state of a running streaming search: how far into the text it
   got, which automaton state it is in, and the outputs captured at that
   position that have not all been emitted yet.</p>

   <p>Instances are immutable. A {@link Searcher} moves from one state to the
   next, and {@link AhoCorasick#resume(String, SearchState)} starts a new
   searcher from any state previously returned by
   {@link Searcher#getState()}.</p>
 */
public final class SearchState {

  /** The state before any character has been read. */
  public static final SearchState INITIAL =
      new SearchState(null, 0, 0, AhoCorasick.ROOT, State.EMPTY_INTS, 0);

  private final AhoCorasick automaton;  // Null only for INITIAL.
  private final int textOffset;
  private final int textPosition;
  private final int currentState;
  private final int[] pendingOutputs;
  private final int pendingCursor;

  SearchState(AhoCorasick automaton, int textOffset, int textPosition,
              int currentState, int[] pendingOutputs, int pendingCursor) {
    this.automaton = automaton;
    this.textOffset = textOffset;
    this.textPosition = textPosition;
    this.currentState = currentState;
    this.pendingOutputs = pendingOutputs;
    this.pendingCursor = pendingCursor;
  }

  /**
   * Returns the char offset into the text where scanning resumes.
   */
  public int getTextOffset() {
    return this.textOffset;
  }

  /**
   * Returns the number of code points read so far. This is also the 1-based
   * position at which the pending outputs were captured.
   */
  public int getTextPosition() {
    return this.textPosition;
  }

  public int getCurrentState() {
    return this.currentState;
  }

  public int[] getPendingOutputs() {
    return this.pendingOutputs.clone();
  }

  public int getPendingCursor() {
    return this.pendingCursor;
  }

  public boolean hasPendingOutputs() {
    return this.pendingCursor < this.pendingOutputs.length;
  }

  /**
   * Returns true if this state can be resumed on {@code other}: it was
   * produced by a search over {@code other}, or it is {@link #INITIAL}.
   */
  boolean belongsTo(AhoCorasick other) {
    return this.automaton == null || this.automaton == other;
  }

  /**
   * Returns the pattern index most recently emitted from the pending
   * outputs.
   */
  int lastEmittedOutput() {
    return this.pendingOutputs[this.pendingCursor - 1];
  }

  SearchState advanceCursor() {
    return new SearchState(this.automaton, this.textOffset, this.textPosition,
                           this.currentState, this.pendingOutputs,
                           this.pendingCursor + 1);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("textOffset", this.textOffset)
        .add("textPosition", this.textPosition)
        .add("currentState", this.currentState)
        .add("pendingOutputs", Arrays.toString(this.pendingOutputs))
        .add("pendingCursor", this.pendingCursor)
        .toString();
  }
}
