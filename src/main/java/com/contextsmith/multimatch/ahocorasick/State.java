package com.contextsmith.multimatch.ahocorasick;

import java.util.Arrays;

/**
 * A state represents an element in the Aho-Corasick automaton: one distinct
 * prefix shared by the patterns.
 *
 * <p>States never point at each other directly. Transitions and the fail link
 * are integer handles into the state table owned by {@link AhoCorasick}, so
 * the table can be handed out after the build without any reference cycles.
 * Mutators are package private and only called while building.</p>
 */
public abstract class State {

  // Here's an inlined list of ints backed by an array of ints.
  static final int[] EMPTY_INTS = new int[0];

  // null when empty
  // an Integer when size 1, while building
  // an int[] when size > 1, or once sealed
  private Object outputs = null;
  private int fail = AhoCorasick.ROOT;
  private final int depth;

  State(int depth) {
    this.depth = depth;
  }

  void addOutput(int value) {
    if (this.outputs == null) {
      this.outputs = value;
    } else if (this.outputs instanceof Integer) {
      int v = ((Integer) this.outputs).intValue();
      if (value != v) {
        this.outputs = new int[] {v, value};
      }
    } else {
      int[] outputs = (int[]) this.outputs;
      for (int v : outputs) {
        if (v == value) return;
      }
      int[] newoutputs = Arrays.copyOf(outputs, outputs.length + 1);
      newoutputs[newoutputs.length - 1] = value;
      this.outputs = newoutputs;
    }
  }

  void addOutputs(int[] values) {
    for (int i : values) {
      this.addOutput(i);
    }
  }

  /**
   * Moves a single output into an array so that {@link #outputs()} never
   * allocates afterwards. Called once the outputs are final.
   */
  void sealOutputs() {
    if (this.outputs instanceof Integer) {
      this.outputs = new int[] { ((Integer) this.outputs).intValue() };
    }
  }

  /**
   * Returns the handle of the state reached on {@code codePoint}, or
   * {@link AhoCorasick#NO_STATE} when there is no such transition.
   */
  public abstract int get(int codePoint);

  /**
   * Returns the code points this state has transitions on.
   */
  public abstract int[] keys();

  abstract void put(int codePoint, int state);

  public int getDepth() {
    return this.depth;
  }

  public int getFail() {
    return this.fail;
  }

  /**
   * Returns the 1-based indices of every pattern ending at this state, own
   * pattern(s) first, then those inherited through the fail link.
   */
  public int[] getOutputs() {
    int[] outputs = this.outputs();
    return (outputs.length > 0) ? outputs.clone() : outputs;
  }

  // Callers must not modify the returned array. Allocates only before
  // sealOutputs().
  int[] outputs() {
    if (this.outputs == null) {
      return EMPTY_INTS;
    } else if (this.outputs instanceof Integer) {
      return new int[] { ((Integer) this.outputs).intValue() };
    } else {
      return (int[]) this.outputs;
    }
  }

  public boolean hasOutputs() {
    return this.outputs != null;
  }

  public boolean hasTransition(int codePoint) {
    return this.get(codePoint) != AhoCorasick.NO_STATE;
  }

  void setFail(int fail) {
    this.fail = fail;
  }
}
