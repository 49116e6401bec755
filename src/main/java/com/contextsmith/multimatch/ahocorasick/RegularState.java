package com.contextsmith.multimatch.ahocorasick;

import java.util.Arrays;

/**
 * A non-root state. Most states have zero or one transition, so the
 * transition map is kept inline in two parallel arrays.
 */
public class RegularState extends State {

  // keys[i] is the code point leading to the state handle targets[i].
  // Both are EMPTY_INTS until the first transition is added.
  private int[] keys = EMPTY_INTS;
  private int[] targets = EMPTY_INTS;

  RegularState(int depth) {
    super(depth);
  }

  // BEGIN STATE MAP
  // This is basically an inlined map of code points to state handles,
  // sized for the small fan-out below the root.
  @Override
  public int get(int codePoint) {
    int[] keys = this.keys;
    for (int i = 0; i < keys.length; ++i) {
      if (keys[i] == codePoint) {
        return this.targets[i];
      }
    }
    return AhoCorasick.NO_STATE;
  }

  @Override
  public int[] keys() {
    return this.keys.clone();
  }

  @Override
  void put(int codePoint, int state) {
    for (int i = 0; i < this.keys.length; ++i) {
      if (this.keys[i] == codePoint) {
        this.targets[i] = state;
        return;
      }
    }

    int[] newkeys = Arrays.copyOf(this.keys, this.keys.length + 1);
    newkeys[newkeys.length - 1] = codePoint;

    int[] newtargets = Arrays.copyOf(this.targets, this.targets.length + 1);
    newtargets[newtargets.length - 1] = state;

    this.keys = newkeys;
    this.targets = newtargets;
  }
}
