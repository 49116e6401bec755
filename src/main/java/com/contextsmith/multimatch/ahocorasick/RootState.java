package com.contextsmith.multimatch.ahocorasick;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.primitives.Ints;

/**
 * The root state. It usually has a transition for most of the alphabet seen
 * in the patterns, so it is backed by a hash map instead of the inline arrays
 * used by {@link RegularState}.
 */
public class RootState extends State {
  // Insertion ordered, so the build visits children the same way every run.
  private final Map<Integer, Integer> codePointStateMap;

  RootState() {
    super(0);
    this.codePointStateMap = new LinkedHashMap<Integer, Integer>();
  }

  @Override
  public int get(int codePoint) {
    Integer state = this.codePointStateMap.get(codePoint);
    return (state == null) ? AhoCorasick.NO_STATE : state.intValue();
  }

  @Override
  public int[] keys() {
    return Ints.toArray(this.codePointStateMap.keySet());
  }

  @Override
  void put(int codePoint, int state) {
    this.codePointStateMap.put(codePoint, state);
  }
}
