package com.contextsmith.multimatch.utils;

import com.google.common.base.Strings;

public class ProcessUtil {

  public static final int EXIT_FAILURE = -1;

  public static void die(Exception e) {
    if (e != null) e.printStackTrace();
    System.exit(EXIT_FAILURE);
  }

  public static void die(String msg) {
    if (!Strings.isNullOrEmpty(msg)) {
      System.err.println(msg);
    }
    System.exit(EXIT_FAILURE);
  }

  public static String getHeapConsumption() {
    long heapSize = Runtime.getRuntime().totalMemory() / 1024 / 1024;
    long freeSize = Runtime.getRuntime().freeMemory() / 1024 / 1024;
    long heapMaxSize = Runtime.getRuntime().maxMemory() / 1024 / 1024;
    return String.format("%d/%d/%d MB Used",
                         heapSize - freeSize, heapSize, heapMaxSize);
  }

  private ProcessUtil() {
  }
}
