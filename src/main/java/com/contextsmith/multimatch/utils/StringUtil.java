package com.contextsmith.multimatch.utils;

import org.apache.commons.lang3.StringUtils;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

public class StringUtil {
  private static Gson gson = null;

  public static synchronized Gson getGsonInstance() {
    if (gson == null) {
      gson = new GsonBuilder().disableHtmlEscaping().create();
    }
    return gson;
  }

  /**
   * Returns the number of code points in {@code s}, 0 for null.
   */
  public static int codePointLength(String s) {
    if (StringUtils.isEmpty(s)) return 0;
    return s.codePointCount(0, s.length());
  }

  public static String toJson(Object o) {
    return getGsonInstance().toJson(o);
  }

  private StringUtil() {
  }
}
