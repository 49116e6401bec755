package com.contextsmith.multimatch.cli;

import com.contextsmith.multimatch.ahocorasick.Match;
import com.contextsmith.multimatch.utils.StringUtil;
import com.google.gson.JsonObject;

/** Enum of all available ways to print a match. */
public enum OutputFormat {
  /** {@code source:start-stop<TAB>patternIndex<TAB>pattern} */
  text {
    @Override
    public String format(String source, Match match) {
      return String.format("%s:%d-%d\t%d\t%s", source, match.getStart(),
                           match.getStop(), match.getPatternIndex(),
                           match.getPattern());
    }
  },
  /** One JSON object per line. */
  json {
    @Override
    public String format(String source, Match match) {
      JsonObject object = new JsonObject();
      object.addProperty("source", source);
      object.addProperty("pattern", match.getPattern());
      object.addProperty("pattern_index", match.getPatternIndex());
      object.addProperty("start", match.getStart());
      object.addProperty("stop", match.getStop());
      return StringUtil.toJson(object);
    }
  };

  public abstract String format(String source, Match match);
}
