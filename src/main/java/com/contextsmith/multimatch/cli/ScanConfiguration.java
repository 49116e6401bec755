package com.contextsmith.multimatch.cli;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.IOException;
import java.util.Locale;
import java.util.Properties;

import org.apache.commons.lang3.StringUtils;

import com.contextsmith.multimatch.dictionary.PatternDictionary;
import com.contextsmith.multimatch.utils.FileUtil;
import com.google.common.base.MoreObjects;
import com.google.common.primitives.Ints;

/**
 * Settings of a scan run. Defaults come from {@code multimatch.properties} on
 * the class path, can be replaced by another properties file, and finally by
 * command line flags through the setters.
 */
public class ScanConfiguration {
  public static final String DEFAULT_PROPERTIES = "multimatch.properties";

  public static final String MIN_CHARS_KEY = "patterns.min.chars";
  public static final String COMMENT_PREFIX_KEY = "patterns.comment.prefix";
  public static final String SCAN_MODE_KEY = "scan.mode";
  public static final String OUTPUT_FORMAT_KEY = "output.format";

  /** How the text is consumed. */
  public enum ScanMode {
    batch, stream
  }

  /** Loads {@code filename}, falling back to defaults when it is missing. */
  public static ScanConfiguration load(String filename) throws IOException {
    return load(filename, false);
  }

  /**
   * Loads {@code filename}. When {@code required}, a missing file throws
   * {@link IOException} instead of falling back to defaults.
   */
  public static ScanConfiguration load(String filename, boolean required)
      throws IOException {
    return fromProperties(FileUtil.loadProperties(filename, required));
  }

  public static ScanConfiguration fromProperties(Properties props) {
    ScanConfiguration config = new ScanConfiguration();
    String minChars = props.getProperty(MIN_CHARS_KEY);
    if (StringUtils.isNotBlank(minChars)) config.setMinChars(minChars);

    // A blank prefix is meaningful: it turns comment lines off.
    String prefix = props.getProperty(COMMENT_PREFIX_KEY);
    if (prefix != null) config.setCommentPrefix(prefix.trim());

    String mode = props.getProperty(SCAN_MODE_KEY);
    if (StringUtils.isNotBlank(mode)) config.setScanMode(mode);

    String format = props.getProperty(OUTPUT_FORMAT_KEY);
    if (StringUtils.isNotBlank(format)) config.setOutputFormat(format);
    return config;
  }

  private int minChars = PatternDictionary.DEFAULT_MIN_CHARS;
  private String commentPrefix = PatternDictionary.DEFAULT_COMMENT_PREFIX;
  private ScanMode scanMode = ScanMode.batch;
  private OutputFormat outputFormat = OutputFormat.text;

  public String getCommentPrefix() {
    return this.commentPrefix;
  }

  public int getMinChars() {
    return this.minChars;
  }

  public OutputFormat getOutputFormat() {
    return this.outputFormat;
  }

  public ScanMode getScanMode() {
    return this.scanMode;
  }

  public void setCommentPrefix(String commentPrefix) {
    this.commentPrefix = StringUtils.defaultString(commentPrefix);
  }

  public void setMinChars(String minChars) {
    Integer value = Ints.tryParse(StringUtils.trimToEmpty(minChars));
    checkArgument(value != null && value >= 1,
                  "%s must be a positive integer: %s", MIN_CHARS_KEY, minChars);
    this.minChars = value;
  }

  public void setOutputFormat(String outputFormat) {
    this.outputFormat = parseEnum(OutputFormat.class, OUTPUT_FORMAT_KEY,
                                  outputFormat);
  }

  public void setScanMode(String scanMode) {
    this.scanMode = parseEnum(ScanMode.class, SCAN_MODE_KEY, scanMode);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("minChars", this.minChars)
        .add("commentPrefix", this.commentPrefix)
        .add("scanMode", this.scanMode)
        .add("outputFormat", this.outputFormat)
        .toString();
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String key,
                                                 String value) {
    String name = StringUtils.trimToEmpty(value).toLowerCase(Locale.ROOT);
    try {
      return Enum.valueOf(type, name);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Invalid %s: \"%s\"", key, value), e);
    }
  }
}
