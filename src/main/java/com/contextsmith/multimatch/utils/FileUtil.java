package com.contextsmith.multimatch.utils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.zip.GZIPInputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.io.ByteSource;
import com.google.common.io.CharSource;
import com.google.common.io.Files;

public class FileUtil {

  static final Logger log = LogManager.getLogger(FileUtil.class);

  public static final String COMPRESSED_FILE_RE = ".+?\\.(gz|gzip)";

  /**
   * Returns the UTF-8 contents of {@code filename}, looked up on disk first
   * and then on the class path. Gzipped files are decompressed.
   */
  public static CharSource findResourceAsCharSource(String filename)
      throws IOException {
    ByteSource bytes = findResourceAsByteSource(filename);
    if (bytes == null) {
      throw new IOException("Could not locate: " + filename);
    }
    if (filename.matches(COMPRESSED_FILE_RE)) {
      bytes = gunzip(bytes);
    }
    return bytes.asCharSource(StandardCharsets.UTF_8);
  }

  public static ByteSource findResourceAsByteSource(String filename) {
    // First, lookup the file directly.
    File f = new File(filename);
    if (f.isFile()) return Files.asByteSource(f);

    // Second, lookup the file in class-path.
    ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
    if (classLoader.getResource(filename) != null) {
      return new ByteSource() {
        @Override
        public InputStream openStream() throws IOException {
          InputStream stream = classLoader.getResourceAsStream(filename);
          if (stream == null) throw new IOException("Vanished: " + filename);
          return stream;
        }
      };
    }
    log.debug("Could not locate: {}", filename);
    return null;
  }

  public static CharSource inputStreamToCharSource(
      final InputStream inputStream) {
    return new CharSource() {
        @Override
        public Reader openStream() throws IOException {
            return new InputStreamReader(inputStream, StandardCharsets.UTF_8);
        }
    };
  }

  /**
   * Loads {@code filename} as properties, from disk or from the class path.
   * Returns empty properties if it cannot be found.
   */
  public static Properties loadProperties(String filename) throws IOException {
    return loadProperties(filename, false);
  }

  /**
   * Loads {@code filename} as properties, from disk or from the class path.
   * A missing file is an {@link IOException} when {@code required}, and
   * empty properties otherwise.
   */
  public static Properties loadProperties(String filename, boolean required)
      throws IOException {
    Properties prop = new Properties();
    ByteSource bytes = findResourceAsByteSource(filename);
    if (bytes == null) {
      if (required) throw new IOException("Could not locate: " + filename);
      log.warn("Could not find '{}', using defaults.", filename);
      return prop;
    }
    try (Reader reader = bytes.asCharSource(StandardCharsets.UTF_8).openStream()) {
      prop.load(reader);
    }
    return prop;
  }

  private static ByteSource gunzip(final ByteSource compressed) {
    return new ByteSource() {
      @Override
      public InputStream openStream() throws IOException {
        return new GZIPInputStream(
            new BufferedInputStream(compressed.openStream()));
      }
    };
  }

  public static CharSource fileAsCharSource(String path) throws IOException {
    File file = new File(path);
    if (!file.isFile()) throw new IOException("Not a file: " + path);
    return Files.asCharSource(file, StandardCharsets.UTF_8);
  }

  private FileUtil() {
  }
}
