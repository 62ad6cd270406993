package io.xmliterator.input;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * Determines the character encoding of an XML document from its byte order
 * mark or its XML declaration
 * @since 1.0.0
 */
public final class EncodingDetector {
  private static final Logger log = LoggerFactory.getLogger(EncodingDetector.class);

  /**
   * The maximum number of bytes inspected at the beginning of the document
   */
  static final int PROLOG_LENGTH = 1024;

  private static final Pattern ENCODING_PATTERN = Pattern.compile(
      "encoding\\s*=\\s*[\"']([A-Za-z][A-Za-z0-9._\\-]*)[\"']");

  private EncodingDetector() {
    // hidden constructor
  }

  /**
   * Detect the encoding of the document in the given stream. The stream
   * must support {@link InputStream#mark(int)}. Its position is unchanged
   * when the method returns.
   * @param in the stream
   * @param fallback the encoding to use if the document does not declare
   * one or if the declared one is not supported
   * @return the encoding
   * @throws IOException if the stream could not be read
   */
  public static Charset detect(InputStream in, Charset fallback) throws IOException {
    if (!in.markSupported()) {
      throw new IllegalArgumentException("Input stream must support mark/reset");
    }
    in.mark(PROLOG_LENGTH);
    byte[] prolog;
    try {
      prolog = in.readNBytes(PROLOG_LENGTH);
    } finally {
      in.reset();
    }
    return detect(prolog, prolog.length, fallback);
  }

  /**
   * Detect the encoding of a document from its first bytes
   * @param prolog the first bytes of the document
   * @param len the number of valid bytes in <code>prolog</code>
   * @param fallback the encoding to use if the document does not declare
   * one or if the declared one is not supported
   * @return the encoding
   */
  static Charset detect(byte[] prolog, int len, Charset fallback) {
    if (startsWith(prolog, len, 0xEF, 0xBB, 0xBF)) {
      return StandardCharsets.UTF_8;
    }
    if (startsWith(prolog, len, 0xFE, 0xFF) || startsWith(prolog, len, 0x00, 0x3C, 0x00, 0x3F)) {
      return StandardCharsets.UTF_16BE;
    }
    if (startsWith(prolog, len, 0xFF, 0xFE) || startsWith(prolog, len, 0x3C, 0x00, 0x3F, 0x00)) {
      return StandardCharsets.UTF_16LE;
    }

    if (!startsWith(prolog, len, '<', '?', 'x', 'm', 'l')) {
      return fallback;
    }

    // the declaration only contains ASCII characters
    String decl = new String(prolog, 0, len, StandardCharsets.ISO_8859_1);
    int end = decl.indexOf("?>");
    if (end < 0) {
      return fallback;
    }
    Matcher m = ENCODING_PATTERN.matcher(decl.substring(0, end));
    if (!m.find()) {
      return fallback;
    }

    String name = m.group(1);
    if (name.regionMatches(true, 0, "UTF-16", 0, 6) ||
        name.regionMatches(true, 0, "UTF-32", 0, 6)) {
      log.warn("Document declares encoding `" + name + "' but its declaration " +
          "is single-byte encoded. Falling back to " + fallback.name() + ".");
      return fallback;
    }

    try {
      return Charset.forName(name);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      log.warn("Unsupported encoding `" + name + "'. Falling back to " +
          fallback.name() + ".");
      return fallback;
    }
  }

  private static boolean startsWith(byte[] buf, int len, int... prefix) {
    if (len < prefix.length) {
      return false;
    }
    for (int i = 0; i < prefix.length; ++i) {
      if ((buf[i] & 0xFF) != prefix[i]) {
        return false;
      }
    }
    return true;
  }
}
