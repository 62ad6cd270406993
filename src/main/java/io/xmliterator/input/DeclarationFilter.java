package io.xmliterator.input;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;
import io.xmliterator.util.UTF8BomFilter;

/**
 * Removes the byte order mark and the <code>encoding</code> pseudo-attribute
 * of the XML declaration from the beginning of a UTF-8 chunk stream. The
 * parser only reads UTF-8, so once the input has been transcoded (or the
 * declared encoding has been replaced by a fallback) the declaration no
 * longer describes the bytes the parser receives.
 * @since 1.0.0
 */
class DeclarationFilter implements ChunkSource {
  private static final Logger log = LoggerFactory.getLogger(DeclarationFilter.class);

  private static final byte[] DECLARATION_START =
      "<?xml".getBytes(StandardCharsets.US_ASCII);

  private static final Pattern ENCODING_ATTRIBUTE = Pattern.compile(
      "\\s+encoding\\s*=\\s*(\"[^\"]*\"|'[^']*')");

  private static final int NO_DECLARATION = -1;
  private static final int NEED_MORE = -2;

  private final ChunkSource source;
  private final UTF8BomFilter bomFilter = new UTF8BomFilter();

  private boolean prologRead = false;

  /**
   * The filtered beginning of the document that has not been returned yet
   */
  private byte[] pending;
  private int pendingPos;

  /**
   * Create a new filter
   * @param source the source providing UTF-8 chunks
   */
  DeclarationFilter(ChunkSource source) {
    this.source = source;
  }

  @Override
  public int read(byte[] buf) throws IOException {
    if (!prologRead) {
      prologRead = true;
      pending = readProlog(buf.length);
      pendingPos = 0;
    }

    if (pending != null) {
      int n = Math.min(buf.length, pending.length - pendingPos);
      System.arraycopy(pending, pendingPos, buf, 0, n);
      pendingPos += n;
      if (pendingPos == pending.length) {
        pending = null;
      }
      if (n > 0) {
        return n;
      }
    }

    return source.read(buf);
  }

  /**
   * Read chunks until the end of the XML declaration has been found or it is
   * clear that there is none
   * @param chunkSize the size of the chunks to read
   * @return the filtered bytes read
   * @throws IOException if the source could not be read
   */
  private byte[] readProlog(int chunkSize) throws IOException {
    ByteArrayOutputStream prolog = new ByteArrayOutputStream();
    byte[] chunk = new byte[chunkSize];
    boolean eof = false;
    int start = -1;
    while (true) {
      byte[] bytes = prolog.toByteArray();
      if (start < 0 && (bytes.length >= 3 || eof)) {
        start = bomFilter.filter(bytes, bytes.length);
      }
      if (start >= 0) {
        int end = findDeclarationEnd(bytes, start);
        if (end >= 0) {
          return rewrite(bytes, start, end);
        }
        if (end == NO_DECLARATION || eof ||
            bytes.length - start > EncodingDetector.PROLOG_LENGTH) {
          return copyFrom(bytes, start);
        }
      }

      int n = source.read(chunk);
      if (n < 0) {
        eof = true;
      } else {
        prolog.write(chunk, 0, n);
      }
    }
  }

  /**
   * Look for the XML declaration
   * @param bytes the bytes read so far
   * @param start the offset of the first byte after the BOM
   * @return the offset of the first byte after the declaration,
   * {@link #NO_DECLARATION} or {@link #NEED_MORE}
   */
  private static int findDeclarationEnd(byte[] bytes, int start) {
    int len = bytes.length - start;
    for (int i = 0; i < DECLARATION_START.length; ++i) {
      if (i >= len) {
        return NEED_MORE;
      }
      if (bytes[start + i] != DECLARATION_START[i]) {
        return NO_DECLARATION;
      }
    }
    if (len == DECLARATION_START.length) {
      return NEED_MORE;
    }
    // <?xml-stylesheet ...?> and similar processing instructions
    if (!Character.isWhitespace(bytes[start + DECLARATION_START.length])) {
      return NO_DECLARATION;
    }
    for (int i = start + DECLARATION_START.length; i < bytes.length - 1; ++i) {
      if (bytes[i] == '?' && bytes[i + 1] == '>') {
        return i + 2;
      }
    }
    return NEED_MORE;
  }

  private static byte[] rewrite(byte[] bytes, int start, int end) {
    String declaration = new String(bytes, start, end - start, StandardCharsets.UTF_8);
    Matcher m = ENCODING_ATTRIBUTE.matcher(declaration);
    if (!m.find()) {
      return copyFrom(bytes, start);
    }

    log.debug("Removing `" + m.group().trim() + "' from XML declaration");
    byte[] rewritten = (declaration.substring(0, m.start()) +
        declaration.substring(m.end())).getBytes(StandardCharsets.UTF_8);
    byte[] result = new byte[rewritten.length + bytes.length - end];
    System.arraycopy(rewritten, 0, result, 0, rewritten.length);
    System.arraycopy(bytes, end, result, rewritten.length, bytes.length - end);
    return result;
  }

  private static byte[] copyFrom(byte[] bytes, int start) {
    byte[] result = new byte[bytes.length - start];
    System.arraycopy(bytes, start, result, 0, result.length);
    return result;
  }

  @Override
  public void close() throws IOException {
    source.close();
  }
}
