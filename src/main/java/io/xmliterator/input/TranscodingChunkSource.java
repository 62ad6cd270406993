package io.xmliterator.input;

import java.io.IOException;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.StandardCharsets;

/**
 * Reads characters from a decoding {@link Reader} and re-encodes them to
 * UTF-8. A high surrogate at the end of a chunk is kept back until its low
 * surrogate has been read.
 */
class TranscodingChunkSource implements ChunkSource {
  /**
   * The maximum number of UTF-8 bytes a single char can be encoded to
   */
  private static final int MAX_BYTES_PER_CHAR = 3;

  private final Reader reader;
  private final CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder();
  private final CharBuffer chars;
  private boolean endOfInput;
  private boolean flushed;

  /**
   * Create a new source
   * @param reader the reader providing decoded characters
   * @param bufferSize the size of the byte buffers that will be passed
   * to {@link #read(byte[])}
   */
  TranscodingChunkSource(Reader reader, int bufferSize) {
    this.reader = reader;
    this.chars = CharBuffer.allocate(Math.max(2, bufferSize / MAX_BYTES_PER_CHAR));
  }

  @Override
  public int read(byte[] buf) throws IOException {
    while (!flushed) {
      if (!endOfInput && reader.read(chars) < 0) {
        endOfInput = true;
      }

      chars.flip();
      ByteBuffer out = ByteBuffer.wrap(buf);
      CoderResult result = encoder.encode(chars, out, endOfInput);
      if (result.isError()) {
        result.throwException();
      }
      if (endOfInput) {
        encoder.flush(out);
        flushed = true;
      }
      chars.compact();

      if (out.position() > 0) {
        return out.position();
      }
    }
    return -1;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
