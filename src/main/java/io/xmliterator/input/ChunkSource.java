package io.xmliterator.input;

import java.io.Closeable;
import java.io.IOException;

/**
 * Supplies UTF-8 encoded bytes to the {@link XMLTokenizer}
 */
interface ChunkSource extends Closeable {
  /**
   * Read the next chunk of bytes
   * @param buf the buffer to fill
   * @return the number of bytes written to <code>buf</code> (may be 0) or
   * <code>-1</code> if the end of the input has been reached
   * @throws IOException if the input could not be read or decoded
   */
  int read(byte[] buf) throws IOException;
}
