package io.xmliterator.input;

import java.io.IOException;
import java.io.InputStream;

/**
 * Passes bytes through unchanged. Used for input that is already UTF-8 or
 * one of its subsets.
 */
class RawChunkSource implements ChunkSource {
  private final InputStream in;

  RawChunkSource(InputStream in) {
    this.in = in;
  }

  @Override
  public int read(byte[] buf) throws IOException {
    return in.read(buf);
  }

  @Override
  public void close() throws IOException {
    in.close();
  }
}
