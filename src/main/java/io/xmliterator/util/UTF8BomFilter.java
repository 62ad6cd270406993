package io.xmliterator.util;

/**
 * Skips a BOM (byte order marker) at the beginning of a byte stream that is
 * read chunk by chunk
 * @since 1.0.0
 */
public class UTF8BomFilter {
  private static final byte[] UTF8_BOM_BYTES = new byte[] { (byte)0xEF, (byte)0xBB, (byte)0xBF };

  /**
   * <code>true</code> if the filter has already checked for a BOM
   */
  private boolean bomChecked = false;

  /**
   * Check the given chunk for a BOM. If this is the first chunk checked and
   * if it starts with a BOM, the method will return the offset of the first
   * byte after the BOM. The method is a no-op for all subsequent chunks.
   * @param buf the chunk to check
   * @param len the number of valid bytes in <code>buf</code>
   * @return the offset of the first byte in <code>buf</code> that belongs to
   * the actual content (either <code>0</code> or the length of the BOM)
   */
  public int filter(byte[] buf, int len) {
    if (bomChecked) {
      return 0;
    }
    bomChecked = true;

    if (len < UTF8_BOM_BYTES.length) {
      return 0;
    }
    for (int i = 0; i < UTF8_BOM_BYTES.length; ++i) {
      if (UTF8_BOM_BYTES[i] != buf[i]) {
        // we did not find a BOM
        return 0;
      }
    }

    // we found a BOM - skip it
    return UTF8_BOM_BYTES.length;
  }
}
