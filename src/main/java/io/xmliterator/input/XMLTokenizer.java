package io.xmliterator.input;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import javax.xml.stream.Location;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;

import com.fasterxml.aalto.AsyncByteArrayFeeder;
import com.fasterxml.aalto.AsyncXMLInputFactory;
import com.fasterxml.aalto.AsyncXMLStreamReader;
import com.fasterxml.aalto.stax.InputFactoryImpl;

import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;
import io.xmliterator.DecodeException;
import io.xmliterator.MalformedXMLException;
import io.xmliterator.MismatchedTagException;
import io.xmliterator.ParserOptions;

/**
 * Splits an XML byte stream into {@link XMLToken}s. The stream is read chunk
 * by chunk and fed into an asynchronous parser. A new chunk is only read
 * when the parser has consumed the previous one, so the tokenizer never
 * reads ahead further than one chunk.
 * @since 1.0.0
 */
public class XMLTokenizer implements Iterator<XMLToken>, Closeable {
  private static final Logger log = LoggerFactory.getLogger(XMLTokenizer.class);

  private final AsyncXMLInputFactory xmlInputFactory = new InputFactoryImpl();
  private final AsyncXMLStreamReader<AsyncByteArrayFeeder> xmlParser =
      xmlInputFactory.createAsyncForByteArray();

  private final Charset encoding;
  private final ChunkSource source;
  private final byte[] buf;

  /**
   * The maximum number of bytes kept for reporting a mismatched end tag
   */
  private static final int MAX_RETAINED = 64 * 1024;

  /**
   * Bytes fed into the parser after the end of the last element tag
   */
  private byte[] retained = new byte[256];
  private int retainedLen = 0;
  private long retainedStart = 0;

  /**
   * Names of the elements the parser has reported as open
   */
  private final Deque<String> openElements = new ArrayDeque<>();

  /**
   * The number of bytes fed into the parser so far
   */
  private long bytesFed = 0;

  private boolean inputEnded = false;
  private boolean done = false;
  private boolean closed = false;

  /**
   * <code>true</code> if the last start element was self-closing and the
   * end element the parser reports for it must be skipped
   */
  private boolean skipNextEnd = false;

  private XMLToken nextToken;

  /**
   * Create a tokenizer that reads from the given stream. The encoding of
   * the document is detected immediately.
   * @param in the stream to read from. It will be closed when the tokenizer
   * is closed.
   * @param options parser options
   * @throws IOException if the beginning of the stream could not be read
   */
  public XMLTokenizer(InputStream in, ParserOptions options) throws IOException {
    BufferedInputStream bin = new BufferedInputStream(in, options.getBufferSize());
    this.encoding = EncodingDetector.detect(bin, options.getDefaultEncoding());
    this.buf = new byte[options.getBufferSize()];

    ChunkSource utf8;
    if (encoding.equals(StandardCharsets.UTF_8) ||
        encoding.equals(StandardCharsets.US_ASCII)) {
      utf8 = new RawChunkSource(bin);
    } else {
      log.debug("Transcoding input from " + encoding.name() + " to UTF-8");
      InputStreamReader reader = new InputStreamReader(bin, encoding.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT));
      utf8 = new TranscodingChunkSource(reader, options.getBufferSize());
    }
    source = new DeclarationFilter(utf8);
  }

  /**
   * @return the encoding the document is read with
   */
  public Charset getEncoding() {
    return encoding;
  }

  @Override
  public boolean hasNext() {
    if (nextToken != null) {
      return true;
    }
    if (done) {
      return false;
    }
    try {
      nextToken = readToken();
    } catch (RuntimeException e) {
      done = true;
      throw e;
    }
    if (nextToken == null) {
      done = true;
      return false;
    }
    return true;
  }

  @Override
  public XMLToken next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    XMLToken result = nextToken;
    nextToken = null;
    return result;
  }

  /**
   * Read tokens from the parser until one is found that should be reported
   * @return the token or <code>null</code> if the end of the document has
   * been reached
   */
  private XMLToken readToken() {
    while (true) {
      // read next token
      int event;
      try {
        event = xmlParser.next();
      } catch (XMLStreamException e) {
        throw toException(e);
      }

      switch (event) {
        case AsyncXMLStreamReader.EVENT_INCOMPLETE:
          // wait for more input
          feed();
          break;

        case XMLStreamConstants.END_DOCUMENT:
          return null;

        case XMLStreamConstants.START_ELEMENT:
          releaseParsed();
          if (isEmptyElement()) {
            skipNextEnd = true;
            return new XMLToken(XMLToken.Type.EMPTY_ELEMENT, pos(), name());
          }
          openElements.push(name());
          return new XMLToken(XMLToken.Type.START_ELEMENT, pos(), name());

        case XMLStreamConstants.END_ELEMENT:
          releaseParsed();
          if (skipNextEnd) {
            skipNextEnd = false;
            break;
          }
          openElements.poll();
          return new XMLToken(XMLToken.Type.END_ELEMENT, pos(), name());

        case XMLStreamConstants.CHARACTERS:
        case XMLStreamConstants.CDATA:
        case XMLStreamConstants.SPACE:
          return new XMLToken(XMLToken.Type.TEXT, pos(), xmlParser.getText());

        default:
          // comments, processing instructions, DTD, start of document
          break;
      }
    }
  }

  /**
   * Read the next chunk from the input and push it into the parser
   */
  private void feed() {
    if (inputEnded) {
      MismatchedTagException mismatch = findMismatchedEndTag(null);
      if (mismatch != null) {
        throw mismatch;
      }
      throw new MalformedXMLException("Unexpected end of input", bytesFed, null);
    }

    int len;
    try {
      len = source.read(buf);
    } catch (CharacterCodingException e) {
      throw new DecodeException("Input is not valid " + encoding.name(), -1, e);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read input", e);
    }

    if (len < 0) {
      xmlParser.getInputFeeder().endOfInput();
      inputEnded = true;
      return;
    }

    if (len == 0) {
      return;
    }

    retain(buf, len);
    try {
      xmlParser.getInputFeeder().feedInput(buf, 0, len);
    } catch (XMLStreamException e) {
      throw toException(e);
    }
    bytesFed += len;
  }

  /**
   * Keep bytes fed into the parser until an element tag after them has
   * been parsed
   * @param b the bytes
   * @param len the number of bytes to keep
   */
  private void retain(byte[] b, int len) {
    if (retainedStart < 0) {
      return;
    }
    if (retainedLen + len > MAX_RETAINED) {
      // the end tag cannot be located anymore
      retainedStart = -1;
      retained = null;
      return;
    }
    if (retainedLen + len > retained.length) {
      byte[] n = new byte[Math.max(retained.length * 2, retainedLen + len)];
      System.arraycopy(retained, 0, n, 0, retainedLen);
      retained = n;
    }
    System.arraycopy(b, 0, retained, retainedLen, len);
    retainedLen += len;
  }

  /**
   * Drop retained bytes the parser has consumed
   */
  private void releaseParsed() {
    if (retainedStart < 0) {
      return;
    }
    long end;
    try {
      end = xmlParser.getLocationInfo().getEndingByteOffset();
    } catch (XMLStreamException e) {
      end = -1;
    }
    if (end < retainedStart || end > retainedStart + retainedLen) {
      return;
    }
    int n = (int)(end - retainedStart);
    System.arraycopy(retained, n, retained, 0, retainedLen - n);
    retainedLen -= n;
    retainedStart = end;
  }

  /**
   * Look for an end tag in the input the parser has not consumed yet whose
   * name does not match the innermost open element
   * @param cause the parser failure that ended the stream (may be
   * <code>null</code>)
   * @return the failure or <code>null</code> if there is no such end tag
   */
  private MismatchedTagException findMismatchedEndTag(XMLStreamException cause) {
    String expected = openElements.peek();
    if (expected == null || retainedStart < 0) {
      return null;
    }
    String rest = new String(retained, 0, retainedLen, StandardCharsets.UTF_8);
    int i = 0;
    while (i < rest.length()) {
      if (rest.startsWith("<!--", i)) {
        i = skipPast(rest, i, "-->");
      } else if (rest.startsWith("<![CDATA[", i)) {
        i = skipPast(rest, i, "]]>");
      } else if (rest.startsWith("<?", i)) {
        i = skipPast(rest, i, "?>");
      } else if (rest.startsWith("</", i)) {
        int nameEnd = i + 2;
        while (nameEnd < rest.length() && rest.charAt(nameEnd) != '>' &&
            !Character.isWhitespace(rest.charAt(nameEnd))) {
          ++nameEnd;
        }
        if (nameEnd == rest.length()) {
          // incomplete end tag
          return null;
        }
        String actual = rest.substring(i + 2, nameEnd);
        if (actual.equals(expected)) {
          return null;
        }
        long offset = retainedStart + rest.substring(0, i)
            .getBytes(StandardCharsets.UTF_8).length;
        return new MismatchedTagException(expected, actual, offset, cause);
      } else {
        ++i;
      }
    }
    return null;
  }

  private static int skipPast(String s, int from, String end) {
    int i = s.indexOf(end, from);
    return i < 0 ? s.length() : i + end.length();
  }

  private boolean isEmptyElement() {
    try {
      return xmlParser.isEmptyElement();
    } catch (XMLStreamException e) {
      throw toException(e);
    }
  }

  /**
   * @return the qualified name of the current element as it appears in
   * the document
   */
  private String name() {
    String prefix = xmlParser.getPrefix();
    if (prefix == null || prefix.isEmpty()) {
      return xmlParser.getLocalName();
    }
    return prefix + ":" + xmlParser.getLocalName();
  }

  private long pos() {
    return xmlParser.getLocation().getCharacterOffset();
  }

  /**
   * Convert a parser exception to a typed failure
   * @param e the parser exception
   * @return the typed failure
   */
  private RuntimeException toException(XMLStreamException e) {
    Location location = e.getLocation();
    long offset = location != null ? location.getCharacterOffset() : bytesFed;
    String message = e.getMessage();
    if (message != null && message.contains("Invalid UTF-8")) {
      // the parser decodes UTF-8 input itself
      return new DecodeException("Input is not valid UTF-8", offset, e);
    }

    MismatchedTagException mismatch = findMismatchedEndTag(e);
    if (mismatch != null) {
      return mismatch;
    }
    return new MalformedXMLException("Could not parse input: " + message, offset, e);
  }

  /**
   * Close the parser and the underlying input stream
   * @throws IOException if the input stream could not be closed
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    done = true;
    nextToken = null;
    try {
      xmlParser.close();
    } catch (XMLStreamException e) {
      throw new IOException("Could not close XML parser", e);
    } finally {
      source.close();
    }
  }
}
