package io.xmliterator;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;
import io.xmliterator.input.EventNormalizer;
import io.xmliterator.input.XMLStreamEvent;
import io.xmliterator.input.XMLTokenizer;
import io.xmliterator.node.Node;
import io.xmliterator.reduce.DictReducer;
import io.xmliterator.reduce.Edge;
import io.xmliterator.reduce.EdgeCounter;
import io.xmliterator.reduce.PathCounter;
import io.xmliterator.reduce.ReductionResult;
import io.xmliterator.reduce.Reductions;
import io.xmliterator.reduce.XMLReducer;
import rx.Observable;

/**
 * Entry point for reading XML files as event streams and for reducing them
 * to mappings or edge counts
 * @since 1.0.0
 */
public final class XMLIterator {
  private static final Logger log = LoggerFactory.getLogger(XMLIterator.class);

  private XMLIterator() {
    // hidden constructor
  }

  /**
   * Open an XML file and iterate over its events. The caller must close
   * the returned iterator (preferably with try-with-resources) unless it
   * consumes all events.
   * @param path the file to read
   * @return the events
   * @throws IOException if the file could not be opened
   */
  public static EventNormalizer iterate(Path path) throws IOException {
    return iterate(path, new ParserOptions());
  }

  /**
   * Open an XML file and iterate over its events. The caller must close
   * the returned iterator (preferably with try-with-resources) unless it
   * consumes all events.
   * @param path the file to read
   * @param options parser options
   * @return the events
   * @throws IOException if the file could not be opened
   */
  public static EventNormalizer iterate(Path path, ParserOptions options)
      throws IOException {
    log.debug("Reading " + path);
    InputStream in = Files.newInputStream(path);
    try {
      return new EventNormalizer(new XMLTokenizer(in, options));
    } catch (IOException | RuntimeException e) {
      try {
        in.close();
      } catch (IOException ce) {
        e.addSuppressed(ce);
      }
      throw e;
    }
  }

  /**
   * Create an observable that emits the events of an XML file. The file is
   * opened on subscription and closed when the observable completes, fails
   * or is unsubscribed from (for example through {@link Observable#take(int)}).
   * @param path the file to read
   * @return the observable
   */
  public static Observable<XMLStreamEvent> observe(Path path) {
    return observe(path, new ParserOptions());
  }

  /**
   * Create an observable that emits the events of an XML file. The file is
   * opened on subscription and closed when the observable completes, fails
   * or is unsubscribed from (for example through {@link Observable#take(int)}).
   * @param path the file to read
   * @param options parser options
   * @return the observable
   */
  public static Observable<XMLStreamEvent> observe(Path path, ParserOptions options) {
    return Observable.<XMLStreamEvent, EventNormalizer>using(() -> {
      try {
        return iterate(path, options);
      } catch (IOException e) {
        throw new UncheckedIOException("Could not open " + path, e);
      }
    }, events -> Observable.from(() -> events), events -> {
      try {
        events.close();
      } catch (IOException e) {
        log.error("Could not close " + path, e);
      }
    });
  }

  /**
   * Convert an XML file to a tree of nodes in the format of xmltodict
   * @param path the file to read
   * @return the (possibly partial) tree
   * @throws IOException if the file could not be opened
   * @see DictReducer
   */
  public static ReductionResult<Node> toMapping(Path path) throws IOException {
    return toMapping(path, new ParserOptions());
  }

  /**
   * Convert an XML file to a tree of nodes in the format of xmltodict
   * @param path the file to read
   * @param options parser options (maximum number of events, maximum depth,
   * elements to always wrap in lists)
   * @return the (possibly partial) tree
   * @throws IOException if the file could not be opened
   * @see DictReducer
   */
  public static ReductionResult<Node> toMapping(Path path, ParserOptions options)
      throws IOException {
    return reduce(path, options, new DictReducer(options));
  }

  /**
   * Count parent/child element name pairs in an XML file
   * @param path the file to read
   * @return the (possibly partial) counts
   * @throws IOException if the file could not be opened
   */
  public static ReductionResult<Map<Edge, Long>> countEdges(Path path)
      throws IOException {
    return countEdges(path, new ParserOptions());
  }

  /**
   * Count parent/child element name pairs in an XML file
   * @param path the file to read
   * @param options parser options
   * @return the (possibly partial) counts
   * @throws IOException if the file could not be opened
   */
  public static ReductionResult<Map<Edge, Long>> countEdges(Path path,
      ParserOptions options) throws IOException {
    return reduce(path, options, new EdgeCounter());
  }

  /**
   * Count element paths from the root element in an XML file
   * @param path the file to read
   * @return the (possibly partial) counts
   * @throws IOException if the file could not be opened
   */
  public static ReductionResult<Map<List<String>, Long>> countPaths(Path path)
      throws IOException {
    return countPaths(path, new ParserOptions());
  }

  /**
   * Count element paths from the root element in an XML file
   * @param path the file to read
   * @param options parser options
   * @return the (possibly partial) counts
   * @throws IOException if the file could not be opened
   */
  public static ReductionResult<Map<List<String>, Long>> countPaths(Path path,
      ParserOptions options) throws IOException {
    return reduce(path, options, new PathCounter());
  }

  private static <R> ReductionResult<R> reduce(Path path, ParserOptions options,
      XMLReducer<R> reducer) throws IOException {
    try (EventNormalizer events = iterate(path, options)) {
      ReductionResult<R> result = Reductions.reduce(events, reducer,
          options.getMaxEvents());
      log.debug("Consumed " + result.getEventsConsumed() + " events from " + path);
      return result;
    }
  }
}
