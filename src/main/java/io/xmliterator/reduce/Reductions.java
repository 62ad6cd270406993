package io.xmliterator.reduce;

import java.util.Iterator;

import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;
import io.xmliterator.ConfigConstants;
import io.xmliterator.XMLIteratorException;
import io.xmliterator.input.XMLStreamEvent;

/**
 * Drives {@link XMLReducer}s over event streams
 * @since 1.0.0
 */
public final class Reductions {
  private static final Logger log = LoggerFactory.getLogger(Reductions.class);

  private Reductions() {
    // hidden constructor
  }

  /**
   * Pass all events to the given reducer
   * @param <R> the type of the reducer's result
   * @param events the events
   * @param reducer the reducer
   * @return the result
   */
  public static <R> ReductionResult<R> reduce(Iterator<XMLStreamEvent> events,
      XMLReducer<R> reducer) {
    return reduce(events, reducer, ConfigConstants.UNLIMITED);
  }

  /**
   * Pass events to the given reducer until the stream ends or the given
   * number of events has been consumed. If the stream fails, the reducer's
   * partial result is returned together with the cause.
   * @param <R> the type of the reducer's result
   * @param events the events
   * @param reducer the reducer
   * @param maxEvents the maximum number of events to consume or
   * {@link ConfigConstants#UNLIMITED}
   * @return the result
   */
  public static <R> ReductionResult<R> reduce(Iterator<XMLStreamEvent> events,
      XMLReducer<R> reducer, int maxEvents) {
    long consumed = 0;
    boolean limitReached = false;
    XMLIteratorException error = null;
    try {
      while (true) {
        if (maxEvents != ConfigConstants.UNLIMITED && consumed >= maxEvents) {
          limitReached = true;
          break;
        }
        if (!events.hasNext()) {
          break;
        }
        reducer.onEvent(events.next());
        ++consumed;
      }
    } catch (XMLIteratorException e) {
      log.warn("Input ended abnormally after " + consumed + " events. " +
          "Returning partial result.", e);
      error = e;
    }
    return new ReductionResult<>(reducer.getResult(), consumed, limitReached, error);
  }
}
