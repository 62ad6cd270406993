package io.xmliterator.reduce;

import io.xmliterator.input.XMLStreamEvent;

/**
 * Reduces normalized XML events
 * @param <R> the type of the result
 * @since 1.0.0
 */
public interface XMLReducer<R> extends StreamReducer<XMLStreamEvent, R> {
  // nothing to do here
}
