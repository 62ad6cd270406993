package io.xmliterator.reduce;

/**
 * Folds a stream of events into a single result
 * @param <R> the type of the result
 * @since 1.0.0
 */
public interface Reducer<R> {
  /**
   * Will be called when no more events will be passed to the reducer,
   * either because the stream has ended, the event limit has been reached or
   * the stream has failed
   * @return the result built from all events seen so far (never
   * <code>null</code>)
   */
  R getResult();
}
