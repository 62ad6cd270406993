package io.xmliterator.reduce;

/**
 * A reducer that processes events one at a time
 * @param <T> the type of the stream events this reducer can handle
 * @param <R> the type of the result
 * @since 1.0.0
 */
public interface StreamReducer<T, R> extends Reducer<R> {
  /**
   * Will be called on every stream event
   * @param event the event
   */
  void onEvent(T event);
}
