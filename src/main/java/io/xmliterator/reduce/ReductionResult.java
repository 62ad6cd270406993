package io.xmliterator.reduce;

import java.util.Optional;

import io.xmliterator.XMLIteratorException;

/**
 * The outcome of reducing an event stream. Holds the (possibly partial)
 * value, the number of events consumed and, if the stream failed, the cause.
 * @param <R> the type of the value
 * @since 1.0.0
 */
public class ReductionResult<R> {
  private final R value;
  private final long eventsConsumed;
  private final boolean limitReached;
  private final XMLIteratorException error;

  /**
   * Create a new result
   * @param value the value
   * @param eventsConsumed the number of events passed to the reducer
   * @param limitReached <code>true</code> if the reducer was stopped because
   * the maximum number of events had been consumed
   * @param error the failure that ended the stream (may be <code>null</code>)
   */
  public ReductionResult(R value, long eventsConsumed, boolean limitReached,
      XMLIteratorException error) {
    this.value = value;
    this.eventsConsumed = eventsConsumed;
    this.limitReached = limitReached;
    this.error = error;
  }

  /**
   * @return the value built from all consumed events
   */
  public R getValue() {
    return value;
  }

  /**
   * @return the number of events passed to the reducer
   */
  public long getEventsConsumed() {
    return eventsConsumed;
  }

  /**
   * @return <code>true</code> if the reducer was stopped because the
   * maximum number of events had been consumed
   */
  public boolean isLimitReached() {
    return limitReached;
  }

  /**
   * @return the failure that ended the stream early, if any
   */
  public Optional<XMLIteratorException> getError() {
    return Optional.ofNullable(error);
  }

  /**
   * @return <code>true</code> if the whole document has been consumed
   * without errors
   */
  public boolean isComplete() {
    return error == null && !limitReached;
  }
}
