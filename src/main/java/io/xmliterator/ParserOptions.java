package io.xmliterator;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Options that control how an XML document is read and reduced
 * @since 1.0.0
 */
public class ParserOptions {
  private int bufferSize = ConfigConstants.DEFAULT_BUFFER_SIZE;
  private Charset defaultEncoding = StandardCharsets.UTF_8;
  private int maxEvents = ConfigConstants.UNLIMITED;
  private int maxDepth = ConfigConstants.UNLIMITED;
  private Set<String> forceList = Collections.emptySet();

  /**
   * Create options from a configuration object. Missing keys keep their
   * default values.
   * @param config the configuration (see {@link ConfigConstants})
   * @return the options
   * @throws IllegalArgumentException if one of the values is invalid
   */
  public static ParserOptions fromConfig(JsonObject config) {
    ParserOptions result = new ParserOptions()
      .setBufferSize(config.getInteger(ConfigConstants.BUFFER_SIZE,
          ConfigConstants.DEFAULT_BUFFER_SIZE))
      .setMaxEvents(config.getInteger(ConfigConstants.MAX_EVENTS,
          ConfigConstants.UNLIMITED))
      .setMaxDepth(config.getInteger(ConfigConstants.MAX_DEPTH,
          ConfigConstants.UNLIMITED));

    String encoding = config.getString(ConfigConstants.DEFAULT_ENCODING,
        ConfigConstants.DEFAULT_DEFAULT_ENCODING);
    result.setDefaultEncoding(Charset.forName(encoding));

    JsonArray forceList = config.getJsonArray(ConfigConstants.FORCE_LIST);
    if (forceList != null) {
      Set<String> names = new LinkedHashSet<>();
      for (int i = 0; i < forceList.size(); ++i) {
        names.add(forceList.getString(i));
      }
      result.setForceList(names);
    }

    return result;
  }

  /**
   * Set the number of bytes read from the input at once
   * @param bufferSize the buffer size (must be at least 2)
   * @return a reference to this, so the API can be used fluently
   */
  public ParserOptions setBufferSize(int bufferSize) {
    if (bufferSize < 2) {
      throw new IllegalArgumentException("Buffer size must be at least 2");
    }
    this.bufferSize = bufferSize;
    return this;
  }

  /**
   * @return the number of bytes read from the input at once
   */
  public int getBufferSize() {
    return bufferSize;
  }

  /**
   * Set the encoding to use if the document does not declare one or if the
   * declared one is not supported
   * @param defaultEncoding the encoding
   * @return a reference to this, so the API can be used fluently
   */
  public ParserOptions setDefaultEncoding(Charset defaultEncoding) {
    this.defaultEncoding = Objects.requireNonNull(defaultEncoding);
    return this;
  }

  /**
   * @return the encoding used if the document does not declare a
   * supported one
   */
  public Charset getDefaultEncoding() {
    return defaultEncoding;
  }

  /**
   * Set the maximum number of events a reducer consumes before it stops
   * @param maxEvents the maximum number of events or
   * {@link ConfigConstants#UNLIMITED}
   * @return a reference to this, so the API can be used fluently
   */
  public ParserOptions setMaxEvents(int maxEvents) {
    if (maxEvents < 0 && maxEvents != ConfigConstants.UNLIMITED) {
      throw new IllegalArgumentException("Invalid maximum number of events: " + maxEvents);
    }
    this.maxEvents = maxEvents;
    return this;
  }

  /**
   * @return the maximum number of events a reducer consumes or
   * {@link ConfigConstants#UNLIMITED}
   */
  public int getMaxEvents() {
    return maxEvents;
  }

  /**
   * Set the maximum element depth the dict reducer records. The root element
   * has depth 1. Deeper elements are skipped together with their content.
   * @param maxDepth the maximum depth or {@link ConfigConstants#UNLIMITED}
   * @return a reference to this, so the API can be used fluently
   */
  public ParserOptions setMaxDepth(int maxDepth) {
    if (maxDepth < 0 && maxDepth != ConfigConstants.UNLIMITED) {
      throw new IllegalArgumentException("Invalid maximum depth: " + maxDepth);
    }
    this.maxDepth = maxDepth;
    return this;
  }

  /**
   * @return the maximum element depth or {@link ConfigConstants#UNLIMITED}
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  /**
   * Set the names of elements whose values the dict reducer always wraps in
   * a list, even if they occur only once
   * @param forceList the element names
   * @return a reference to this, so the API can be used fluently
   */
  public ParserOptions setForceList(Collection<String> forceList) {
    this.forceList = Collections.unmodifiableSet(new LinkedHashSet<>(forceList));
    return this;
  }

  /**
   * @return the names of elements that are always wrapped in a list
   */
  public Set<String> getForceList() {
    return forceList;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ParserOptions that = (ParserOptions)o;
    return bufferSize == that.bufferSize &&
      maxEvents == that.maxEvents &&
      maxDepth == that.maxDepth &&
      Objects.equals(defaultEncoding, that.defaultEncoding) &&
      Objects.equals(forceList, that.forceList);
  }

  @Override
  public int hashCode() {
    return Objects.hash(bufferSize, defaultEncoding, maxEvents, maxDepth, forceList);
  }
}
