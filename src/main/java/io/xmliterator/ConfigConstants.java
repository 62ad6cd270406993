package io.xmliterator;

/**
 * Configuration constants
 * @see ParserOptions#fromConfig(io.vertx.core.json.JsonObject)
 * @since 1.0.0
 */
public final class ConfigConstants {
  public static final String BUFFER_SIZE = "xmliterator.bufferSize";
  public static final String DEFAULT_ENCODING = "xmliterator.defaultEncoding";
  public static final String MAX_EVENTS = "xmliterator.maxEvents";
  public static final String MAX_DEPTH = "xmliterator.maxDepth";
  public static final String FORCE_LIST = "xmliterator.forceList";

  public static final int DEFAULT_BUFFER_SIZE = 4096;
  public static final String DEFAULT_DEFAULT_ENCODING = "UTF-8";

  /**
   * Value for {@link #MAX_EVENTS} and {@link #MAX_DEPTH} meaning "no limit"
   */
  public static final int UNLIMITED = -1;

  private ConfigConstants() {
    // hidden constructor
  }
}
