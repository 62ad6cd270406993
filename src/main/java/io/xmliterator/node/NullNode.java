package io.xmliterator.node;

/**
 * An element without any content
 */
public final class NullNode extends Node {
  /**
   * The only instance of this class
   */
  public static final NullNode INSTANCE = new NullNode();

  private NullNode() {
    // hidden constructor
  }

  @Override
  public Type getType() {
    return Type.NULL;
  }

  @Override
  public Object toObject() {
    return null;
  }
}
