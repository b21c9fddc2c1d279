package ru.dimension.container;

import java.util.List;

/**
 * A by-type lookup matched more than one component where exactly one was required.
 */
public class AmbiguousComponentException extends ContainerException {

  private final Class<?> requestedType;
  private final List<String> candidates;

  public AmbiguousComponentException(Class<?> requestedType, List<String> candidates) {
    super("More than one component of type " + requestedType.getName()
              + " was found (expected exactly one): " + candidates);
    this.requestedType = requestedType;
    this.candidates = List.copyOf(candidates);
  }

  public Class<?> requestedType() {
    return requestedType;
  }

  public List<String> candidates() {
    return candidates;
  }
}
