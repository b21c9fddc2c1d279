package ru.dimension.container;

import java.util.List;

/**
 * A construction chain revisited a component that is already being constructed
 * on the same thread.
 */
public class CyclicDependencyException extends ContainerException {

  private final List<String> cycle;

  public CyclicDependencyException(List<String> cycle) {
    super("Cyclic dependency detected: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }

  /**
   * The cycle in traversal order. First and last elements are the same component.
   */
  public List<String> cycle() {
    return cycle;
  }
}
