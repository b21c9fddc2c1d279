package ru.dimension.container;

/**
 * Lifetime of a component built by the container.
 */
public enum Scope {
  /** Built on first use, then cached for the life of the container. */
  SINGLETON,
  /** Built anew on every request. */
  PROTOTYPE
}
