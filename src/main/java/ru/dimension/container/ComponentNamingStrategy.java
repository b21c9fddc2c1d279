package ru.dimension.container;

/**
 * Derives a component name from a type when a type is registered without an explicit name.
 */
@FunctionalInterface
public interface ComponentNamingStrategy {

  String toComponentName(Class<?> type);
}
