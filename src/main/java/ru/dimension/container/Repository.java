package ru.dimension.container;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the factories of one container, indexed by component name and by produced type.
 * Pure lookup; nothing here builds components.
 *
 * <p>Written during registration only and read concurrently afterwards.
 */
public final class Repository {

  /**
   * A factory together with the name it is registered under.
   */
  public record Entry(String name, ComponentFactory<?> factory) {}

  private final Map<String, ComponentFactory<?>> factoriesByName = new ConcurrentHashMap<>();
  private final Map<Class<?>, List<String>> namesByType = new ConcurrentHashMap<>();
  // registration order
  private final List<Entry> entries = new CopyOnWriteArrayList<>();

  /**
   * @throws NameConflictException if {@code name} is already bound
   */
  public synchronized void register(String name, ComponentFactory<?> factory) {
    String n = ComponentKey.requireName(name);
    if (factory == null) {
      throw new InvalidArgumentException("Factory for component '" + n + "' must be non-null");
    }
    if (factoriesByName.putIfAbsent(n, factory) != null) {
      throw new NameConflictException(n);
    }
    namesByType.computeIfAbsent(factory.componentType(), k -> new CopyOnWriteArrayList<>()).add(n);
    entries.add(new Entry(n, factory));
  }

  public Optional<ComponentFactory<?>> findByName(String name) {
    String n = ComponentKey.normalizeName(name);
    return n == null ? Optional.empty() : Optional.ofNullable(factoriesByName.get(n));
  }

  /**
   * Every factory whose component can be used as {@code type}, in registration order.
   */
  public List<Entry> findByType(Class<?> type) {
    if (type == null) {
      throw new InvalidArgumentException("Component type must be non-null");
    }
    List<Entry> out = new ArrayList<>();
    for (Entry e : entries) {
      if (e.factory().isTypeOf(type)) {
        out.add(e);
      }
    }
    return out;
  }

  /**
   * The single factory for {@code type}. When several match, the one registered with
   * exactly {@code type} wins if it is the only such factory.
   *
   * @throws UnknownComponentException if nothing matches
   * @throws AmbiguousComponentException if no single factory can be chosen
   */
  public Entry findUnique(Class<?> type) {
    List<Entry> matches = findByType(type);
    if (matches.isEmpty()) {
      throw new UnknownComponentException("Unknown component type: " + type.getName());
    }
    if (matches.size() == 1) {
      return matches.get(0);
    }

    List<String> exact = namesByType.getOrDefault(type, List.of());
    if (exact.size() == 1) {
      String name = exact.get(0);
      return new Entry(name, factoriesByName.get(name));
    }

    throw new AmbiguousComponentException(type, matches.stream().map(Entry::name).toList());
  }

  public boolean exists(String name) {
    String n = ComponentKey.normalizeName(name);
    return n != null && factoriesByName.containsKey(n);
  }

  public boolean exists(Class<?> type) {
    if (type == null) return false;
    for (Entry e : entries) {
      if (e.factory().isTypeOf(type)) return true;
    }
    return false;
  }

  public List<Entry> entries() {
    return List.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }
}
