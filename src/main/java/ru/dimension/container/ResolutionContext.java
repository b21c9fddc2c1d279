package ru.dimension.container;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of component names under construction in one resolution call tree.
 * Confined to a single thread; not safe for concurrent use.
 */
public final class ResolutionContext {

  private final List<String> inProgress = new ArrayList<>();

  /**
   * @throws CyclicDependencyException if {@code name} is already under construction
   */
  public void push(String name) {
    int first = inProgress.indexOf(name);
    if (first >= 0) {
      List<String> cycle = new ArrayList<>(inProgress.subList(first, inProgress.size()));
      cycle.add(name);
      throw new CyclicDependencyException(cycle);
    }
    inProgress.add(name);
  }

  /**
   * @throws InvalidStateException if {@code name} is not on top of the stack
   */
  public void pop(String name) {
    if (inProgress.isEmpty()) {
      throw new InvalidStateException("Cannot pop '" + name + "': resolution stack is empty");
    }
    String top = inProgress.get(inProgress.size() - 1);
    if (!top.equals(name)) {
      throw new InvalidStateException(
          "Cannot pop '" + name + "': top of resolution stack is '" + top + "' " + inProgress);
    }
    inProgress.remove(inProgress.size() - 1);
  }

  /**
   * Pushes {@code name} and returns a guard popping it on close.
   */
  public Guard guard(String name) {
    push(name);
    return new Guard(this, name);
  }

  public List<String> path() {
    return List.copyOf(inProgress);
  }

  public int depth() {
    return inProgress.size();
  }

  public boolean isEmpty() {
    return inProgress.isEmpty();
  }

  @Override
  public String toString() {
    return "ResolutionContext" + inProgress;
  }

  public static final class Guard implements AutoCloseable {
    private final ResolutionContext context;
    private final String name;

    private Guard(ResolutionContext context, String name) {
      this.context = context;
      this.name = name;
    }

    @Override
    public void close() {
      context.pop(name);
    }
  }
}
