package ru.dimension.container;

import java.util.List;
import java.util.function.Function;

/**
 * Hands out resolution contexts for one container.
 *
 * <p>A top-level lookup gets a fresh {@link ResolutionContext}; a lookup issued on the same
 * thread while that one is still running (a constructor calling back into the container)
 * joins it, so self-lookups are reported as cycles. The context is dropped once the
 * top-level lookup returns.
 *
 * <p>Each thread has its own context. A cycle that spans threads, such as one thread
 * waiting on a singleton another thread is building, is not detected.
 */
final class CycleDetector {

  private final ThreadLocal<ResolutionContext> active = new ThreadLocal<>();

  <T> T resolve(Function<ResolutionContext, T> resolution) {
    ResolutionContext current = active.get();
    if (current != null) {
      return resolution.apply(current);
    }

    ResolutionContext context = new ResolutionContext();
    active.set(context);
    try {
      return resolution.apply(context);
    } finally {
      active.remove();
    }
  }

  /**
   * Names under construction on the calling thread; empty outside of a lookup.
   */
  List<String> currentPath() {
    ResolutionContext current = active.get();
    return current == null ? List.of() : current.path();
  }
}
