package com.gentoro.onepivot.engine;

import com.gentoro.onepivot.exception.PivotCancelledException;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation signal checked by the engine at every hierarchy level and before each
 * cell computation.
 *
 * <p>A token is cancelled either explicitly through {@link #cancel()} or when its optional
 * external checker reports cancellation (for example a job's cancel flag or thread interruption).
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(() -> false);

  private final BooleanSupplier externalChecker;
  private volatile boolean cancelled;

  public CancellationToken() {
    this(null);
  }

  private CancellationToken(BooleanSupplier externalChecker) {
    this.externalChecker = externalChecker;
  }

  /** Token that is never cancelled. */
  public static CancellationToken none() {
    return NONE;
  }

  /** Token that reports cancellation whenever {@code checker} does. */
  public static CancellationToken from(BooleanSupplier checker) {
    return new CancellationToken(checker);
  }

  public void cancel() {
    if (this == NONE) {
      throw new IllegalStateException("The shared no-op token cannot be cancelled");
    }
    cancelled = true;
  }

  public boolean isCancellationRequested() {
    return cancelled || (externalChecker != null && externalChecker.getAsBoolean());
  }

  /**
   * @param stage short description of where the engine is, included in the failure message
   * @throws PivotCancelledException when cancellation was requested
   */
  public void throwIfCancellationRequested(String stage) {
    if (isCancellationRequested()) {
      throw new PivotCancelledException("Pivot computation cancelled during " + stage);
    }
  }
}
