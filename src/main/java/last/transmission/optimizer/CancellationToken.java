package last.transmission.optimizer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for a sequence run. Another thread calls {@link #cancel()}; the optimizer
 * checks the flag between stages, between sigma-clipping iterations and before each cost
 * evaluation, and stops by throwing {@link OptimizationCancelledException}.
 */
public class CancellationToken {

  /**
   * Token that is never cancelled, used when the caller does not supply one
   */
  public static final CancellationToken NONE = new CancellationToken() {
    @Override
    public void cancel() {
      throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
    }
  };

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Throw if cancellation has been requested
   *
   * @param where Short description of the current point of execution, used in the message
   * @throws OptimizationCancelledException If {@link #cancel()} has been called
   */
  public void checkCancelled(String where) {
    if (cancelled.get()) {
      throw new OptimizationCancelledException("Optimization cancelled " + where);
    }
  }

}
