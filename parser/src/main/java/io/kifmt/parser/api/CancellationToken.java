package io.kifmt.parser.api;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation for reads and writes.
 *
 * <p>The token is polled at I/O boundaries only: before a file is opened, between read chunks, and
 * before writing and flushing. A cancelled operation fails with a {@link KiCadFileException}
 * carrying the {@link KiCadFileException#CANCELLED} code.
 *
 * <pre>{@code
 * AtomicBoolean stop = new AtomicBoolean();
 * Board board = KiCadFormat.board().read(path, CancellationToken.of(stop::get));
 * }</pre>
 */
@FunctionalInterface
public interface CancellationToken {
  CancellationToken NONE = () -> false;

  boolean isCancelled();

  /** @return a token that is never cancelled */
  static CancellationToken none() {
    return NONE;
  }

  /**
   * Adapts a condition into a token.
   *
   * @param condition returns {@code true} once the operation should stop
   * @return a new token
   */
  static CancellationToken of(BooleanSupplier condition) {
    Objects.requireNonNull(condition, "condition");
    return condition::getAsBoolean;
  }

  /**
   * Fails if cancellation was requested.
   *
   * @param source the path or stream being processed, for the error context
   * @throws KiCadFileException with code {@link KiCadFileException#CANCELLED}
   */
  default void throwIfCancelled(String source) throws KiCadFileException {
    if (isCancelled()) {
      throw KiCadFileException.cancelled(source);
    }
  }
}
