package ai.eloquent.minotaur.util;

/**
 * An unchecked variant of {@link java.lang.InterruptedException}, thrown when a harness thread
 * is interrupted at a suspension point (a sleep, a poll, a join).
 * Whoever throws this is expected to have re-asserted the thread's interrupt flag.
 */
public class RuntimeInterruptedException extends RuntimeException {

  /**
   * Create a {@link RuntimeInterruptedException} that wraps around the original InterruptedException
   * @param e the original InterruptedException
   */
  public RuntimeInterruptedException(InterruptedException e) {
    super(e);
  }


  /**
   * Create a {@link RuntimeInterruptedException} describing what we were waiting on when interrupted.
   *
   * @param message What the thread was doing.
   * @param e the original InterruptedException
   */
  public RuntimeInterruptedException(String message, InterruptedException e) {
    super(message, e);
  }
}
