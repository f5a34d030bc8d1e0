package tiered.cache.common.function;

/**
 * 예외를 던질 수 있는 void 작업을 표현하는 함수형 인터페이스
 *
 * <p>표준 {@link Runnable}과 달리 Checked Exception을 던질 수 있습니다.
 *
 * @see ThrowingSupplier
 */
@FunctionalInterface
public interface ThrowingRunnable {

  /**
   * 작업을 실행합니다.
   *
   * @throws Throwable 작업 실행 중 발생한 예외
   */
  void run() throws Throwable;
}
