package tiered.cache.common.function;

/**
 * 예외를 던질 수 있는 Supplier
 *
 * <p>표준 {@link java.util.function.Supplier}와 달리 Checked Exception을 던질 수 있어 LogicExecutor에
 * 메서드 참조로 작업을 넘길 때 사용합니다.
 *
 * @param <T> 반환 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {

  /**
   * 결과를 계산하거나 예외를 던집니다.
   *
   * @return 계산 결과
   * @throws Throwable 작업 중 발생한 예외
   */
  T get() throws Throwable;
}
