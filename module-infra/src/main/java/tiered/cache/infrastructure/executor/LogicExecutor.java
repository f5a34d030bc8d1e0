package tiered.cache.infrastructure.executor;

import java.util.function.Function;
import tiered.cache.common.function.ThrowingRunnable;
import tiered.cache.common.function.ThrowingSupplier;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 패턴을 추상화한 실행기
 *
 * <p>코드 평탄화(Code Flattening)를 위해 설계되었습니다. 비즈니스 로직은 별도 메서드로 분리하고 메서드 참조({@code
 * this::method})를 활용하세요.
 *
 * <h3>지원 패턴</h3>
 *
 * <ol>
 *   <li><b>try-catch-throw</b> (예외 변환 후 재전파) - {@link #execute}
 *   <li><b>try-catch-return</b> (기본값 반환) - {@link #executeOrDefault}
 *   <li><b>try-catch-recover</b> (복구 로직 실행) - {@link #executeOrCatch}
 *   <li><b>try-finally</b> (리소스 정리) - {@link #executeWithFinally}
 *   <li><b>다중 catch</b> (ExceptionTranslator 사용) - {@link #executeWithTranslation}
 * </ol>
 *
 * <h3>사용 예시</h3>
 *
 * <pre>{@code
 * Optional<CacheEntry<V>> hit =
 *     executor.executeOrDefault(
 *         () -> shared.get(key), Optional.empty(), TaskContext.of("Cache", "GetShared", key));
 * }</pre>
 *
 * @see ExceptionTranslator
 */
public interface LogicExecutor {

  /**
   * 예외를 RuntimeException으로 변환하여 전파
   *
   * @param task 실행할 작업
   * @param context 작업 컨텍스트 (로깅/메트릭용)
   * @return 작업 결과
   */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /**
   * 예외 발생 시 기본값 반환
   *
   * @param task 실행할 작업
   * @param defaultValue 예외 발생 시 반환할 기본값
   * @param context 작업 컨텍스트
   * @return 작업 결과 또는 기본값
   */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /**
   * 예외 발생 시 복구 로직 실행
   *
   * <p>recovery는 번역된 예외를 전달받습니다.
   */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  /** void 작업 실행 */
  void executeVoid(ThrowingRunnable task, TaskContext context);

  /**
   * finally 블록을 명시적으로 지정
   *
   * <p>finallyBlock은 성공/실패와 무관하게 정확히 1회 실행됩니다. finallyBlock의 예외는 원래 예외를 덮지 않고 suppressed로
   * 합류합니다.
   */
  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 커스텀 ExceptionTranslator로 예외 변환 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
