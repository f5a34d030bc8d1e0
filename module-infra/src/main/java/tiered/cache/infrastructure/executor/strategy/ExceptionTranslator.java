package tiered.cache.infrastructure.executor.strategy;

import tiered.cache.error.exception.InternalSystemException;
import tiered.cache.error.exception.OriginLoadException;
import tiered.cache.error.exception.TierUnavailableException;
import tiered.cache.error.exception.base.BaseException;
import tiered.cache.infrastructure.executor.TaskContext;
import tiered.cache.util.ExceptionUtils;
import tiered.cache.util.InterruptUtils;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow (VirtualMachineError 등)
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>이미 도메인 예외(BaseException)이면 그대로 반환
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /**
   * 기본 예외 변환기
   *
   * <p>CompletionException/ExecutionException unwrap 후 BaseException 감지
   */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /**
   * 원본 로더 예외 변환기
   *
   * <p>로더가 던진 예외는 종류와 무관하게 {@link OriginLoadException}으로 감쌉니다. 로더가 도메인 예외를 던져도 pass-through
   * 하지 않습니다 (호출자는 항상 LoadError를 관측).
   */
  static ExceptionTranslator forOriginLoad(String key) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof OriginLoadException ole) {
        return ole;
      }
      InterruptUtils.restoreInterruptIfNeeded(unwrapped);
      return new OriginLoadException(key, unwrapped);
    };
  }

  /** 계층 저장소 예외 변환기 (연결/타임아웃 등 → TierUnavailableException) */
  static ExceptionTranslator forTier(String tierName) {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new TierUnavailableException(tierName, unwrapped));
  }
}
