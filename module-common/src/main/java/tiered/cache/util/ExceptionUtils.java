package tiered.cache.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** 비동기 래퍼 예외 처리 */
public final class ExceptionUtils {

  private ExceptionUtils() {}

  /**
   * {@link CompletionException} / {@link ExecutionException} 껍질을 벗겨 실제 원인을 반환합니다.
   *
   * <p>로더 풀에서 실행된 작업의 예외가 {@code Future#get}을 거치며 감싸지는 경우에 사용합니다. 원인이 없는 래퍼는 그대로 반환합니다.
   */
  public static Throwable unwrapAsyncException(Throwable throwable) {
    Throwable current = throwable;
    while (isAsyncWrapper(current) && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static boolean isAsyncWrapper(Throwable t) {
    return t instanceof CompletionException || t instanceof ExecutionException;
  }
}
