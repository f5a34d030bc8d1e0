package tiered.cache.error.exception;

import lombok.Getter;
import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * 원본 로더 실패 예외 (LoadError)
 *
 * <p>로더가 던진 예외를 cause로 보존하여 호출자에게 전파합니다. 실패 결과는 어떤 계층에도 캐시되지 않으며, 오케스트레이터 내부에서 재시도하지
 * 않습니다.
 */
@Getter
public class OriginLoadException extends ServerBaseException {

  private final String key;

  public OriginLoadException(String key, Throwable cause) {
    super(CommonErrorCode.ORIGIN_LOAD_FAILURE, cause, key);
    this.key = key;
  }
}
