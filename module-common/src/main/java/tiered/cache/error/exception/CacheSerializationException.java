package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/** Shared 계층 직렬화/역직렬화 실패 예외 */
public class CacheSerializationException extends ServerBaseException {

  public CacheSerializationException(String detail, Throwable cause) {
    super(CommonErrorCode.CACHE_SERIALIZATION_FAILURE, cause, detail);
  }
}
