package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ClientBaseException;

/** null/빈 캐시 키, 잘못된 만료 스펙 등 호출자 입력 오류 */
public class InvalidCacheKeyException extends ClientBaseException {

  public InvalidCacheKeyException(String detail) {
    super(CommonErrorCode.INVALID_INPUT_VALUE, detail);
  }
}
