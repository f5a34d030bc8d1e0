package tiered.cache.error.exception.base;

import tiered.cache.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 입력이 계약과 다를 때 발생하는 4xx 계열 예외. 호출자에게 구체적인 실패 원인을 전달하는 것이
 * 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
