package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * 하나의 키에 대해 두 개 이상의 락 보유자가 관찰되었을 때 발생하는 치명적 예외
 *
 * <p>올바른 구현에서는 절대 발생하지 않아야 하는 프로그래밍 오류입니다. 복구 대상이 아닙니다.
 */
public class LockInvariantViolationException extends ServerBaseException {

  public LockInvariantViolationException(String key) {
    super(CommonErrorCode.LOCK_INVARIANT_VIOLATION, key);
  }
}
