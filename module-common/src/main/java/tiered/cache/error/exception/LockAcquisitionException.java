package tiered.cache.error.exception;

import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/** 키 락 대기 중 인터럽트 등으로 획득 자체가 중단된 경우 */
public class LockAcquisitionException extends ServerBaseException {

  public LockAcquisitionException(String key, Throwable cause) {
    super(CommonErrorCode.LOCK_ACQUISITION_FAILURE, cause, "락 획득 중 인터럽트: " + key);
  }
}
