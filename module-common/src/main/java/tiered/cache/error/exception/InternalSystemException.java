package tiered.cache.error.exception;

import lombok.Getter;
import tiered.cache.error.CommonErrorCode;
import tiered.cache.error.exception.base.ServerBaseException;

/**
 * 관리되지 않은 예외를 프로젝트 규격으로 감싸는 서버 예외
 *
 * <p>LogicExecutor가 BaseException 계층이 아닌 예외를 만났을 때 사용합니다. 원본 예외는 cause로 보존됩니다.
 */
@Getter
public class InternalSystemException extends ServerBaseException {

  private final String taskName;

  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause);
    this.taskName = taskName;
  }
}
