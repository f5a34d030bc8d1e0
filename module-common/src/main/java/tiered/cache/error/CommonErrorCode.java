package tiered.cache.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),

  // === Cache Errors (5xx) ===
  TIER_UNAVAILABLE("S101", "캐시 계층 사용 불가 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  ORIGIN_LOAD_FAILURE("S102", "원본 데이터 로드 실패 (key: %s)", HttpStatus.BAD_GATEWAY),
  LOCK_TIMEOUT("S103", "락 대기 시간 초과 (key: %s, wait: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  LOCK_INVARIANT_VIOLATION(
      "S104", "락 불변식 위반: 동시 보유자 감지 (key: %s)", HttpStatus.INTERNAL_SERVER_ERROR),
  LOCK_ACQUISITION_FAILURE("S105", "락 획득 중 오류 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_SERIALIZATION_FAILURE("S106", "캐시 직렬화 실패 (%s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
