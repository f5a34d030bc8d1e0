package tiered.cache.core.domain.model;

import tiered.cache.error.exception.InvalidCacheKeyException;

/**
 * 캐시 키/태그 검증
 *
 * <p>캐시 키는 불투명 문자열이며 정확한 문자열 동등성으로 비교합니다. trim, 대소문자 변환 등 어떤 정규화도 하지 않습니다.
 */
public final class CacheKeys {

  private CacheKeys() {}

  public static String requireValid(String key) {
    if (key == null || key.isEmpty()) {
      throw new InvalidCacheKeyException("cache key must not be empty");
    }
    return key;
  }

  public static String requireValidTag(String tag) {
    if (tag == null || tag.isEmpty()) {
      throw new InvalidCacheKeyException("cache tag must not be empty");
    }
    return tag;
  }
}
