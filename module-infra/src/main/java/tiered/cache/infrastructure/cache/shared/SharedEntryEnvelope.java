package tiered.cache.infrastructure.cache.shared;

import java.time.Duration;
import java.util.Set;
import tiered.cache.core.domain.model.CacheEntry;
import tiered.cache.core.domain.model.ExpirationKind;
import tiered.cache.core.domain.model.ExpirationSpec;

/**
 * Shared 계층에 JSON으로 저장되는 엔트리 봉투
 *
 * <p>값은 {@code payload}에 코덱이 만든 문자열로 들어가며, 만료 스펙/태그/negative 표식은 봉투 필드로 보존됩니다. 다른 인스턴스가
 * backfill할 때 원래 스펙을 그대로 복원하기 위함입니다.
 */
public record SharedEntryEnvelope(
    ExpirationKind kind, long ttlMillis, Set<String> tags, boolean negative, String payload) {

  static <V> SharedEntryEnvelope wrap(CacheEntry<V> entry, String payload) {
    ExpirationSpec spec = entry.expiration();
    return new SharedEntryEnvelope(
        spec.kind(), spec.duration().toMillis(), entry.tags(), entry.negative(), payload);
  }

  ExpirationSpec expiration() {
    return new ExpirationSpec(kind, Duration.ofMillis(ttlMillis));
  }

  boolean sliding() {
    return kind == ExpirationKind.SLIDING;
  }

  boolean hasTag(String tag) {
    return tags != null && tags.contains(tag);
  }
}
