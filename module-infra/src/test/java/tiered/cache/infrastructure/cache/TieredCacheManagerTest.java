package tiered.cache.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tiered.cache.core.domain.model.ExpirationSpec;
import tiered.cache.error.exception.InvalidCacheKeyException;
import tiered.cache.support.TestLogicExecutors;

class TieredCacheManagerTest {

  private TieredCacheManager manager;

  @BeforeEach
  void setUp() {
    manager =
        TieredCacheManager.builder()
            .executor(TestLogicExecutors.passThrough())
            .meterRegistry(new SimpleMeterRegistry())
            .build();
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  @Test
  @DisplayName("같은 이름은 같은 인스턴스를 반환")
  void same_name_returns_same_cache() {
    TieredCache<String> first = manager.getCache("users", String.class);
    TieredCache<String> second = manager.getCache("users", String.class);

    assertThat(first).isSameAs(second);
    assertThat(manager.getCacheNames()).containsExactly("users");
  }

  @Test
  @DisplayName("캐시마다 독립된 L1과 락 레지스트리")
  void caches_are_isolated() {
    TieredCache<String> users = manager.getCache("users", String.class);
    TieredCache<String> teams = manager.getCache("teams", String.class);
    ExpirationSpec spec = ExpirationSpec.absolute(Duration.ofMinutes(1));

    users.put("id:1", "alice", spec, Set.of());

    assertThat(teams.getLocalStore().get("id:1")).isEmpty();
    assertThat(users.getLockRegistry()).isNotSameAs(teams.getLockRegistry());
    assertThat(manager.getLocalStore("users")).isSameAs(users.getLocalStore());
    assertThat(manager.getLocalStore("unknown")).isNull();
  }

  @Test
  @DisplayName("같은 이름을 다른 값 타입으로 요청하면 거부")
  void rejects_type_mismatch() {
    manager.getCache("users", String.class);

    assertThatThrownBy(() -> manager.getCache("users", Integer.class))
        .isInstanceOf(InvalidCacheKeyException.class);
  }

  @Test
  @DisplayName("제네릭 타입 캐시는 TypeReference로 구분")
  void generic_types_are_distinguished() {
    TieredCache<List<String>> names =
        manager.getCache("names", new TypeReference<List<String>>() {});

    assertThat(manager.getCache("names", new TypeReference<List<String>>() {})).isSameAs(names);
    assertThatThrownBy(() -> manager.getCache("names", new TypeReference<List<Integer>>() {}))
        .isInstanceOf(InvalidCacheKeyException.class);
  }

  @Test
  @DisplayName("빈 캐시 이름 거부")
  void rejects_blank_name() {
    assertThatThrownBy(() -> manager.getCache(" ", String.class))
        .isInstanceOf(InvalidCacheKeyException.class);
  }

  @Test
  @DisplayName("instanceId 미지정 시 자동 생성")
  void generates_instance_id() {
    assertThat(manager.getInstanceId()).isNotBlank();
  }
}
