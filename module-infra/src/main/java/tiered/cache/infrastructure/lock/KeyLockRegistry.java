package tiered.cache.infrastructure.lock;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.core.domain.model.CacheKeys;
import tiered.cache.error.exception.LockAcquisitionException;
import tiered.cache.error.exception.LockInvariantViolationException;
import tiered.cache.error.exception.LockTimeoutException;

/**
 * 키 단위 상호배제 락 레지스트리
 *
 * <h3>특징</h3>
 *
 * <ul>
 *   <li>키마다 독립된 fair {@link ReentrantLock} (FIFO 대기, spin 없음)
 *   <li>서로 다른 키는 서로를 막지 않음 (stripe 공유 없음)
 *   <li>참조 카운트가 0이 되면 엔트리 제거 (무한 증가 방지)
 * </ul>
 *
 * <h3>Reclamation 규칙</h3>
 *
 * <p>참조 카운트 증감과 엔트리 제거는 해당 키의 {@code compute}/{@code computeIfPresent} 안에서만 일어납니다. 따라서 신규
 * 진입자는 기존 락에 합류하거나 새 락을 만들 뿐, 두 락이 같은 키에 동시에 존재할 수 없습니다.
 *
 * <h3>메트릭</h3>
 *
 * <ul>
 *   <li>{@code cache.lock.wait} (Timer): 락 대기 시간
 *   <li>{@code cache.lock.timeout} (Counter): 대기 시간 초과
 *   <li>{@code cache.lock.active} (Gauge): 살아 있는 락 엔트리 수
 * </ul>
 */
@Slf4j
public class KeyLockRegistry {

  private final ConcurrentHashMap<String, KeyLock> locks = new ConcurrentHashMap<>();
  private final AtomicLong invariantViolations = new AtomicLong();

  private final Timer waitTimer;
  private final Counter timeoutCounter;
  private final Counter violationCounter;

  public KeyLockRegistry(MeterRegistry meterRegistry, String cacheName) {
    Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.waitTimer =
        Timer.builder("cache.lock.wait").tag("cache", cacheName).register(meterRegistry);
    this.timeoutCounter =
        Counter.builder("cache.lock.timeout").tag("cache", cacheName).register(meterRegistry);
    this.violationCounter =
        Counter.builder("cache.lock.violation").tag("cache", cacheName).register(meterRegistry);
    Gauge.builder("cache.lock.active", locks, ConcurrentHashMap::size)
        .tag("cache", cacheName)
        .register(meterRegistry);
  }

  /**
   * 키 락 획득 (최대 timeout 대기)
   *
   * @return 해제용 핸들 (try-with-resources 가능)
   * @throws LockTimeoutException timeout 내 획득 실패
   * @throws LockAcquisitionException 대기 중 인터럽트 (인터럽트 플래그 복원)
   */
  public LockHandle acquire(String key, Duration timeout) {
    CacheKeys.requireValid(key);
    Objects.requireNonNull(timeout, "timeout");

    KeyLock lock = retain(key);
    long start = System.nanoTime();
    boolean acquired;
    try {
      acquired = lock.mutex.tryLock(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      dropReference(key, lock);
      Thread.currentThread().interrupt();
      throw new LockAcquisitionException(key, e);
    } finally {
      waitTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
    }

    if (!acquired) {
      dropReference(key, lock);
      timeoutCounter.increment();
      throw new LockTimeoutException(key, timeout);
    }

    enterCriticalSection(key, lock);
    return new LockHandle(key, () -> exitCriticalSection(key, lock));
  }

  /** 핸들 해제 (멱등) */
  public void release(LockHandle handle) {
    handle.close();
  }

  /** 살아 있는 락 엔트리 수 */
  public int size() {
    return locks.size();
  }

  /** 키 락을 기다리며 큐에 들어간 스레드 수 추정치 (엔트리가 없으면 0) */
  public int queuedWaiters(String key) {
    KeyLock lock = locks.get(key);
    return lock == null ? 0 : lock.mutex.getQueueLength();
  }

  /** 관측된 상호배제 위반 횟수 (정상이면 항상 0) */
  public long invariantViolations() {
    return invariantViolations.get();
  }

  private KeyLock retain(String key) {
    return locks.compute(
        key,
        (k, existing) -> {
          KeyLock lock = existing != null ? existing : new KeyLock();
          lock.references++;
          return lock;
        });
  }

  private void dropReference(String key, KeyLock lock) {
    locks.computeIfPresent(
        key,
        (k, current) -> {
          if (current != lock) {
            return current;
          }
          current.references--;
          return current.references == 0 ? null : current;
        });
  }

  private void enterCriticalSection(String key, KeyLock lock) {
    int holders = lock.holders.incrementAndGet();
    if (holders == 1) {
      return;
    }
    lock.holders.decrementAndGet();
    lock.mutex.unlock();
    dropReference(key, lock);
    invariantViolations.incrementAndGet();
    violationCounter.increment();
    log.error("[KeyLock] Mutual exclusion violated: key={}, holders={}", key, holders);
    throw new LockInvariantViolationException(key);
  }

  private void exitCriticalSection(String key, KeyLock lock) {
    lock.holders.decrementAndGet();
    try {
      lock.mutex.unlock();
    } finally {
      dropReference(key, lock);
    }
  }

  /** 키 하나의 락 상태. references는 map compute 안에서만 변경된다. */
  private static final class KeyLock {
    private final ReentrantLock mutex = new ReentrantLock(true);
    private final AtomicInteger holders = new AtomicInteger();
    private int references;
  }
}
