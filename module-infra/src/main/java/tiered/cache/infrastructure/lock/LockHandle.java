package tiered.cache.infrastructure.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 획득한 키 락의 해제 핸들
 *
 * <p>{@link #close()}는 멱등입니다. 두 번째 호출부터는 아무 일도 하지 않습니다. 획득한 스레드에서 해제해야 합니다.
 */
public final class LockHandle implements AutoCloseable {

  private final String key;
  private final Runnable releaser;
  private final AtomicBoolean released = new AtomicBoolean(false);

  LockHandle(String key, Runnable releaser) {
    this.key = key;
    this.releaser = releaser;
  }

  public String key() {
    return key;
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      releaser.run();
    }
  }
}
