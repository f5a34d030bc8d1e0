package tiered.cache.util;

import java.io.InterruptedIOException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 인터럽트 플래그 복원
 *
 * <p>원본 로더가 던진 예외가 번역되면서 InterruptedException이 cause/suppressed 안으로 묻히면 호출 스레드의 인터럽트
 * 상태가 사라집니다. 번역 직전에 예외 그래프를 훑어 플래그를 되살립니다.
 */
public final class InterruptUtils {

  /** 순환 참조 대비 방문 상한 */
  private static final int MAX_VISITS = 32;

  private InterruptUtils() {}

  /** InterruptedException 또는 InterruptedIOException이 그래프에 있으면 현재 스레드를 다시 인터럽트합니다. */
  public static void restoreInterruptIfNeeded(Throwable t) {
    if (t != null && hasInterruptedNode(t)) {
      Thread.currentThread().interrupt();
    }
  }

  private static boolean hasInterruptedNode(Throwable root) {
    Deque<Throwable> pending = new ArrayDeque<>();
    pending.push(root);
    int visits = 0;
    while (!pending.isEmpty() && visits++ < MAX_VISITS) {
      Throwable node = pending.pop();
      if (node instanceof InterruptedException || node instanceof InterruptedIOException) {
        return true;
      }
      if (node.getCause() != null && node.getCause() != node) {
        pending.push(node.getCause());
      }
      for (Throwable suppressed : node.getSuppressed()) {
        pending.push(suppressed);
      }
    }
    return false;
  }
}
