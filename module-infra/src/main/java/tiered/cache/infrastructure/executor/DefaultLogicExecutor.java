package tiered.cache.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import tiered.cache.common.function.ThrowingRunnable;
import tiered.cache.common.function.ThrowingSupplier;
import tiered.cache.error.exception.base.BaseException;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li><b>Error 즉시 rethrow</b>: VirtualMachineError 등은 번역 없이 전파
 *   <li><b>BaseException pass-through</b>: 이미 도메인 예외이면 그대로 전파
 *   <li><b>메트릭</b>: {@code logic.executor} Timer (component / operation / result 태그)
 *   <li><b>로그</b>: 도메인 예외는 WARN, 그 외 예외는 ERROR (stacktrace 포함)
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private static final String METRIC_NAME = "logic.executor";
  private static final String UNEXPECTED_TRANSLATOR_FAILURE =
      "Translator failed with unexpected Throwable";

  private final ExceptionTranslator translator;
  private final MeterRegistry meterRegistry;

  public DefaultLogicExecutor(ExceptionTranslator translator, MeterRegistry meterRegistry) {
    this.translator = Objects.requireNonNull(translator, "translator");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    try {
      return executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(translator, t, context);
      logFailure(primary, context);
      throw primary;
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translateSafe(translator, t, context);
      log.warn(
          "[Task:RECOVER] {}, errorType={}, message={}",
          context.toTaskName(),
          translated.getClass().getSimpleName(),
          translated.getMessage());
      return recovery.apply(translated);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    Objects.requireNonNull(context, "context");

    final AtomicBoolean ran = new AtomicBoolean(false);
    Runnable onceFinally =
        () -> {
          if (ran.compareAndSet(false, true)) {
            finallyBlock.run();
          }
        };

    T result;
    try {
      result = executeRaw(task, context);
    } catch (Error e) {
      runCleanupSuppressing(e, onceFinally);
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(translator, t, context);
      runCleanupSuppressing(primary, onceFinally);
      logFailure(primary, context);
      throw primary;
    }
    onceFinally.run();
    return result;
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(customTranslator, "customTranslator");
    Objects.requireNonNull(context, "context");

    try {
      return executeRaw(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException primary = translateSafe(customTranslator, t, context);
      logFailure(primary, context);
      throw primary;
    }
  }

  /** 작업 실행 + Timer 기록 (예외는 그대로 전파) */
  private <T> T executeRaw(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    long start = System.nanoTime();
    String result = "success";
    try {
      return task.get();
    } catch (Throwable t) {
      result = "failure";
      throw t;
    } finally {
      record(context, result, System.nanoTime() - start);
    }
  }

  private void record(TaskContext context, String result, long elapsedNanos) {
    Timer.builder(METRIC_NAME)
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("result", result)
        .register(meterRegistry)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);
  }

  /**
   * translator를 안전하게 호출한다.
   *
   * <p>translator가 RuntimeException으로 실패하면 그 예외 자체를 primary로 삼고, 계약 위반(checked Throwable)은
   * IllegalStateException으로 감싼다. Error는 전파한다.
   */
  private static RuntimeException translateSafe(
      ExceptionTranslator customTranslator, Throwable t, TaskContext context) {
    try {
      return customTranslator.translate(t, context);
    } catch (RuntimeException ex) {
      return ex;
    } catch (Error e) {
      throw e;
    } catch (Throwable unexpected) {
      return new IllegalStateException(UNEXPECTED_TRANSLATOR_FAILURE, unexpected);
    }
  }

  private static void logFailure(RuntimeException error, TaskContext context) {
    if (error instanceof BaseException) {
      log.warn(
          "[Task:FAILURE] {}, errorType={}, message={}",
          context.toTaskName(),
          error.getClass().getSimpleName(),
          error.getMessage());
      return;
    }
    log.error(
        "[Task:FAILURE] {}, errorType={}",
        context.toTaskName(),
        error.getClass().getSimpleName(),
        error);
  }

  /** 정리 작업을 1회만 실행하고, 정리 중 예외가 나와도 primary를 덮지 않고 suppressed로만 합류시킨다. */
  private static void runCleanupSuppressing(Throwable primary, Runnable onceFinally) {
    try {
      onceFinally.run();
    } catch (RuntimeException cleanupEx) {
      if (primary != cleanupEx) {
        primary.addSuppressed(cleanupEx);
      }
    }
  }
}
