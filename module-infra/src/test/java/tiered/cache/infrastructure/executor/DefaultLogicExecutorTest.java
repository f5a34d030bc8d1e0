package tiered.cache.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import tiered.cache.error.exception.InternalSystemException;
import tiered.cache.error.exception.OriginLoadException;
import tiered.cache.error.exception.TierUnavailableException;
import tiered.cache.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Unit tests for {@link DefaultLogicExecutor}.
 *
 * <ul>
 *   <li>Exception translation and BaseException pass-through
 *   <li>Error propagation without translation
 *   <li>executeWithFinally() runs cleanup exactly once
 *   <li>logic.executor timer tags
 * </ul>
 */
@DisplayName("DefaultLogicExecutor Tests")
class DefaultLogicExecutorTest {

  private MeterRegistry meterRegistry;
  private LogicExecutor executor;

  private ListAppender<ILoggingEvent> logAppender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    executor = new DefaultLogicExecutor(ExceptionTranslator.defaultTranslator(), meterRegistry);

    logger = (Logger) LoggerFactory.getLogger(DefaultLogicExecutor.class);
    logAppender = new ListAppender<>();
    logAppender.start();
    logger.addAppender(logAppender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(logAppender);
    logAppender.stop();
  }

  @Test
  @DisplayName("execute() should return result and record a success timer")
  void execute_success() {
    // Given
    TaskContext context = TaskContext.of("Test", "Success", "k1");

    // When
    String result = executor.execute(() -> "ok", context);

    // Then
    assertThat(result).isEqualTo("ok");
    assertThat(
            meterRegistry
                .get("logic.executor")
                .tag("component", "Test")
                .tag("operation", "Success")
                .tag("result", "success")
                .timer()
                .count())
        .isEqualTo(1L);
  }

  @Test
  @DisplayName("execute() should wrap checked exceptions in InternalSystemException")
  void execute_translates_checked_exception() {
    // Given
    TaskContext context = TaskContext.of("Test", "Checked");
    IOException original = new IOException("disk");

    // When & Then
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw original;
                    },
                    context))
        .isInstanceOf(InternalSystemException.class)
        .hasCause(original);
  }

  @Test
  @DisplayName("Non-domain exceptions from a translator should be logged at ERROR")
  void non_domain_failure_logged_at_error() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new IOException("raw");
                    },
                    (e, context) -> new IllegalStateException(e),
                    TaskContext.of("Test", "Raw")))
        .isInstanceOf(IllegalStateException.class);
    assertThat(logAppender.list)
        .singleElement()
        .satisfies(event -> assertThat(event.getLevel()).isEqualTo(Level.ERROR));
  }

  @Test
  @DisplayName("execute() should pass domain exceptions through and log them at WARN")
  void execute_passes_domain_exception_through() {
    // Given
    TierUnavailableException domain = new TierUnavailableException("shared", new IOException());

    // When & Then
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw domain;
                    },
                    TaskContext.of("Test", "Domain")))
        .isSameAs(domain);
    assertThat(logAppender.list)
        .singleElement()
        .satisfies(event -> assertThat(event.getLevel()).isEqualTo(Level.WARN));
  }

  @Test
  @DisplayName("execute() should unwrap CompletionException before translating")
  void execute_unwraps_async_exception() {
    TierUnavailableException domain = new TierUnavailableException("shared", new IOException());

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new CompletionException(domain);
                    },
                    TaskContext.of("Test", "Async")))
        .isSameAs(domain);
  }

  @Test
  @DisplayName("Errors should propagate without translation")
  void error_propagates() {
    StackOverflowError error = new StackOverflowError("deep");

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw error;
                    },
                    TaskContext.of("Test", "Error")))
        .isSameAs(error);
  }

  @Test
  @DisplayName("executeOrDefault() should return the default on failure")
  void execute_or_default() {
    Integer result =
        executor.executeOrDefault(
            () -> {
              throw new IOException("fail");
            },
            -1,
            TaskContext.of("Test", "Default"));

    assertThat(result).isEqualTo(-1);
    assertThat(logAppender.list)
        .singleElement()
        .satisfies(event -> assertThat(event.getFormattedMessage()).contains("[Task:RECOVER]"));
  }

  @Test
  @DisplayName("executeOrCatch() should hand the translated exception to recovery")
  void execute_or_catch_receives_translated_exception() {
    String result =
        executor.executeOrCatch(
            () -> {
              throw new IOException("fail");
            },
            e -> e.getClass().getSimpleName(),
            TaskContext.of("Test", "Catch"));

    assertThat(result).isEqualTo("InternalSystemException");
  }

  @Test
  @DisplayName("executeWithFinally() should run cleanup exactly once on success and failure")
  void execute_with_finally_runs_cleanup_once() {
    AtomicInteger cleanups = new AtomicInteger();

    executor.executeWithFinally(() -> "ok", cleanups::incrementAndGet, TaskContext.of("T", "F"));
    assertThatThrownBy(
            () ->
                executor.executeWithFinally(
                    () -> {
                      throw new IOException("fail");
                    },
                    cleanups::incrementAndGet,
                    TaskContext.of("T", "F")))
        .isInstanceOf(InternalSystemException.class);

    assertThat(cleanups).hasValue(2);
  }

  @Test
  @DisplayName("executeWithFinally() should attach cleanup failure as suppressed")
  void cleanup_failure_is_suppressed() {
    IllegalStateException cleanupFailure = new IllegalStateException("cleanup");

    assertThatThrownBy(
            () ->
                executor.executeWithFinally(
                    () -> {
                      throw new IOException("primary");
                    },
                    () -> {
                      throw cleanupFailure;
                    },
                    TaskContext.of("T", "Suppressed")))
        .isInstanceOf(InternalSystemException.class)
        .satisfies(e -> assertThat(e.getSuppressed()).containsExactly(cleanupFailure));
  }

  @Test
  @DisplayName("executeWithTranslation() should use the custom translator")
  void execute_with_translation() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new IOException("origin");
                    },
                    ExceptionTranslator.forOriginLoad("user:1"),
                    TaskContext.of("Cache", "Load", "user:1")))
        .isInstanceOf(OriginLoadException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @DisplayName("executeVoid() should run the task")
  void execute_void() {
    AtomicInteger runs = new AtomicInteger();

    executor.executeVoid(runs::incrementAndGet, TaskContext.of("Test", "Void"));

    assertThat(runs).hasValue(1);
  }
}
