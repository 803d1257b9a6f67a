package senatesim.speech;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds every call to a delegate generator with a timeout, so a stalled content source
 * cannot hold up the debate. Calls run on a single daemon worker.
 */
public class TimeoutSpeechGenerator implements SpeechGenerator, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TimeoutSpeechGenerator.class);

  private final SpeechGenerator delegate;
  private final Duration timeout;
  private final ExecutorService executor;

  public TimeoutSpeechGenerator(SpeechGenerator delegate, Duration timeout) {
    if (delegate == null) throw new IllegalArgumentException("delegate must not be null");
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
    this.delegate = delegate;
    this.timeout = timeout;
    this.executor = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "speech-generator");
      t.setDaemon(true);
      return t;
    });
  }

  public Duration timeout() { return timeout; }

  @Override
  public SpeechContent generate(SpeechRequest request) throws SpeechGenerationException {
    Future<SpeechContent> future = executor.submit(() -> delegate.generate(request));
    try {
      SpeechContent content = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (content == null || content.isBlank()) {
        throw new SpeechGenerationException("Empty speech for " + request.speaker().name());
      }
      return content;
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Speech generation timed out for {} after {} ms", request.speaker().name(), timeout.toMillis());
      throw new SpeechGenerationException("Speech generation timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof SpeechGenerationException sge) throw sge;
      throw new SpeechGenerationException("Speech generation failed: " + cause, cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new SpeechGenerationException("Interrupted while generating speech", e);
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
