/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import static org.assertj.core.api.Assertions.assertThat;

import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import io.opentelemetry.sdk.testing.time.TestClock;
import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BackoffUploaderTest {

  private static final Logger logger = Logger.getLogger(BackoffUploaderTest.class.getName());

  private final TestClock clock = TestClock.create();
  private final ScriptedTransport transport = new ScriptedTransport();
  private final RecordingSleeper sleeper = new RecordingSleeper(clock);
  private final UploadPayload payload = TestPayloads.payload();

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private BackoffUploader uploader(RetryPolicy policy, BackoffStrategy backoff) {
    return new BackoffUploader(
        transport,
        policy,
        backoff,
        HttpStatusFailureClassifier.getInstance(),
        sleeper,
        clock,
        logger);
  }

  private BackoffUploader uploader(int maxAttempts) {
    RetryPolicy policy =
        RetryPolicy.builder().setMaxAttempts(maxAttempts).setJitter(0.0).build();
    return uploader(policy, ExponentialBackoff.create(policy));
  }

  @Test
  void succeedsAfterTwoServiceUnavailable() {
    transport.respond(503).respond(503).respond(200);

    UploadResult result = uploader(3).upload(payload);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getAttempts()).isEqualTo(3);
    assertThat(transport.calls).isEqualTo(3);
    assertThat(sleeper.delays).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
  }

  @Test
  void badRequestIsFatalAfterOneAttempt() {
    transport.respond(400).respond(200);

    UploadResult result = uploader(3).upload(payload);

    assertThat(result.isSuccess()).isFalse();
    UploadError error = result.getError();
    assertThat(error).isNotNull();
    assertThat(error.isFatal()).isTrue();
    assertThat(error.getStatusCode()).isEqualTo(400);
    assertThat(error.getAttempts()).isEqualTo(1);
    assertThat(transport.calls).isEqualTo(1);
    assertThat(sleeper.delays).isEmpty();
  }

  @Test
  void retryableFailuresStopAtMaxAttempts() {
    transport.respond(503).respond(502).respond(500).respond(200);

    UploadResult result = uploader(3).upload(payload);

    UploadError error = result.getError();
    assertThat(error).isNotNull();
    assertThat(error.getKind()).isEqualTo(ErrorKind.RETRYABLE);
    assertThat(error.getStatusCode()).isEqualTo(500);
    assertThat(error.getAttempts()).isEqualTo(3);
    assertThat(transport.calls).isEqualTo(3);
  }

  @Test
  void connectionFailureIsRetried() {
    transport.fail(new ConnectException("Connection refused")).respond(200);

    UploadResult result = uploader(3).upload(payload);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getAttempts()).isEqualTo(2);
  }

  @Test
  void connectionFailureReportsNoStatus() {
    transport.fail(new ConnectException("Connection refused"));

    UploadResult result = uploader(1).upload(payload);

    UploadError error = result.getError();
    assertThat(error).isNotNull();
    assertThat(error.isRetryable()).isTrue();
    assertThat(error.getStatusCode()).isEqualTo(UploadError.NO_STATUS);
    assertThat(error.getCause()).isInstanceOf(ConnectException.class);
  }

  @Test
  void unexpectedRuntimeFailureIsFatal() {
    transport.fail(new IllegalStateException("Transport is closed")).respond(200);

    UploadResult result = uploader(3).upload(payload);

    UploadError error = result.getError();
    assertThat(error).isNotNull();
    assertThat(error.isFatal()).isTrue();
    assertThat(transport.calls).isEqualTo(1);
  }

  @Test
  void delaysNeverDecreaseAcrossAttempts() {
    transport.respond(503).respond(503).respond(503).respond(503).respond(200);
    // 抖动先取上界再取下界
    Deque<Double> randoms = new ArrayDeque<>(Arrays.asList(1.0, 0.0, 0.0, 0.0));
    RetryPolicy policy =
        RetryPolicy.builder()
            .setMaxAttempts(5)
            .setBackoffMultiplier(1.0)
            .setJitter(0.5)
            .build();
    ExponentialBackoff backoff =
        new ExponentialBackoff(
            policy.getInitialBackoff(),
            policy.getMaxBackoff(),
            policy.getBackoffMultiplier(),
            policy.getJitter(),
            randoms::removeFirst);

    UploadResult result = uploader(policy, backoff).upload(payload);

    assertThat(result.isSuccess()).isTrue();
    assertThat(sleeper.delays).hasSize(4);
    assertThat(sleeper.delays).isSorted();
    assertThat(sleeper.delays).allMatch(d -> d.equals(Duration.ofMillis(1500)));
  }

  @Test
  void delaysAreCappedAtMaxBackoff() {
    for (int i = 0; i < 5; i++) {
      transport.respond(503);
    }
    RetryPolicy policy =
        RetryPolicy.builder()
            .setMaxAttempts(6)
            .setMaxBackoff(Duration.ofSeconds(3))
            .setJitter(0.0)
            .build();

    uploader(policy, ExponentialBackoff.create(policy)).upload(payload);

    assertThat(sleeper.delays)
        .containsExactly(
            Duration.ofSeconds(1),
            Duration.ofSeconds(2),
            Duration.ofSeconds(3),
            Duration.ofSeconds(3),
            Duration.ofSeconds(3));
  }

  @Test
  void noBackoffStartsPastDeadline() {
    transport.respond(503).respond(503).respond(200);

    UploadResult result = uploader(3).upload(payload, Duration.ofMillis(1500));

    UploadError error = result.getError();
    assertThat(error).isNotNull();
    assertThat(error.isRetryable()).isTrue();
    assertThat(error.getStatusCode()).isEqualTo(503);
    assertThat(error.getMessage()).contains("deadline");
    assertThat(transport.calls).isEqualTo(2);
    assertThat(sleeper.delays).containsExactly(Duration.ofSeconds(1));
  }

  @Test
  void interruptDuringBackoffAbandonsUpload() {
    transport.respond(503).respond(200);
    sleeper.interrupt = true;

    UploadResult result = uploader(3).upload(payload);

    UploadError error = result.getError();
    assertThat(error).isNotNull();
    assertThat(error.isRetryable()).isTrue();
    assertThat(error.getMessage()).contains("interrupted");
    assertThat(transport.calls).isEqualTo(1);
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void closeClosesTransport() {
    BackoffUploader uploader = uploader(3);

    uploader.close();
    uploader.close();

    assertThat(transport.closeCount).isEqualTo(1);
  }

  /** 按脚本返回响应的传输 */
  private static final class ScriptedTransport implements ProfileTransport {
    private final Deque<Object> script = new ArrayDeque<>();
    int calls;
    int closeCount;

    ScriptedTransport respond(int code) {
      script.add(TransportResponse.of(code));
      return this;
    }

    ScriptedTransport fail(Exception e) {
      script.add(e);
      return this;
    }

    @Override
    public TransportResponse send(UploadPayload payload) throws IOException {
      calls++;
      Object next = script.removeFirst();
      if (next instanceof IOException) {
        throw (IOException) next;
      }
      if (next instanceof RuntimeException) {
        throw (RuntimeException) next;
      }
      return (TransportResponse) next;
    }

    @Override
    public void close() {
      closeCount++;
    }
  }

  /** 记录等待时间并推进时钟 */
  private static final class RecordingSleeper implements Sleeper {
    private final TestClock clock;
    final List<Duration> delays = new ArrayList<>();
    boolean interrupt;

    RecordingSleeper(TestClock clock) {
      this.clock = clock;
    }

    @Override
    public void sleep(Duration duration) throws InterruptedException {
      if (interrupt) {
        throw new InterruptedException();
      }
      delays.add(duration);
      clock.advance(duration);
    }
  }
}
