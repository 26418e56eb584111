/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.upload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.sdk.extension.profiling.config.ProfilingExportConfig;
import io.opentelemetry.sdk.extension.profiling.payload.UploadPayload;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpProfileTransportTest {

  private static final Logger logger = Logger.getLogger(OkHttpProfileTransportTest.class.getName());

  private MockWebServer server;
  private OkHttpProfileTransport transport;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    if (transport != null) {
      transport.close();
    }
    server.shutdown();
  }

  private OkHttpProfileTransport transport(UploadMode mode) {
    OkHttpClient client =
        new OkHttpClient.Builder()
            .callTimeout(Duration.ofSeconds(5))
            .retryOnConnectionFailure(false)
            .build();
    transport =
        new OkHttpProfileTransport(
            client, server.url("/ingest").toString(), mode, "otel-java", logger);
    return transport;
  }

  @Test
  void rawModeSendsGzipBodyWithQueryParameters() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200));
    UploadPayload payload = TestPayloads.payload();

    TransportResponse response = transport(UploadMode.RAW).send(payload);

    assertThat(response.isSuccessful()).isTrue();
    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(request.getMethod()).isEqualTo("POST");
    HttpUrl url = request.getRequestUrl();
    assertThat(url).isNotNull();
    assertThat(url.encodedPath()).isEqualTo("/ingest");
    assertThat(url.queryParameter("name")).isEqualTo("billing{environment=staging,host=node-7}");
    assertThat(url.queryParameter("from")).isEqualTo("1000000000");
    assertThat(url.queryParameter("until")).isEqualTo("11000000000");
    assertThat(url.queryParameter("format")).isEqualTo("pprof");
    assertThat(url.queryParameter("spyName")).isEqualTo("otel-java");
    assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token-123");
    assertThat(request.getHeader("Content-Encoding")).isEqualTo("gzip");
    assertThat(request.getBody().readByteArray()).isEqualTo(payload.getCompressedBody());
  }

  @Test
  void multipartModeSendsProfileAndSampleTypeConfig() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200));

    transport(UploadMode.MULTIPART).send(TestPayloads.payload());

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(request.getHeader("Content-Type")).startsWith("multipart/form-data");
    assertThat(request.getHeader("Content-Encoding")).isNull();
    HttpUrl url = request.getRequestUrl();
    assertThat(url).isNotNull();
    assertThat(url.queryParameter("format")).isNull();
    String body = request.getBody().readUtf8();
    assertThat(body).contains("name=\"profile\"");
    assertThat(body).contains("name=\"sample_type_config\"");
    assertThat(body).contains("\"cpu-time\"");
  }

  @Test
  void noAuthorizationHeaderWithoutToken() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(200));

    transport(UploadMode.RAW).send(TestPayloads.payload(null));

    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(request.getHeader("Authorization")).isNull();
  }

  @Test
  void errorResponseIsReturnedWithBodySnippet() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(400).setBody("invalid token"));

    TransportResponse response = transport(UploadMode.RAW).send(TestPayloads.payload());

    assertThat(response.isSuccessful()).isFalse();
    assertThat(response.getCode()).isEqualTo(400);
    assertThat(response.getBody()).isEqualTo("invalid token");
  }

  @Test
  void connectionFailureThrowsIoException() throws Exception {
    MockWebServer stopped = new MockWebServer();
    stopped.start();
    String url = stopped.url("/ingest").toString();
    stopped.shutdown();
    transport =
        new OkHttpProfileTransport(
            new OkHttpClient.Builder().retryOnConnectionFailure(false).build(),
            url,
            UploadMode.RAW,
            "otel-java",
            logger);

    assertThatThrownBy(() -> transport.send(TestPayloads.payload()))
        .isInstanceOf(IOException.class);
  }

  @Test
  void sendAfterCloseFails() {
    OkHttpProfileTransport closed = transport(UploadMode.RAW);
    closed.close();

    assertThatThrownBy(() -> closed.send(TestPayloads.payload()))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void uploaderRetriesServerErrorsAgainstRealServer() {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(200));
    RetryPolicy policy =
        RetryPolicy.builder()
            .setInitialBackoff(Duration.ofMillis(10))
            .setMaxBackoff(Duration.ofMillis(20))
            .build();

    UploadResult result =
        BackoffUploader.create(transport(UploadMode.RAW), policy).upload(TestPayloads.payload());

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getAttempts()).isEqualTo(2);
    assertThat(server.getRequestCount()).isEqualTo(2);
  }

  @Test
  void createFromConfig() {
    ProfilingExportConfig config =
        ProfilingExportConfig.builder()
            .setEndpoint("http://pyroscope.example:4040/")
            .setUploadMode(UploadMode.MULTIPART)
            .setHost("node-1")
            .build();

    transport = OkHttpProfileTransport.create(config);

    assertThat(transport.getMode()).isEqualTo(UploadMode.MULTIPART);
    assertThat(transport.toString()).contains("http://pyroscope.example:4040/ingest");
  }
}
