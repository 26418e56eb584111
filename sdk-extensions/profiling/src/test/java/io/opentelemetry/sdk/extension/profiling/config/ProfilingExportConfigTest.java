/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.extension.profiling.upload.UploadMode;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProfilingExportConfigTest {

  @Test
  void defaults() {
    ProfilingExportConfig config = ProfilingExportConfig.create(MapConfigProperties.empty());

    assertThat(config.isEnabled()).isTrue();
    assertThat(config.getIngestUrl()).isEqualTo("http://localhost:4040/ingest");
    assertThat(config.getServiceName()).isEqualTo("unknown_service:java");
    assertThat(config.getEnvironment()).isNull();
    assertThat(config.getExportInterval()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.getExportTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.getUploadTimeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(config.getUploadMode()).isEqualTo(UploadMode.RAW);
    assertThat(config.getRetryPolicy().getMaxAttempts()).isEqualTo(3);
    assertThat(config.getRetryPolicy().getInitialBackoff()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.getRetryPolicy().getMaxBackoff()).isEqualTo(Duration.ofSeconds(8));
    assertThat(config.getAccumulatorCapacity()).isEqualTo(10_000);
    assertThat(config.getShutdownFlushTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.isMemoryEnabled()).isTrue();
    assertThat(config.getSpyName()).isEqualTo("otel-java");
    assertThat(config.getAuthToken()).isNull();
    assertThat(config.getAuthTokenSource()).isNull();
  }

  @Test
  void readsProfilingKeys() {
    ProfilingExportConfig config =
        ProfilingExportConfig.create(
            MapConfigProperties.of(
                "otel.profiling.enabled", "false",
                "otel.profiling.endpoint", "https://pyroscope.example.com/",
                "otel.profiling.ingest.path", "api/ingest",
                "otel.service.name", "checkout",
                "otel.profiling.export.interval", "15s",
                "otel.profiling.export.timeout", "20s",
                "otel.profiling.upload.timeout", "500ms",
                "otel.profiling.upload.mode", "Multipart",
                "otel.profiling.retry.max.attempts", "5",
                "otel.profiling.retry.initial.backoff", "200ms",
                "otel.profiling.retry.max.backoff", "2s",
                "otel.profiling.retry.backoff.multiplier", "3.0",
                "otel.profiling.retry.jitter", "0",
                "otel.profiling.accumulator.capacity", "64",
                "otel.profiling.shutdown.flush.timeout", "1s",
                "otel.profiling.memory.enabled", "false",
                "otel.profiling.spy.name", "custom-agent"));

    assertThat(config.isEnabled()).isFalse();
    assertThat(config.getIngestUrl()).isEqualTo("https://pyroscope.example.com/api/ingest");
    assertThat(config.getServiceName()).isEqualTo("checkout");
    assertThat(config.getExportInterval()).isEqualTo(Duration.ofSeconds(15));
    assertThat(config.getExportTimeout()).isEqualTo(Duration.ofSeconds(20));
    assertThat(config.getUploadTimeout()).isEqualTo(Duration.ofMillis(500));
    assertThat(config.getUploadMode()).isEqualTo(UploadMode.MULTIPART);
    assertThat(config.getRetryPolicy().getMaxAttempts()).isEqualTo(5);
    assertThat(config.getRetryPolicy().getInitialBackoff()).isEqualTo(Duration.ofMillis(200));
    assertThat(config.getRetryPolicy().getMaxBackoff()).isEqualTo(Duration.ofSeconds(2));
    assertThat(config.getRetryPolicy().getBackoffMultiplier()).isEqualTo(3.0);
    assertThat(config.getRetryPolicy().getJitter()).isZero();
    assertThat(config.getAccumulatorCapacity()).isEqualTo(64);
    assertThat(config.getShutdownFlushTimeout()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.isMemoryEnabled()).isFalse();
    assertThat(config.getSpyName()).isEqualTo("custom-agent");
  }

  @Test
  void explicitTokenWins() {
    ProfilingExportConfig config =
        ProfilingExportConfig.create(
            MapConfigProperties.of(
                "otel.profiling.token", " explicit ",
                "otel.resource.attributes", "token=from-resource",
                "otel.exporter.otlp.headers", "Authorization=Bearer from-header"));

    assertThat(config.getAuthToken()).isEqualTo("explicit");
    assertThat(config.getAuthTokenSource()).isEqualTo("otel.profiling.token");
  }

  @Test
  void tokenFromResourceAttributes() {
    ProfilingExportConfig config =
        ProfilingExportConfig.create(
            MapConfigProperties.of(
                "otel.resource.attributes", "service.name=orders,token=from-resource",
                "otel.exporter.otlp.headers", "Authorization=Bearer from-header"));

    assertThat(config.getAuthToken()).isEqualTo("from-resource");
    assertThat(config.getAuthTokenSource()).isEqualTo("resource.attributes[token]");
  }

  @Test
  void tokenFromOtlpHeadersStripsBearer() {
    ProfilingExportConfig config =
        ProfilingExportConfig.create(
            MapConfigProperties.of(
                "otel.exporter.otlp.headers", "x-tenant=a, authorization=Bearer from-header"));

    assertThat(config.getAuthToken()).isEqualTo("from-header");
    assertThat(config.getAuthTokenSource())
        .isEqualTo("otel.exporter.otlp.headers[Authorization]");
  }

  @Test
  void resolvesIdentityFromResourceAttributes() {
    ProfilingExportConfig config =
        ProfilingExportConfig.create(
            MapConfigProperties.of(
                "otel.resource.attributes",
                "service.name=orders,deployment.environment.name=prod,host.name=web-1"));

    assertThat(config.getServiceName()).isEqualTo("orders");
    assertThat(config.getEnvironment()).isEqualTo("prod");
    assertThat(config.getHost()).isEqualTo("web-1");
  }

  @Test
  void explicitProfilingKeysOverrideResourceAttributes() {
    ProfilingExportConfig config =
        ProfilingExportConfig.create(
            MapConfigProperties.of(
                "otel.service.name", "payments",
                "otel.profiling.environment", "staging",
                "otel.profiling.host", "node-3",
                "otel.resource.attributes",
                "service.name=orders,deployment.environment=prod,host.name=web-1"));

    assertThat(config.getServiceName()).isEqualTo("payments");
    assertThat(config.getEnvironment()).isEqualTo("staging");
    assertThat(config.getHost()).isEqualTo("node-3");
  }

  @Test
  void applyResourceFillsMissingValues() {
    Resource resource =
        Resource.create(
            Attributes.builder()
                .put("service.name", "from-resource")
                .put("deployment.environment", "qa")
                .put("host.name", "resource-host")
                .build());

    ProfilingExportConfig config =
        ProfilingExportConfig.builder()
            .fromConfigProperties(MapConfigProperties.of("otel.profiling.host", "node-9"))
            .applyResource(resource)
            .build();

    assertThat(config.getServiceName()).isEqualTo("from-resource");
    assertThat(config.getEnvironment()).isEqualTo("qa");
    assertThat(config.getHost()).isEqualTo("node-9");
  }

  @Test
  void applyResourceKeepsExplicitServiceName() {
    Resource resource =
        Resource.create(Attributes.builder().put("service.name", "from-resource").build());

    ProfilingExportConfig config =
        ProfilingExportConfig.builder().setServiceName("explicit").applyResource(resource).build();

    assertThat(config.getServiceName()).isEqualTo("explicit");
  }

  @Test
  void extractAttribute() {
    assertThat(ProfilingExportConfig.extractAttribute("a=1, b = 2 ,c=x=y", "b")).isEqualTo("2");
    assertThat(ProfilingExportConfig.extractAttribute("a=1,c=x=y", "c")).isEqualTo("x=y");
    assertThat(ProfilingExportConfig.extractAttribute("a=1", "missing")).isNull();
    assertThat(ProfilingExportConfig.extractAttribute(null, "a")).isNull();
  }

  @Test
  void ingestUrlJoinsPaths() {
    assertThat(
            ProfilingExportConfig.builder()
                .setEndpoint("http://pyroscope:4040/")
                .setIngestPath("/ingest")
                .build()
                .getIngestUrl())
        .isEqualTo("http://pyroscope:4040/ingest");
    assertThat(
            ProfilingExportConfig.builder()
                .setEndpoint("http://pyroscope:4040")
                .setIngestPath("")
                .build()
                .getIngestUrl())
        .isEqualTo("http://pyroscope:4040");
  }

  @Test
  void rejectsInvalidEndpoint() {
    assertThatThrownBy(() -> ProfilingExportConfig.builder().setEndpoint("not a url").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("endpoint");
  }

  @Test
  void rejectsNonPositiveDurations() {
    assertThatThrownBy(
            () -> ProfilingExportConfig.builder().setExportInterval(Duration.ZERO).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("exportInterval");
    assertThatThrownBy(
            () -> ProfilingExportConfig.builder().setUploadTimeout(Duration.ofSeconds(-1)).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("uploadTimeout");
    assertThatThrownBy(
            () ->
                ProfilingExportConfig.builder()
                    .setShutdownFlushTimeout(Duration.ofMillis(-1))
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("shutdownFlushTimeout");
  }

  @Test
  void rejectsInvalidRetrySettings() {
    assertThatThrownBy(() -> ProfilingExportConfig.builder().setRetryMaxAttempts(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProfilingExportConfig.builder().setRetryJitter(1.5).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () ->
                ProfilingExportConfig.builder()
                    .setRetryInitialBackoff(Duration.ofSeconds(10))
                    .setRetryMaxBackoff(Duration.ofSeconds(1))
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("maxBackoff");
  }

  @Test
  void rejectsInvalidCapacityAndNames() {
    assertThatThrownBy(() -> ProfilingExportConfig.builder().setAccumulatorCapacity(0).build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProfilingExportConfig.builder().setServiceName(" ").build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ProfilingExportConfig.builder().setSpyName("").build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsUnknownUploadMode() {
    assertThatThrownBy(
            () ->
                ProfilingExportConfig.create(
                    MapConfigProperties.of("otel.profiling.upload.mode", "websocket")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("upload mode");
  }

  @Test
  void toStringMasksToken() {
    ProfilingExportConfig config =
        ProfilingExportConfig.builder().setToken("super-secret").setHost("h").build();

    assertThat(config.getAuthToken()).isEqualTo("super-secret");
    assertThat(config.toString()).doesNotContain("super-secret").contains("authToken=***");
  }
}
