/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.payload;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.sdk.extension.profiling.pprof.BinaryProfile;
import io.opentelemetry.sdk.extension.profiling.pprof.ProfileBuilder;
import io.opentelemetry.sdk.extension.profiling.sample.ProfileWindow;
import io.opentelemetry.sdk.extension.profiling.sample.Sample;
import io.opentelemetry.sdk.extension.profiling.sample.SampleType;
import io.opentelemetry.sdk.extension.profiling.sample.StackFrame;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PayloadEncoderTest {

  private final PayloadEncoder encoder = new PayloadEncoder();
  private final PayloadMetadata metadata =
      PayloadMetadata.create("checkout", "production", "host-1", "secret-token");
  private BinaryProfile profile;

  @BeforeEach
  void setUp() throws Exception {
    StackFrame frame = StackFrame.create("process", "Order.java", 21);
    profile =
        new ProfileBuilder()
            .build(
                ProfileWindow.create(
                    1_000L,
                    2_000L,
                    Arrays.asList(
                        Sample.create(SampleType.CPU, Collections.singletonList(frame), 10, 0),
                        Sample.create(
                            SampleType.HEAP_SPACE, Collections.singletonList(frame), 512, 0))));
  }

  @Test
  void compressedBodyInflatesToProfileBytes() throws Exception {
    UploadPayload payload = encoder.encode(profile, metadata);

    assertThat(gunzip(payload.getCompressedBody())).isEqualTo(profile.getBytes());
    assertThat(payload.getContentEncoding()).isEqualTo("gzip");
    assertThat(payload.getFormat()).isEqualTo("pprof");
    assertThat(payload.getStartNanos()).isEqualTo(1_000L);
    assertThat(payload.getEndNanos()).isEqualTo(2_000L);
    assertThat(payload.getAuthToken()).isEqualTo("secret-token");
  }

  @Test
  void encodingIsIdempotent() throws Exception {
    UploadPayload first = encoder.encode(profile, metadata);
    UploadPayload second = encoder.encode(profile, metadata);

    assertThat(second).isEqualTo(first);
    assertThat(second.hashCode()).isEqualTo(first.hashCode());
  }

  @Test
  void labelsAreSortedByKey() throws Exception {
    UploadPayload payload = encoder.encode(profile, metadata);

    assertThat(payload.getLabels())
        .containsExactly(
            entry("environment", "production"),
            entry("host", "host-1"),
            entry("service_name", "checkout"));
    assertThatThrownBy(() -> payload.getLabels().put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void missingOptionalMetadataIsOmitted() throws Exception {
    UploadPayload payload =
        encoder.encode(profile, PayloadMetadata.create("checkout", "", null, null));

    assertThat(payload.getLabels()).containsOnlyKeys("service_name");
    assertThat(payload.getAuthToken()).isNull();
  }

  @Test
  void sampleTypeConfigDescribesPresentTypes() throws Exception {
    UploadPayload payload = encoder.encode(profile, metadata);

    JsonNode config = new ObjectMapper().readTree(payload.getSampleTypeConfig());
    assertThat(config.size()).isEqualTo(2);
    assertThat(config.get("cpu-time").get("units").asText()).isEqualTo("nanoseconds");
    assertThat(config.get("cpu-time").get("display-name").asText()).isEqualTo("cpu_time");
    assertThat(config.get("heap-space").get("aggregation").asText()).isEqualTo("average");
    assertThat(config.get("heap-space").get("sampled").asBoolean()).isFalse();
  }

  @Test
  void toStringMasksToken() throws Exception {
    UploadPayload payload = encoder.encode(profile, metadata);

    assertThat(payload.toString()).doesNotContain("secret-token");
    assertThat(metadata.toString()).doesNotContain("secret-token");
  }

  @Test
  void emptyServiceNameIsRejected() {
    assertThatThrownBy(() -> PayloadMetadata.create("", null, null, null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static byte[] gunzip(byte[] compressed) throws IOException {
    try (GZIPInputStream gis = new GZIPInputStream(new ByteArrayInputStream(compressed));
        ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
      byte[] buffer = new byte[1024];
      int len;
      while ((len = gis.read(buffer)) > 0) {
        baos.write(buffer, 0, len);
      }
      return baos.toByteArray();
    }
  }
}
