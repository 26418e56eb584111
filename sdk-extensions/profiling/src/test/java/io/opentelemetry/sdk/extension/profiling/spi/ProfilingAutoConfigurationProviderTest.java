/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.spi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.opentelemetry.sdk.autoconfigure.spi.AutoConfigurationCustomizer;
import io.opentelemetry.sdk.autoconfigure.spi.AutoConfigurationCustomizerProvider;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.resources.Resource;
import java.util.ServiceLoader;
import java.util.function.BiFunction;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ProfilingAutoConfigurationProviderTest {

  @SuppressWarnings("unchecked")
  private static BiFunction<Resource, ConfigProperties, Resource> captureResourceCustomizer() {
    AutoConfigurationCustomizer customizer = mock(AutoConfigurationCustomizer.class);
    when(customizer.addResourceCustomizer(any())).thenReturn(customizer);
    new ProfilingAutoConfigurationProvider().customize(customizer);

    ArgumentCaptor<BiFunction<Resource, ConfigProperties, Resource>> captor =
        ArgumentCaptor.forClass(BiFunction.class);
    verify(customizer).addResourceCustomizer(captor.capture());
    return captor.getValue();
  }

  @Test
  void registeredAsServiceProvider() {
    assertThat(ServiceLoader.load(AutoConfigurationCustomizerProvider.class))
        .anyMatch(p -> p instanceof ProfilingAutoConfigurationProvider);
  }

  @Test
  void disabledExportLeavesResourceUntouched() {
    ConfigProperties config = mock(ConfigProperties.class);
    when(config.getBoolean("otel.profiling.enabled", true)).thenReturn(false);
    Resource resource = Resource.getDefault();

    Resource result = captureResourceCustomizer().apply(resource, config);

    assertThat(result).isSameAs(resource);
    assertThat(ProfilingAutoConfigurationProvider.getExporter()).isNull();
  }

  @Test
  void invalidConfigurationDisablesExport() {
    ConfigProperties config = mock(ConfigProperties.class);
    when(config.getBoolean("otel.profiling.enabled", true)).thenReturn(true);
    when(config.getBoolean("otel.profiling.memory.enabled", true)).thenReturn(true);
    when(config.getString("otel.profiling.endpoint")).thenReturn("not a url");
    Resource resource = Resource.getDefault();

    Resource result = captureResourceCustomizer().apply(resource, config);

    assertThat(result).isSameAs(resource);
    assertThat(ProfilingAutoConfigurationProvider.getExporter()).isNull();
  }

  @Test
  void runsAfterOtherCustomizers() {
    assertThat(new ProfilingAutoConfigurationProvider().order()).isGreaterThan(0);
  }
}
