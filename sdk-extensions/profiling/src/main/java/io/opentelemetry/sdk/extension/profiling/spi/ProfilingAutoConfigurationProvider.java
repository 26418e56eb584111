/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.profiling.spi;

import io.opentelemetry.sdk.autoconfigure.spi.AutoConfigurationCustomizer;
import io.opentelemetry.sdk.autoconfigure.spi.AutoConfigurationCustomizerProvider;
import io.opentelemetry.sdk.autoconfigure.spi.ConfigProperties;
import io.opentelemetry.sdk.extension.profiling.ProfilingExporter;
import io.opentelemetry.sdk.extension.profiling.config.ProfilingExportConfig;
import io.opentelemetry.sdk.resources.Resource;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Profile 导出自动配置提供者
 *
 * <p>通过 SPI 机制自动集成到 OpenTelemetry SDK 自动配置中。在 Resource 确定后创建并启动
 * {@link ProfilingExporter}，并注册关闭钩子。外部采样器通过 {@link #getExporter()} 获取实例。
 */
public final class ProfilingAutoConfigurationProvider
    implements AutoConfigurationCustomizerProvider {

  private static final Logger logger =
      Logger.getLogger(ProfilingAutoConfigurationProvider.class.getName());

  private static final String PROFILING_ENABLED = "otel.profiling.enabled";

  @Nullable private static volatile ProfilingExporter exporter;

  @Override
  public void customize(AutoConfigurationCustomizer autoConfiguration) {
    autoConfiguration.addResourceCustomizer(
        (resource, config) -> {
          if (!isEnabled(config)) {
            logger.log(Level.INFO, "Profiling export disabled by {0}", PROFILING_ENABLED);
            return resource;
          }

          initializeExporter(resource, config);
          return resource;
        });
  }

  @Override
  public int order() {
    // 确保在其他自定义之后执行
    return Integer.MAX_VALUE - 100;
  }

  private static boolean isEnabled(ConfigProperties config) {
    return config.getBoolean(PROFILING_ENABLED, true);
  }

  private static void initializeExporter(Resource resource, ConfigProperties config) {
    if (exporter != null) {
      return;
    }

    synchronized (ProfilingAutoConfigurationProvider.class) {
      if (exporter != null) {
        return;
      }

      ProfilingExportConfig exportConfig;
      try {
        exportConfig =
            ProfilingExportConfig.builder()
                .fromConfigProperties(config)
                .applyResource(resource)
                .build();
      } catch (IllegalArgumentException e) {
        logger.log(Level.WARNING, "Invalid profiling export configuration, export disabled", e);
        return;
      }

      ProfilingExporter created = ProfilingExporter.create(exportConfig);
      created.start();
      exporter = created;

      // 注册关闭钩子
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    try {
                      created.close();
                    } catch (RuntimeException e) {
                      logger.log(Level.WARNING, "Failed to close profiling exporter", e);
                    }
                  },
                  "otel-profiling-shutdown"));

      logger.log(Level.INFO, "Profiling exporter initialized");
    }
  }

  /**
   * 获取导出器实例
   *
   * @return 导出器，如果未初始化则返回 null
   */
  @Nullable
  public static ProfilingExporter getExporter() {
    return exporter;
  }
}
