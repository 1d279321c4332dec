/*
 * どこで: fan-out 設定テスト
 * 何を: Prometheus 用の MeterRegistry が自動構成されることを確認する
 * なぜ: actuator で公開する prometheus エンドポイントに対応する registry が必要なため
 */
package com.example.fanout.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.prometheus.PrometheusMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class PrometheusRegistryConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  MetricsAutoConfiguration.class, PrometheusMetricsExportAutoConfiguration.class));

  @Test
  void prometheusRegistryIsAvailableForScraping() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(PrometheusMeterRegistry.class);
          context.getBean(PrometheusMeterRegistry.class).counter("fanout.publish.total").increment();
          assertThat(context.getBean(PrometheusMeterRegistry.class).scrape())
              .contains("fanout_publish_total");
        });
  }
}
