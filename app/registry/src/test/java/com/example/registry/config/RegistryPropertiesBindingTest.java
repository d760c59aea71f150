/*
 * どこで: Registry 設定バインドのテスト
 * 何を: registry.store/export/display の値が record へ正しく束縛され、不正値で起動が失敗することを検証する
 * なぜ: 設定ミスをリクエスト処理時ではなく起動時に検出するため
 */
package com.example.registry.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class RegistryPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(RegistryConfig.class)
          .withPropertyValues(
              "registry.store.init-max-attempts=3",
              "registry.store.init-retry-delay=250ms",
              "registry.export.auto-csv=true",
              "registry.export.auto-json=false",
              "registry.export.directory=out/exports",
              "registry.display.zone-id=Asia/Tokyo",
              "registry.display.timestamp-pattern=yyyy/MM/dd HH:mm");

  @Test
  void contextStartsAndBindsAllFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final RegistryStoreProperties store = context.getBean(RegistryStoreProperties.class);
          final RegistryExportProperties export = context.getBean(RegistryExportProperties.class);
          final RegistryDisplayProperties display =
              context.getBean(RegistryDisplayProperties.class);

          assertThat(store.initMaxAttempts()).isEqualTo(3);
          assertThat(store.initRetryDelay()).isEqualTo(Duration.ofMillis(250));
          assertThat(export.autoCsv()).isTrue();
          assertThat(export.autoJson()).isFalse();
          assertThat(export.directory()).isEqualTo("out/exports");
          assertThat(display.zoneId()).isEqualTo(ZoneId.of("Asia/Tokyo"));
          assertThat(display.timestampPattern()).isEqualTo("yyyy/MM/dd HH:mm");
        });
  }

  @Test
  void contextFailsWhenMaxAttemptsIsZero() {
    contextRunner
        .withPropertyValues("registry.store.init-max-attempts=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void contextFailsWhenExportDirectoryIsBlank() {
    contextRunner
        .withPropertyValues("registry.export.directory= ")
        .run(context -> assertThat(context).hasFailed());
  }
}
