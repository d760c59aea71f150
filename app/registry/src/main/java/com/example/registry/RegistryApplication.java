/*
 * どこで: Registry アプリのエントリポイント
 * 何を: Spring Boot の起動と共通設定の取り込みを行う
 * なぜ: 時刻源(Clock)を common ライブラリから共有するため
 */
package com.example.registry;

import com.example.registry.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(TimeConfig.class)
public class RegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RegistryApplication.class, args);
    }
}
