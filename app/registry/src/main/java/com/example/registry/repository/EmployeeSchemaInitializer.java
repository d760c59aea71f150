/*
 * どこで: Registry 起動処理
 * 何を: employees テーブルを存在しなければ作成する
 * なぜ: DB コンテナの起動待ちを有限回のリトライで吸収し、Web サーバー公開前にスキーマを保証するため
 */
package com.example.registry.repository;

import com.example.registry.config.RegistryStoreProperties;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EmployeeSchemaInitializer {

  private static final Logger logger = LoggerFactory.getLogger(EmployeeSchemaInitializer.class);

  static final String CREATE_TABLE_SQL =
      """
      CREATE TABLE IF NOT EXISTS employees (
          id BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
          eid VARCHAR(50) NOT NULL,
          name VARCHAR(100) NOT NULL,
          rights VARCHAR(50),
          status VARCHAR(50),
          remarks VARCHAR(500),
          created_at TIMESTAMPTZ NOT NULL,
          updated_at TIMESTAMPTZ NOT NULL,
          CONSTRAINT uq_employees_eid UNIQUE (eid)
      )
      """;

  private final JdbcTemplate jdbcTemplate;
  private final RegistryStoreProperties storeProperties;

  @PostConstruct
  public void initialize() {
    final int maxAttempts = storeProperties.initMaxAttempts();
    for (int attempt = 1; ; attempt++) {
      try {
        jdbcTemplate.execute(CREATE_TABLE_SQL);
        logger.info("employees table ready attempt={}", attempt);
        return;
      } catch (DataAccessResourceFailureException ex) {
        // 接続不可のみ再試行し、SQL 自体の誤りはそのまま起動失敗とする
        if (attempt >= maxAttempts) {
          logger.error("database unreachable after {} attempts", maxAttempts, ex);
          throw new StoreUnavailableException(
              "database unreachable after " + maxAttempts + " attempts", ex);
        }
        logger.warn(
            "database connection failed attempt={}/{} retryIn={}",
            attempt,
            maxAttempts,
            storeProperties.initRetryDelay(),
            ex);
        pause(storeProperties.initRetryDelay(), ex);
      }
    }
  }

  private void pause(Duration delay, DataAccessResourceFailureException cause) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException("interrupted while waiting for database", cause);
    }
  }
}
