/*
 * どこで: fan-out テスト
 * 何を: Testcontainers Postgres への接続と migration 適用を確認する
 * なぜ: コンテキストキャッシュが有効でも DB 接続が確立できることを保証するため
 */
package com.example.fanout;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class PostgresContainerSmokeTest extends AbstractPostgresContainerTest {

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Test
  void postgresContainerIsReachable() {
    final String databaseName =
        jdbcTemplate.getJdbcTemplate().queryForObject("SELECT current_database()", String.class);

    assertThat(databaseName).isNotBlank();
  }

  @Test
  void migrationsCreateBothTables() {
    final Integer tables =
        jdbcTemplate
            .getJdbcTemplate()
            .queryForObject(
                """
                SELECT COUNT(*)
                FROM information_schema.tables
                WHERE table_schema = 'fanout'
                  AND table_name IN ('notifications', 'delivery_states')
                """,
                Integer.class);

    assertThat(tables).isEqualTo(2);
  }
}
