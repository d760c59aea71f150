/*
 * どこで: Registry データアクセス
 * 何を: employees の登録/更新/削除/参照を 1 文ずつ実行する
 * なぜ: 接続の取得と解放を JdbcTemplate に任せ、どの終了経路でも確実に返却するため
 */
package com.example.registry.repository;

import static com.example.registry.common.JdbcTimestampUtils.toInstant;
import static com.example.registry.common.JdbcTimestampUtils.toTimestamp;

import com.example.registry.model.EmployeeDraft;
import com.example.registry.model.EmployeeField;
import com.example.registry.model.EmployeeRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class EmployeeRepository {

  private static final String COLUMNS =
      "id, eid, name, rights, status, remarks, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<EmployeeRecord> findAll(String filter) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "SELECT " + COLUMNS + " FROM employees" + where(filter, params)
        + " ORDER BY id DESC";
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<EmployeeRecord> findPage(String filter, int skip, int limit) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("skip", skip).addValue("limit", limit);
    final String sql = "SELECT " + COLUMNS + " FROM employees" + where(filter, params)
        + " ORDER BY id DESC OFFSET :skip LIMIT :limit";
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<EmployeeRecord> findById(long id) {
    final String sql = "SELECT " + COLUMNS + " FROM employees WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Looks up the holder of {@code externalKey}, ignoring the row {@code excludeId} when given. */
  public Optional<EmployeeRecord> findByExternalKey(String externalKey, Long excludeId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eid", externalKey);
    String sql = "SELECT " + COLUMNS + " FROM employees WHERE eid = :eid";
    if (excludeId != null) {
      sql += " AND id <> :excludeId";
      params.addValue("excludeId", excludeId);
    }
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Inserts a row and returns its generated id. A clash on {@code eid} surfaces as
   * {@link org.springframework.dao.DuplicateKeyException}.
   */
  public long insert(EmployeeDraft draft, Instant now) {
    final String sql =
        """
        INSERT INTO employees (eid, name, rights, status, remarks, created_at, updated_at)
        VALUES (:eid, :name, :rights, :status, :remarks, :createdAt, :updatedAt)
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eid", draft.externalKey())
            .addValue("name", draft.name())
            .addValue("rights", draft.rights())
            .addValue("status", draft.status())
            .addValue("remarks", draft.remarks())
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("insert returned no id");
    }
    return id;
  }

  /** Applies only the given columns and refreshes {@code updated_at}; returns affected rows. */
  public int update(long id, Map<EmployeeField, String> fields, Instant now) {
    if (fields.isEmpty()) {
      throw new IllegalArgumentException("no fields to update");
    }
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("updatedAt", toTimestamp(now));
    fields.forEach((field, value) -> params.addValue(field.column(), value));
    final String assignments =
        fields.keySet().stream()
            .map(field -> field.column() + " = :" + field.column())
            .collect(Collectors.joining(", "));
    final String sql =
        "UPDATE employees SET " + assignments + ", updated_at = :updatedAt WHERE id = :id";
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long id) {
    final String sql = "DELETE FROM employees WHERE id = :id";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public long count() {
    final Long count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM employees", new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  private String where(String filter, MapSqlParameterSource params) {
    if (filter == null || filter.isBlank()) {
      return "";
    }
    // 大文字小文字の畳み込みは列と検索語の両方を DB の LOWER() に揃える
    params.addValue("pattern", "%" + escapeLike(filter.trim()) + "%");
    return " WHERE LOWER(eid) LIKE LOWER(:pattern) OR LOWER(name) LIKE LOWER(:pattern)";
  }

  // PostgreSQL の LIKE は既定でバックスラッシュをエスケープ文字として扱う
  static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private EmployeeRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EmployeeRecord(
        rs.getLong("id"),
        rs.getString("eid"),
        rs.getString("name"),
        rs.getString("rights"),
        rs.getString("status"),
        rs.getString("remarks"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
