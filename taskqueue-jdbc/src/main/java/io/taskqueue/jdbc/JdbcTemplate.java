package io.taskqueue.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in store and repository implementations.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new TaskStoreException("Failed to execute update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return mapAll(ps, mapper);
    } catch (SQLException e) {
      throw new TaskStoreException("Failed to execute query", e);
    }
  }

  /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
  public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return mapAll(ps, mapper);
    } catch (SQLException e) {
      throw new TaskStoreException("Failed to execute updateReturning", e);
    }
  }

  /** Reads a nullable timestamp column as an {@link Instant}. */
  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  /** Converts a nullable {@link Instant} to a bind parameter. */
  public static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  private static <T> List<T> mapAll(PreparedStatement ps, RowMapper<T> mapper) throws SQLException {
    try (ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
