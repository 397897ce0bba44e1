package com.example.profile.store;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TermsOfServiceStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Integer> findLatestAcceptedVersion(long consumerId) {
    final String sql =
        """
        SELECT MAX(version)
        FROM terms_of_service_acceptances
        WHERE consumer_id = :consumerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("consumerId", consumerId);
    return Optional.ofNullable(jdbcTemplate.queryForObject(sql, params, Integer.class));
  }

  /** 同一バージョンの再同意は初回の accepted_at を保持する。 */
  public void recordAcceptance(long consumerId, int version, Instant acceptedAt) {
    final String sql =
        """
        INSERT INTO terms_of_service_acceptances (consumer_id, version, accepted_at)
        VALUES (:consumerId, :version, :acceptedAt)
        ON CONFLICT (consumer_id, version) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("consumerId", consumerId)
            .addValue("version", version)
            .addValue("acceptedAt", toTimestamp(acceptedAt));
    jdbcTemplate.update(sql, params);
  }
}
