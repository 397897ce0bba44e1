package com.example.profile.store;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.profile.model.AddressLink;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AddressLinkStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public AddressLink insert(AddressLink link) {
    final String sql =
        """
        INSERT INTO consumer_addresses (consumer_id, geo_address_id, label, created_at)
        VALUES (:consumerId, :geoAddressId, :label, :createdAt)
        RETURNING consumer_id, geo_address_id, label, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("consumerId", link.consumerId())
            .addValue("geoAddressId", link.geoAddressId())
            .addValue("label", link.label())
            .addValue("createdAt", toTimestamp(link.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public boolean delete(long consumerId, String geoAddressId) {
    final String sql =
        """
        DELETE FROM consumer_addresses
        WHERE consumer_id = :consumerId
          AND geo_address_id = :geoAddressId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("consumerId", consumerId)
            .addValue("geoAddressId", geoAddressId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<AddressLink> findByConsumerId(long consumerId) {
    final String sql =
        """
        SELECT consumer_id, geo_address_id, label, created_at
        FROM consumer_addresses
        WHERE consumer_id = :consumerId
        ORDER BY created_at, geo_address_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("consumerId", consumerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public boolean exists(long consumerId, String geoAddressId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM consumer_addresses
          WHERE consumer_id = :consumerId
            AND geo_address_id = :geoAddressId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("consumerId", consumerId)
            .addValue("geoAddressId", geoAddressId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  private AddressLink mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AddressLink(
        rs.getLong("consumer_id"),
        rs.getString("geo_address_id"),
        rs.getString("label"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
