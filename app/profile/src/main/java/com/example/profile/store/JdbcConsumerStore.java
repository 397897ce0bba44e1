/*
 * どこで: Profile Store 層
 * 何を: consumers テーブルへの読み書きとトランザクション境界を提供する
 * なぜ: Repository がコミット完了を確認してからキャッシュを無効化できるようにするため
 */
package com.example.profile.store;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.profile.model.ConsumerRecord;
import com.example.profile.model.ExperienceType;
import com.example.profile.model.VipTier;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JdbcTemplate/TransactionTemplate は Spring 管理の共有コンポーネントのため")
public class JdbcConsumerStore implements ConsumerStore {

  private static final String COLUMNS =
      """
      consumer_id, external_user_id, experience_type, tenant_id, default_address_id,
      country_code, vip_tier, payment_customer_id, first_name, last_name, email,
      phone_number, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;

  public JdbcConsumerStore(
      NamedParameterJdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
  }

  @Override
  public Optional<ConsumerRecord> findById(long consumerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM consumers
            WHERE consumer_id = :consumerId
              AND recycled_at IS NULL
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("consumerId", consumerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<ConsumerRecord> findByExternalUserId(
      String externalUserId, String tenantId, ExperienceType experienceType) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM consumers
            WHERE external_user_id = :externalUserId
              AND tenant_id = :tenantId
              AND experience_type = :experienceType
              AND recycled_at IS NULL
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("externalUserId", externalUserId)
            .addValue("tenantId", tenantId)
            .addValue("experienceType", experienceType.name());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<ConsumerRecord> findByIdForUpdate(long consumerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM consumers
            WHERE consumer_id = :consumerId
              AND recycled_at IS NULL
            FOR UPDATE
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("consumerId", consumerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public boolean isRecycled(long consumerId) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1 FROM consumers
          WHERE consumer_id = :consumerId
            AND recycled_at IS NOT NULL
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("consumerId", consumerId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  @Override
  public ConsumerRecord insert(ConsumerRecord consumer) {
    final String sql =
        """
        INSERT INTO consumers (
          external_user_id, experience_type, tenant_id, default_address_id, country_code,
          vip_tier, payment_customer_id, first_name, last_name, email, phone_number,
          created_at, updated_at)
        VALUES (
          :externalUserId, :experienceType, :tenantId, :defaultAddressId, :countryCode,
          :vipTier, :paymentCustomerId, :firstName, :lastName, :email, :phoneNumber,
          :createdAt, :updatedAt)
        RETURNING
        """
            + COLUMNS;
    return jdbcTemplate.queryForObject(sql, toParams(consumer), this::mapRow);
  }

  @Override
  public ConsumerRecord update(ConsumerRecord consumer) {
    final String sql =
        """
        UPDATE consumers
        SET external_user_id = :externalUserId,
            experience_type = :experienceType,
            tenant_id = :tenantId,
            default_address_id = :defaultAddressId,
            country_code = :countryCode,
            vip_tier = :vipTier,
            payment_customer_id = :paymentCustomerId,
            first_name = :firstName,
            last_name = :lastName,
            email = :email,
            phone_number = :phoneNumber,
            updated_at = :updatedAt
        WHERE consumer_id = :consumerId
          AND recycled_at IS NULL
        RETURNING
        """
            + COLUMNS;
    return jdbcTemplate.queryForObject(sql, toParams(consumer), this::mapRow);
  }

  @Override
  public boolean softDelete(long consumerId, Instant recycledAt) {
    final String sql =
        """
        UPDATE consumers
        SET recycled_at = :recycledAt,
            updated_at = :recycledAt
        WHERE consumer_id = :consumerId
          AND recycled_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("consumerId", consumerId)
            .addValue("recycledAt", toTimestamp(recycledAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public <T> T transactionally(Supplier<T> fn) {
    return transactionTemplate.execute(status -> fn.get());
  }

  private MapSqlParameterSource toParams(ConsumerRecord consumer) {
    return new MapSqlParameterSource()
        .addValue("consumerId", consumer.consumerId())
        .addValue("externalUserId", consumer.externalUserId())
        .addValue("experienceType", nameOf(consumer.experienceType()))
        .addValue("tenantId", consumer.tenantId())
        .addValue("defaultAddressId", consumer.defaultAddressId())
        .addValue("countryCode", consumer.countryCode())
        .addValue("vipTier", nameOf(consumer.vipTier()))
        .addValue("paymentCustomerId", consumer.paymentCustomerId())
        .addValue("firstName", consumer.firstName())
        .addValue("lastName", consumer.lastName())
        .addValue("email", consumer.email())
        .addValue("phoneNumber", consumer.phoneNumber())
        .addValue("createdAt", toTimestamp(consumer.createdAt()))
        .addValue("updatedAt", toTimestamp(consumer.updatedAt()));
  }

  private String nameOf(Enum<?> value) {
    return value == null ? null : value.name();
  }

  private ConsumerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String experienceType = rs.getString("experience_type");
    final String vipTier = rs.getString("vip_tier");
    return ConsumerRecord.builder()
        .consumerId(rs.getLong("consumer_id"))
        .externalUserId(rs.getString("external_user_id"))
        .experienceType(experienceType == null ? null : ExperienceType.valueOf(experienceType))
        .tenantId(rs.getString("tenant_id"))
        .defaultAddressId(rs.getString("default_address_id"))
        .countryCode(rs.getString("country_code"))
        .vipTier(vipTier == null ? null : VipTier.valueOf(vipTier))
        .paymentCustomerId(rs.getString("payment_customer_id"))
        .firstName(rs.getString("first_name"))
        .lastName(rs.getString("last_name"))
        .email(rs.getString("email"))
        .phoneNumber(rs.getString("phone_number"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();
  }
}
