package io.eventsource.campaign.readmodel;

import io.eventsource.Identifier;
import io.eventsource.campaign.CampaignDetails;
import io.eventsource.campaign.CampaignStatus;
import io.eventsource.jdbc.JdbcTemplate;
import io.eventsource.jdbc.TableNames;
import io.eventsource.spi.ConnectionProvider;
import io.eventsource.spi.TxContext;
import io.eventsource.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * JDBC store for campaign views, portable across H2, PostgreSQL and MySQL.
 *
 * <p>Writes go through the transaction active on the calling thread when there is one,
 * so a view and the projection checkpoint commit together.
 */
public final class JdbcCampaignReadModelStore implements CampaignReadModelStore {
  private static final Logger logger = Logger.getLogger(JdbcCampaignReadModelStore.class.getName());

  public static final String DEFAULT_TABLE = "campaign_read_model";

  private static final String COLUMNS = "id, name, description, subject, content_type, from_name, "
      + "from_email, reply_to_email, status, created_at, updated_at, scheduled_at, sent_at, "
      + "completed_at, segment_id, template_id, metadata, version";

  private final ConnectionProvider connectionProvider;
  private final TxContext txContext;
  private final String tableName;
  private final JdbcTemplate jdbc;
  private final JsonCodec jsonCodec = JsonCodec.getDefault();

  public JdbcCampaignReadModelStore(ConnectionProvider connectionProvider, TxContext txContext) {
    this(connectionProvider, txContext, DEFAULT_TABLE, Duration.ZERO);
  }

  public JdbcCampaignReadModelStore(ConnectionProvider connectionProvider, TxContext txContext,
      String tableName, Duration queryTimeout) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = txContext;
    this.tableName = TableNames.validate(tableName);
    this.jdbc = new JdbcTemplate(queryTimeout == null ? Duration.ZERO : queryTimeout);
  }

  @Override
  public void initialize() {
    try (Connection conn = connectionProvider.getConnection()) {
      String text = textColumnType(conn);
      String ddl = "CREATE TABLE IF NOT EXISTS " + tableName + " ("
          + "id VARCHAR(" + Identifier.MAX_LENGTH + ") NOT NULL PRIMARY KEY, "
          + "name VARCHAR(" + CampaignDetails.MAX_NAME_LENGTH + "), "
          + "description " + text + ", "
          + "subject VARCHAR(" + CampaignDetails.MAX_SUBJECT_LENGTH + "), "
          + "content_type VARCHAR(8), "
          + "from_name VARCHAR(" + CampaignDetails.MAX_NAME_LENGTH + "), "
          + "from_email VARCHAR(" + CampaignDetails.MAX_EMAIL_LENGTH + "), "
          + "reply_to_email VARCHAR(" + CampaignDetails.MAX_EMAIL_LENGTH + "), "
          + "status VARCHAR(16) NOT NULL, "
          + "created_at TIMESTAMP(6) NULL, "
          + "updated_at TIMESTAMP(6) NULL, "
          + "scheduled_at TIMESTAMP(6) NULL, "
          + "sent_at TIMESTAMP(6) NULL, "
          + "completed_at TIMESTAMP(6) NULL, "
          + "segment_id VARCHAR(" + CampaignDetails.MAX_REFERENCE_LENGTH + "), "
          + "template_id VARCHAR(" + CampaignDetails.MAX_REFERENCE_LENGTH + "), "
          + "metadata " + text + ", "
          + "version BIGINT NOT NULL)";
      jdbc.update(conn, ddl);
    } catch (SQLException e) {
      throw JdbcTemplate.translate("initialize campaign read model table", e);
    }
    logger.info("Initialized campaign read model table " + tableName);
  }

  /**
   * Unbounded text type for description and metadata.
   */
  static String textColumnType(Connection conn) throws SQLException {
    String product = conn.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
    if (product.contains("mysql") || product.contains("mariadb")) {
      return "LONGTEXT";
    }
    if (product.contains("postgres")) {
      return "TEXT";
    }
    return "CLOB";
  }

  @Override
  public Optional<CampaignReadModel> find(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    List<CampaignReadModel> rows = inConnection("find campaign " + campaignId, conn -> jdbc.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id = ?", this::mapRow, campaignId));
    return rows.stream().findFirst();
  }

  @Override
  public List<CampaignReadModel> findByStatus(CampaignStatus status, int limit) {
    Objects.requireNonNull(status, "status");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return inConnection("find campaigns by status", conn -> jdbc.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName
            + " WHERE status = ? ORDER BY updated_at DESC, id LIMIT ?",
        this::mapRow, status.name(), limit));
  }

  @Override
  public long countByStatus(CampaignStatus status) {
    Objects.requireNonNull(status, "status");
    return inConnection("count campaigns by status", conn -> jdbc.queryForLong(conn,
        "SELECT COUNT(*) FROM " + tableName + " WHERE status = ?", status.name()));
  }

  @Override
  public void upsert(CampaignReadModel m) {
    Objects.requireNonNull(m, "model");
    String metadata = jsonCodec.toJson(m.metadata());
    inConnection("upsert campaign " + m.id(), conn -> {
      int updated = jdbc.update(conn, "UPDATE " + tableName + " SET name = ?, description = ?, "
              + "subject = ?, content_type = ?, from_name = ?, from_email = ?, reply_to_email = ?, "
              + "status = ?, created_at = ?, updated_at = ?, scheduled_at = ?, sent_at = ?, "
              + "completed_at = ?, segment_id = ?, template_id = ?, metadata = ?, version = ? WHERE id = ?",
          m.name(), m.description(), m.subject(), m.contentType(), m.fromName(), m.fromEmail(),
          m.replyToEmail(), m.status().name(), m.createdAt(), m.updatedAt(), m.scheduledAt(),
          m.sentAt(), m.completedAt(), m.segmentId(), m.templateId(), metadata, m.version(), m.id());
      if (updated == 0) {
        jdbc.update(conn, "INSERT INTO " + tableName + " (" + COLUMNS + ") "
                + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
            m.id(), m.name(), m.description(), m.subject(), m.contentType(), m.fromName(),
            m.fromEmail(), m.replyToEmail(), m.status().name(), m.createdAt(), m.updatedAt(),
            m.scheduledAt(), m.sentAt(), m.completedAt(), m.segmentId(), m.templateId(), metadata,
            m.version());
      }
      return null;
    });
  }

  @Override
  public void clear() {
    inConnection("clear campaign read model", conn -> jdbc.update(conn, "DELETE FROM " + tableName));
  }

  private <T> T inConnection(String action, ConnectionCallback<T> callback) {
    if (txContext != null && txContext.isTransactionActive()) {
      return callback.doInConnection(txContext.currentConnection());
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw JdbcTemplate.translate(action, e);
    }
  }

  private CampaignReadModel mapRow(ResultSet rs) throws SQLException {
    return CampaignReadModel.builder(rs.getString("id"))
        .name(rs.getString("name"))
        .description(rs.getString("description"))
        .subject(rs.getString("subject"))
        .contentType(rs.getString("content_type"))
        .fromName(rs.getString("from_name"))
        .fromEmail(rs.getString("from_email"))
        .replyToEmail(rs.getString("reply_to_email"))
        .status(CampaignStatus.valueOf(rs.getString("status")))
        .createdAt(instant(rs.getTimestamp("created_at")))
        .updatedAt(instant(rs.getTimestamp("updated_at")))
        .scheduledAt(instant(rs.getTimestamp("scheduled_at")))
        .sentAt(instant(rs.getTimestamp("sent_at")))
        .completedAt(instant(rs.getTimestamp("completed_at")))
        .segmentId(rs.getString("segment_id"))
        .templateId(rs.getString("template_id"))
        .metadata(jsonCodec.parseObject(rs.getString("metadata")))
        .version(rs.getLong("version"))
        .build();
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T doInConnection(Connection conn);
  }
}
