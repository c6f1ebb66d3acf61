package io.eventsource.campaign.readmodel;

import io.eventsource.campaign.CampaignStatus;
import io.eventsource.jdbc.DataSourceConnectionProvider;
import io.eventsource.jdbc.tx.JdbcTransactionManager;
import io.eventsource.jdbc.tx.ThreadLocalTxContext;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCampaignReadModelStoreTest {
  private static final Instant CREATED = Instant.parse("2026-04-01T09:00:00Z");

  private JdbcTransactionManager txManager;
  private JdbcCampaignReadModelStore store;

  @BeforeEach
  void setUp() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:campaigns_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(ds);
    ThreadLocalTxContext txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(provider, txContext);
    store = new JdbcCampaignReadModelStore(provider, txContext);
    store.initialize();
  }

  private static CampaignReadModel view(String id, CampaignStatus status, Instant updatedAt) {
    return CampaignReadModel.builder(id)
        .name("Spring")
        .description("")
        .subject("Our Spring offers")
        .contentType("html")
        .fromName("Marketing")
        .fromEmail("news@example.com")
        .status(status)
        .createdAt(CREATED)
        .updatedAt(updatedAt)
        .segmentId("segment-42")
        .metadata(Map.of("channel", "email"))
        .version(1)
        .build();
  }

  @Test
  void upsertInsertsThenReplaces() {
    CampaignReadModel draft = view("campaign-1", CampaignStatus.DRAFT, CREATED);
    store.upsert(draft);
    assertEquals(draft, store.find("campaign-1").orElseThrow());

    CampaignReadModel scheduled = draft.toBuilder()
        .name("Spring Sale")
        .status(CampaignStatus.SCHEDULED)
        .scheduledAt(CREATED.plus(Duration.ofDays(1)))
        .updatedAt(CREATED.plusSeconds(60))
        .version(3)
        .build();
    store.upsert(scheduled);

    CampaignReadModel found = store.find("campaign-1").orElseThrow();
    assertEquals(scheduled, found);
    assertEquals(Map.of("channel", "email"), found.metadata());
    assertNull(found.replyToEmail());
    assertNull(found.sentAt());
  }

  @Test
  void descriptionAndMetadataAreUnbounded() {
    CampaignReadModel large = view("campaign-1", CampaignStatus.FAILED, CREATED).toBuilder()
        .description("d".repeat(20_000))
        .metadata(Map.of("channel", "email", "failureReason", "r".repeat(10_000)))
        .build();

    store.upsert(large);

    CampaignReadModel found = store.find("campaign-1").orElseThrow();
    assertEquals(20_000, found.description().length());
    assertEquals(large, found);
  }

  @Test
  void missingCampaignIsEmpty() {
    assertTrue(store.find("campaign-404").isEmpty());
  }

  @Test
  void findByStatusReturnsMostRecentlyUpdatedFirst() {
    store.upsert(view("campaign-1", CampaignStatus.DRAFT, CREATED));
    store.upsert(view("campaign-2", CampaignStatus.DRAFT, CREATED.plusSeconds(30)));
    store.upsert(view("campaign-3", CampaignStatus.SENDING, CREATED.plusSeconds(60)));
    store.upsert(view("campaign-4", CampaignStatus.DRAFT, CREATED.plusSeconds(90)));

    List<CampaignReadModel> drafts = store.findByStatus(CampaignStatus.DRAFT, 2);

    assertEquals(List.of("campaign-4", "campaign-2"), drafts.stream().map(CampaignReadModel::id).toList());
    assertEquals(3, store.countByStatus(CampaignStatus.DRAFT));
    assertEquals(1, store.countByStatus(CampaignStatus.SENDING));
    assertEquals(0, store.countByStatus(CampaignStatus.FAILED));
    assertThrows(IllegalArgumentException.class, () -> store.findByStatus(CampaignStatus.DRAFT, 0));
  }

  @Test
  void clearRemovesEveryView() {
    store.upsert(view("campaign-1", CampaignStatus.DRAFT, CREATED));
    store.upsert(view("campaign-2", CampaignStatus.CANCELED, CREATED));

    store.clear();

    assertTrue(store.find("campaign-1").isEmpty());
    assertEquals(0, store.countByStatus(CampaignStatus.CANCELED));
  }

  @Test
  void writesJoinTheActiveTransaction() throws Exception {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      store.upsert(view("campaign-1", CampaignStatus.DRAFT, CREATED));
      assertTrue(store.find("campaign-1").isPresent());
      tx.rollback();
    }
    assertTrue(store.find("campaign-1").isEmpty());

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      store.upsert(view("campaign-1", CampaignStatus.DRAFT, CREATED));
      tx.commit();
    }
    assertTrue(store.find("campaign-1").isPresent());
  }

  @Test
  void initializeIsIdempotent() {
    store.upsert(view("campaign-1", CampaignStatus.DRAFT, CREATED));

    store.initialize();

    assertTrue(store.find("campaign-1").isPresent());
  }
}
