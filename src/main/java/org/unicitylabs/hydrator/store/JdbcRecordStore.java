package org.unicitylabs.hydrator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.unicitylabs.hydrator.projection.RecordMappers;
import org.unicitylabs.hydrator.projection.record.DomainRecord;
import org.unicitylabs.hydrator.protocol.CanonicalJson;
import org.unicitylabs.hydrator.protocol.Event;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JDBC store over the hydrated_event table.
 *
 * Each row keeps the complete signed event; typed records are rebuilt on read with the
 * same mappers that produced them. The primary key on event_id decides concurrent
 * inserts: a duplicate is ignored, never an error.
 */
public class JdbcRecordStore implements RecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRecordStore.class);
    private static final TypeReference<List<List<String>>> TAGS_TYPE = new TypeReference<List<List<String>>>() {};

    private static final String INSERT_SQL =
        "INSERT INTO hydrated_event (event_id, pubkey, kind, created_at, content, tags_json, sig, " +
        "record_type, source_relay, slug, coordinate, root_ref, parent_ref, projected_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_BY_ID_SQL =
        "SELECT event_id, pubkey, kind, created_at, content, tags_json, sig, source_relay " +
        "FROM hydrated_event WHERE event_id = ?";

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM hydrated_event";

    private static final String COUNT_BY_TYPE_SQL =
        "SELECT record_type, COUNT(*) FROM hydrated_event GROUP BY record_type";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final RecordMappers mappers;
    private final Clock clock;
    private final Map<String, DomainRecord> pending = new LinkedHashMap<>();
    private final AtomicLong failed = new AtomicLong();

    public JdbcRecordStore(DataSource dataSource) {
        this(new JdbcTemplate(dataSource), RecordMappers.defaults(), Clock.systemUTC());
    }

    public JdbcRecordStore(JdbcTemplate jdbc, RecordMappers mappers, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(
            Objects.requireNonNull(jdbc.getDataSource(), "jdbc.dataSource")));
        this.mappers = mappers;
        this.clock = clock;
    }

    @Override
    public DomainRecord findById(String eventId) {
        synchronized (pending) {
            DomainRecord staged = pending.get(eventId);
            if (staged != null) {
                return staged;
            }
        }
        List<DomainRecord> rows = jdbc.query(SELECT_BY_ID_SQL, recordMapper(), eventId);
        return rows.isEmpty() ? null : rows.get(0);
    }

    @Override
    public boolean save(DomainRecord record) {
        synchronized (pending) {
            return pending.putIfAbsent(record.getEventId(), record) == null;
        }
    }

    @Override
    public int flush() {
        List<DomainRecord> batch;
        synchronized (pending) {
            if (pending.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(pending.values());
            pending.clear();
        }

        int inserted = 0;
        for (int count : insertBatch(batch)) {
            inserted += count > 0 || count == Statement.SUCCESS_NO_INFO ? 1 : 0;
        }
        logger.debug("Flushed {} record(s), {} inserted", batch.size(), inserted);
        return inserted;
    }

    int[] insertBatch(List<DomainRecord> records) {
        long now = clock.millis();
        try {
            return tx.execute(status -> jdbc.batchUpdate(
                INSERT_SQL,
                new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        bind(ps, records.get(i), now);
                    }

                    @Override
                    public int getBatchSize() {
                        return records.size();
                    }
                }));
        } catch (DataAccessException ex) {
            if (isDuplicateKey(ex)) {
                logger.debug("Batch of {} hit an already stored id, inserting row by row", records.size());
            } else {
                logger.warn("Batch insert of {} record(s) failed, inserting row by row: {}",
                        records.size(), ex.getMostSpecificCause().getMessage());
            }
            return insertRows(records, now);
        }
    }

    /**
     * Insert each record on its own. Ids already stored count as 0, refused rows as
     * {@link Statement#EXECUTE_FAILED}.
     */
    private int[] insertRows(List<DomainRecord> records, long now) {
        int[] out = new int[records.size()];
        for (int i = 0; i < records.size(); i++) {
            DomainRecord record = records.get(i);
            try {
                out[i] = jdbc.update(INSERT_SQL, ps -> bind(ps, record, now));
            } catch (DataAccessException rowEx) {
                if (isDuplicateKey(rowEx)) {
                    logger.debug("Event {} already stored", record.getEvent().getShortId());
                    out[i] = 0;
                } else {
                    failed.incrementAndGet();
                    logger.error("Could not store event {} ({}): {}", record.getEvent().getShortId(),
                            record.getType(), rowEx.getMostSpecificCause().getMessage());
                    out[i] = Statement.EXECUTE_FAILED;
                }
            }
        }
        return out;
    }

    private void bind(PreparedStatement ps, DomainRecord record, long now) throws SQLException {
        Event event = record.getEvent();
        ps.setString(1, event.getId());
        ps.setString(2, event.getPubkey());
        ps.setInt(3, event.getKind());
        ps.setLong(4, event.getCreatedAt());
        ps.setString(5, event.getContent());
        ps.setString(6, writeTags(event.getTags()));
        ps.setString(7, event.getSig());
        ps.setString(8, record.getType().name());
        ps.setString(9, record.getSourceRelayUrl());
        ps.setString(10, record.getSlug());
        ps.setString(11, record.getCoordinate());
        ps.setString(12, record.getRootReference());
        ps.setString(13, record.getParentReference());
        ps.setLong(14, now);
    }

    @Override
    public long failedCount() {
        return failed.get();
    }

    @Override
    public int pendingCount() {
        synchronized (pending) {
            return pending.size();
        }
    }

    @Override
    public long count() {
        Long count = jdbc.queryForObject(COUNT_SQL, Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Stored records per record type.
     */
    public Map<String, Long> countByType() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(COUNT_BY_TYPE_SQL, (RowCallbackHandler) rs -> counts.put(rs.getString(1), rs.getLong(2)));
        return counts;
    }

    private RowMapper<DomainRecord> recordMapper() {
        return (rs, rowNum) -> {
            Event event = new Event(
                rs.getString("event_id"),
                rs.getString("pubkey"),
                rs.getLong("created_at"),
                rs.getInt("kind"),
                readTags(rs.getString("tags_json")),
                rs.getString("content"),
                rs.getString("sig"));
            return mappers.map(event, rs.getString("source_relay"));
        };
    }

    private static String writeTags(List<List<String>> tags) {
        try {
            return CanonicalJson.mapper().writeValueAsString(tags);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize tags", e);
        }
    }

    private static List<List<String>> readTags(String json) {
        try {
            return CanonicalJson.mapper().readValue(json, TAGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored tags are not valid JSON", e);
        }
    }

    private static boolean isDuplicateKey(Throwable ex) {
        Throwable cur = ex;
        while (cur != null) {
            if (cur instanceof DuplicateKeyException) return true;
            if (cur instanceof SQLException) {
                String state = Objects.toString(((SQLException) cur).getSQLState(), "").trim();
                if ("23505".equals(state)) return true;
            }
            cur = cur.getCause();
        }
        return false;
    }
}
