package com.pickshot.service;

import com.pickshot.dto.RatingCacheEntry;
import com.pickshot.entity.RatingEntity;
import com.pickshot.repository.RatingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import jakarta.annotation.PostConstruct;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable table of star ratings keyed by photo id.
 *
 * The schema is created on {@link #open()} and evolved by adding any column
 * listed in {@link #COLUMNS} that an older database lacks. Columns are never
 * dropped or changed, so opening an up-to-date database does nothing.
 */
@Service
public class RatingStore {

    private static final Logger log = LoggerFactory.getLogger(RatingStore.class);

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS ratings ("
            + "id VARCHAR(4096) PRIMARY KEY, "
            + "rating INT NOT NULL, "
            + "updated_at BIGINT NOT NULL, "
            + "source_modified_at BIGINT)";

    /** Every column the current code reads, with the type used to add it. */
    private static final Map<String, String> COLUMNS = new LinkedHashMap<>();

    static {
        COLUMNS.put("id", "VARCHAR(4096)");
        COLUMNS.put("rating", "INT DEFAULT 0 NOT NULL");
        COLUMNS.put("updated_at", "BIGINT DEFAULT 0 NOT NULL");
        COLUMNS.put("source_modified_at", "BIGINT");
    }

    private final RatingRepository ratingRepository;
    private final JdbcTemplate jdbcTemplate;

    private volatile boolean opened = false;

    public RatingStore(RatingRepository ratingRepository, JdbcTemplate jdbcTemplate) {
        this.ratingRepository = ratingRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Creates or upgrades the ratings table.
     *
     * @throws RatingStoreUnavailableException if the database cannot be used
     */
    @PostConstruct
    public void open() {
        try {
            jdbcTemplate.execute(CREATE_TABLE);
            Set<String> existing = existingColumns();
            for (Map.Entry<String, String> column : COLUMNS.entrySet()) {
                if (!existing.contains(column.getKey().toUpperCase(Locale.ROOT))) {
                    jdbcTemplate.execute("ALTER TABLE ratings ADD COLUMN " + column.getKey() + " " + column.getValue());
                    log.info("Added missing column '{}' to ratings table", column.getKey());
                }
            }
            opened = true;
            log.info("Ratings store ready ({} entries)", ratingRepository.count());
        } catch (DataAccessException e) {
            throw new RatingStoreUnavailableException("Failed to open ratings database: " + e.getMessage(), e);
        }
    }

    /**
     * Returns every stored entry keyed by photo id.
     */
    @Transactional(readOnly = true)
    public Map<String, RatingCacheEntry> getAll() {
        ensureOpen();
        Map<String, RatingCacheEntry> result = new HashMap<>();
        for (RatingEntity entity : ratingRepository.findAll()) {
            result.put(entity.getId(), toEntry(entity));
        }
        return result;
    }

    @Transactional(readOnly = true)
    public Optional<RatingCacheEntry> find(String id) {
        ensureOpen();
        return ratingRepository.findById(id).map(RatingStore::toEntry);
    }

    /**
     * Inserts or replaces the entry for {@code id}, stamping it with the
     * current time.
     *
     * @param sourceModifiedAt modification time the rating was verified
     *                         against, or null if unverified
     */
    @Transactional
    public void upsert(String id, int rating, Long sourceModifiedAt) {
        ensureOpen();
        if (rating < 0 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 0 and 5: " + rating);
        }
        long now = System.currentTimeMillis();
        if (sourceModifiedAt != null) {
            ratingRepository.upsertVerified(id, rating, now, sourceModifiedAt);
        } else {
            ratingRepository.upsertUnverified(id, rating, now);
        }
    }

    @Transactional
    public void delete(String id) {
        deleteMany(List.of(id));
    }

    @Transactional
    public void deleteMany(Collection<String> ids) {
        ensureOpen();
        if (ids.isEmpty()) {
            return;
        }
        ratingRepository.deleteByIdIn(ids);
    }

    /**
     * Moves an entry to a new id, keeping rating and timestamps. An entry
     * already stored under {@code newId} is replaced.
     */
    @Transactional
    public void renameId(String oldId, String newId) {
        ensureOpen();
        if (oldId.equals(newId) || !ratingRepository.existsById(oldId)) {
            return;
        }
        ratingRepository.deleteByIdIn(List.of(newId));
        ratingRepository.renameId(oldId, newId);
    }

    private Set<String> existingColumns() {
        List<String> names = jdbcTemplate.queryForList(
                "SELECT COLUMN_NAME FROM INFORMATION_SCHEMA.COLUMNS WHERE TABLE_NAME = 'RATINGS'", String.class);
        Set<String> result = new HashSet<>();
        for (String name : names) {
            result.add(name.toUpperCase(Locale.ROOT));
        }
        return result;
    }

    private void ensureOpen() {
        if (!opened) {
            throw new IllegalStateException("Ratings store has not been opened");
        }
    }

    private static RatingCacheEntry toEntry(RatingEntity entity) {
        return new RatingCacheEntry(entity.getRating(), entity.getUpdatedAt(), entity.getSourceModifiedAt());
    }
}
