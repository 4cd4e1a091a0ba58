package courier.spi;

import courier.model.OutcomeRecord;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence for the append-only outcome log: one row per export attempt.
 *
 * <p>All methods take an explicit {@link Connection}; transaction control stays with the
 * caller. There is no update or delete.
 *
 * @see courier.jdbc.store.AbstractJdbcOutcomeStore
 */
public interface OutcomeStore {

    /**
     * Inserts one row.
     *
     * @param conn the JDBC connection
     * @param record the row to insert; its {@code id} is ignored
     */
    void insert(Connection conn, OutcomeRecord record);

    /**
     * Inserts several rows. The default loops over {@link #insert}; JDBC stores batch them.
     */
    default void insertBatch(Connection conn, List<OutcomeRecord> records) {
        for (OutcomeRecord record : records) {
            insert(conn, record);
        }
    }

    /**
     * Returns every row for a session, oldest first.
     */
    List<OutcomeRecord> findBySession(Connection conn, String sessionIdentifier);

    /**
     * Returns the newest row per destination for a session.
     */
    List<OutcomeRecord> latestBySession(Connection conn, String sessionIdentifier);

    /**
     * Returns up to {@code limit} rows for a destination, newest first.
     */
    List<OutcomeRecord> findByDestination(Connection conn, String destinationName, int limit);
}
