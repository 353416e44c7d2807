package caseflow.coordinator.store;

import caseflow.coordinator.model.Admission;
import caseflow.coordinator.model.RateWindow;
import caseflow.coordinator.repository.RateWindowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC implementation of RateWindowRepository.
 * Window rollover and admission are both conditional updates on the row
 * observed by the caller; a zero row count means another invocation moved
 * the window first and the check is repeated against the fresh row.
 */
public class JdbcRateWindowRepository implements RateWindowRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRateWindowRepository.class);

    private static final int MAX_CAS_ROUNDS = 5;
    private static final long CONTENDED_WAIT_MS = 50;
    private static final String DUPLICATE_KEY_STATE = "23505";

    private final Database db;

    public JdbcRateWindowRepository(Database db) {
        this.db = db;
    }

    @Override
    public Admission tryAdmit(String resourceKey, long nowMillis, int requestLimit, long tokenLimit, long tokens,
            long minDelayMillis, long windowMillis) {

        String resetSql = """
                    UPDATE rate_windows
                    SET window_start = ?, request_count = 0, token_count = 0
                    WHERE resource_key = ? AND window_start = ?
                """;

        String admitSql = """
                    UPDATE rate_windows
                    SET request_count = request_count + 1, token_count = token_count + ?, last_admitted_at = ?
                    WHERE resource_key = ? AND window_start = ?
                      AND request_count + 1 <= ? AND token_count + ? <= ?
                      AND (last_admitted_at = 0 OR last_admitted_at <= ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                for (int round = 0; round < MAX_CAS_ROUNDS; round++) {
                    RateWindow window = readOrCreate(conn, resourceKey, nowMillis);

                    if (window.isExpired(nowMillis, windowMillis)) {
                        try (PreparedStatement ps = conn.prepareStatement(resetSql)) {
                            ps.setLong(1, nowMillis);
                            ps.setString(2, resourceKey);
                            ps.setLong(3, window.windowStart());
                            ps.executeUpdate();
                        }
                        conn.commit();
                        continue;
                    }

                    long sinceLast = nowMillis - window.lastAdmittedAt();
                    if (window.lastAdmittedAt() > 0 && sinceLast < minDelayMillis) {
                        return Admission.waitFor(minDelayMillis - sinceLast);
                    }

                    if (window.requestCount() + 1 > requestLimit || window.tokenCount() + tokens > tokenLimit) {
                        return Admission.waitFor(window.windowStart() + windowMillis - nowMillis);
                    }

                    int updated;
                    try (PreparedStatement ps = conn.prepareStatement(admitSql)) {
                        ps.setLong(1, tokens);
                        ps.setLong(2, nowMillis);
                        ps.setString(3, resourceKey);
                        ps.setLong(4, window.windowStart());
                        ps.setInt(5, requestLimit);
                        ps.setLong(6, tokens);
                        ps.setLong(7, tokenLimit);
                        ps.setLong(8, nowMillis - minDelayMillis);
                        updated = ps.executeUpdate();
                    }

                    if (updated == 1) {
                        conn.commit();
                        return Admission.granted();
                    }
                    conn.rollback();
                }

                log.debug("Rate window {} contended for {} rounds", resourceKey, MAX_CAS_ROUNDS);
                return Admission.waitFor(CONTENDED_WAIT_MS);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check rate window: " + resourceKey, e);
        }
    }

    @Override
    public Optional<RateWindow> find(String resourceKey) {
        try (Connection conn = db.getConnection()) {
            Optional<RateWindow> window = read(conn, resourceKey);
            conn.commit();
            return window;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read rate window: " + resourceKey, e);
        }
    }

    private RateWindow readOrCreate(Connection conn, String resourceKey, long nowMillis) throws SQLException {
        Optional<RateWindow> existing = read(conn, resourceKey);
        if (existing.isPresent()) {
            return existing.get();
        }

        String insertSql = """
                    INSERT INTO rate_windows (resource_key, window_start, request_count, token_count, last_admitted_at)
                    VALUES (?, ?, 0, 0, 0)
                """;
        try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
            ps.setString(1, resourceKey);
            ps.setLong(2, nowMillis);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            if (!DUPLICATE_KEY_STATE.equals(e.getSQLState())) {
                throw e;
            }
            conn.rollback();
            log.debug("Rate window {} created concurrently", resourceKey);
        }

        return read(conn, resourceKey)
                .orElseThrow(() -> new SQLException("Rate window vanished: " + resourceKey));
    }

    private Optional<RateWindow> read(Connection conn, String resourceKey) throws SQLException {
        String sql = """
                    SELECT resource_key, window_start, request_count, token_count, last_admitted_at
                    FROM rate_windows WHERE resource_key = ?
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, resourceKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new RateWindow(
                        rs.getString("resource_key"),
                        rs.getLong("window_start"),
                        rs.getInt("request_count"),
                        rs.getLong("token_count"),
                        rs.getLong("last_admitted_at")));
            }
        }
    }
}
