package com.tcrimer.db;

import com.tcrimer.config.Config;
import com.tcrimer.core.MonitoringEvent;
import com.tcrimer.core.MonitoringSink;
import com.tcrimer.db.mybatis.MetadataMapper;
import com.tcrimer.db.mybatis.MyBatisSupport;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Planner statistics refresh (and optionally space reclaim) on the authoritative backend.
 * <p>
 * The last run is recorded in that backend's {@code metadata} table; {@link #runIfDue()} skips
 * while the previous run is younger than the configured interval.
 */
public final class DatabaseMaintenance {
    private static final Logger log = LogManager.getLogger(DatabaseMaintenance.class);
    static final String LAST_RUN_KEY = "maintenance_last_run";

    private final DataStore store;
    private final Clock clock;
    private final Duration minInterval;
    private final MonitoringSink sink;

    public DatabaseMaintenance(DataStore store, Clock clock, Duration minInterval, MonitoringSink sink) {
        this.store = store;
        this.clock = clock;
        this.minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
        this.sink = sink == null ? MonitoringSink.noop() : sink;
    }

    public static DatabaseMaintenance fromConfig(DataStore store, Config config, Clock clock, MonitoringSink sink) {
        return new DatabaseMaintenance(store, clock,
                Duration.ofHours(Math.max(0L, config.getLong("maintenance.min_interval_hours"))), sink);
    }

    public record Report(boolean skipped, BackendKind backend, String product, List<String> statements,
                         long elapsedMillis, Instant lastRun) {
    }

    public Report runIfDue() throws SQLException {
        Optional<Instant> last = lastRun();
        Instant now = clock.instant();
        if (last.isPresent() && now.isBefore(last.get().plus(minInterval))) {
            log.info("maintenance skipped last_run={} next_due={}", last.get(), last.get().plus(minInterval));
            return new Report(true, store.authoritative(), "", List.of(), 0L, last.get());
        }
        return run(false);
    }

    /**
     * @param reclaim also run VACUUM, which rewrites the database file on SQLite
     */
    public Report run(boolean reclaim) throws SQLException {
        long began = System.nanoTime();
        Instant now = clock.instant();
        Executed executed = store.withConnection(conn -> {
            String name = conn.getMetaData().getDatabaseProductName();
            List<String> planned = statementsFor(name, reclaim);
            try (Statement st = conn.createStatement()) {
                for (String sql : planned) {
                    st.execute(sql);
                }
            }
            writeLastRun(conn, now);
            return new Executed(name, planned);
        });
        long elapsed = (System.nanoTime() - began) / 1_000_000L;
        String product = executed.product();
        List<String> statements = executed.statements();
        BackendKind backend = store.authoritative();
        log.info("maintenance done backend={} product={} statements={} elapsed_ms={}",
                backend, product, statements, elapsed);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("backend", backend.name());
        fields.put("product", product);
        fields.put("statements", String.join("; ", statements));
        fields.put("elapsed_ms", elapsed);
        sink.publish(MonitoringEvent.of(MonitoringEvent.MAINTENANCE, fields));
        return new Report(false, backend, product, statements, elapsed, now);
    }

    private record Executed(String product, List<String> statements) {
    }

    public Optional<Instant> lastRun() throws SQLException {
        String raw = store.withConnection(conn -> {
            try (SqlSession session = MyBatisSupport.openSession(conn)) {
                return session.getMapper(MetadataMapper.class).selectValue(LAST_RUN_KEY);
            } catch (PersistenceException e) {
                throw MyBatisSupport.toSqlException(e);
            }
        });
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(raw.trim()));
        } catch (DateTimeParseException e) {
            log.warn("ignoring malformed maintenance marker value={}", raw);
            return Optional.empty();
        }
    }

    static List<String> statementsFor(String product, boolean reclaim) {
        boolean sqlite = product != null && product.toLowerCase(Locale.ROOT).contains("sqlite");
        if (sqlite) {
            return reclaim ? List.of("VACUUM", "ANALYZE") : List.of("ANALYZE", "PRAGMA optimize");
        }
        return reclaim ? List.of("VACUUM ANALYZE") : List.of("ANALYZE");
    }

    private static void writeLastRun(Connection conn, Instant at) throws SQLException {
        try (SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(MetadataMapper.class).upsertValue(LAST_RUN_KEY, at.toString(), at.toString());
            session.commit();
        } catch (PersistenceException e) {
            throw MyBatisSupport.toSqlException(e);
        }
    }
}
