package com.my.offers.adapter.out.state;

import com.my.offers.config.AppConfig;
import com.my.offers.domain.exception.StateStoreException;
import com.my.offers.domain.model.Cursor;
import com.my.offers.domain.model.DedupEntry;
import com.my.offers.domain.model.DedupOutcome;
import com.my.offers.domain.port.out.ClockPort;
import com.my.offers.domain.port.out.CursorStorePort;
import com.my.offers.domain.port.out.DedupLedgerPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 왜: 재시작 후에도 커서와 중복 원장이 유지되도록 파일 기반 SQLite 한 곳에 두 테이블로 보관하기 위함.
 */
@IfBuildProperty(name = "app.state.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteStateStore implements CursorStorePort, DedupLedgerPort {

    private static final String CURSOR_DDL = """
            CREATE TABLE IF NOT EXISTS relay_cursor (
                source_chat_id TEXT PRIMARY KEY,
                last_message_id INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """;

    private static final String DEDUP_DDL = """
            CREATE TABLE IF NOT EXISTS relay_dedup (
                source_chat_id TEXT NOT NULL,
                message_id INTEGER NOT NULL,
                outcome TEXT NOT NULL,
                target_message_id INTEGER,
                decided_at INTEGER NOT NULL,
                PRIMARY KEY (source_chat_id, message_id)
            )
            """;

    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";
    private static final String FULL_SYNC = "PRAGMA synchronous=FULL";

    private static final String SELECT_CURSOR_SQL = "SELECT last_message_id FROM relay_cursor WHERE source_chat_id = ?";
    private static final String ADVANCE_CURSOR_SQL = """
            INSERT INTO relay_cursor(source_chat_id, last_message_id, updated_at) VALUES (?, ?, ?)
            ON CONFLICT(source_chat_id) DO UPDATE SET
                last_message_id = MAX(relay_cursor.last_message_id, excluded.last_message_id),
                updated_at = excluded.updated_at
            """;
    private static final String SELECT_DEDUP_SQL = """
            SELECT outcome, target_message_id, decided_at FROM relay_dedup
            WHERE source_chat_id = ? AND message_id = ?
            """;
    private static final String INSERT_DEDUP_SQL = """
            INSERT OR IGNORE INTO relay_dedup(source_chat_id, message_id, outcome, target_message_id, decided_at)
            VALUES (?, ?, ?, ?, ?)
            """;

    private final DataSource dataSource;
    private final Path sqlitePath;
    private final ClockPort clock;

    public SqliteStateStore(DataSource dataSource, AppConfig appConfig, ClockPort clock) {
        this.dataSource = dataSource;
        this.sqlitePath = Path.of(appConfig.state().sqlitePath());
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StateStoreException("SQLite 경로 생성 실패: " + sqlitePath, e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(FULL_SYNC);
            stmt.execute(CURSOR_DDL);
            stmt.execute(DEDUP_DDL);
        } catch (SQLException e) {
            throw new StateStoreException("상태 테이블 초기화 실패: " + sqlitePath, e);
        }
    }

    @Override
    public Optional<Cursor> find(String sourceChatId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_CURSOR_SQL)) {
            ps.setString(1, sourceChatId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(new Cursor(sourceChatId, rs.getLong(1))) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StateStoreException("커서 조회 실패: " + sourceChatId, e);
        }
    }

    @Override
    public Cursor advance(String sourceChatId, long messageId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(ADVANCE_CURSOR_SQL)) {
            ps.setString(1, sourceChatId);
            ps.setLong(2, messageId);
            ps.setLong(3, clock.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StateStoreException("커서 전진 실패: " + sourceChatId + "#" + messageId, e);
        }
        return find(sourceChatId).orElseThrow(() -> new StateStoreException("커서 기록 후 조회 실패: " + sourceChatId));
    }

    @Override
    public Optional<DedupEntry> find(String sourceChatId, long messageId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_DEDUP_SQL)) {
            ps.setString(1, sourceChatId);
            ps.setLong(2, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                DedupOutcome outcome = DedupOutcome.valueOf(rs.getString(1));
                long target = rs.getLong(2);
                OptionalLong targetId = rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(target);
                Instant decidedAt = Instant.ofEpochMilli(rs.getLong(3));
                return Optional.of(new DedupEntry(sourceChatId, messageId, outcome, targetId, decidedAt));
            }
        } catch (SQLException | IllegalArgumentException e) {
            throw new StateStoreException("중복 원장 조회 실패: " + sourceChatId + "#" + messageId, e);
        }
    }

    @Override
    public boolean record(DedupEntry entry) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_DEDUP_SQL)) {
            ps.setString(1, entry.sourceChatId());
            ps.setLong(2, entry.messageId());
            ps.setString(3, entry.outcome().name());
            if (entry.publishedTargetMessageId().isPresent()) {
                ps.setLong(4, entry.publishedTargetMessageId().getAsLong());
            } else {
                ps.setNull(4, Types.BIGINT);
            }
            ps.setLong(5, entry.decidedAt().toEpochMilli());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new StateStoreException("중복 원장 기록 실패: " + entry.sourceChatId() + "#" + entry.messageId(), e);
        }
    }
}
