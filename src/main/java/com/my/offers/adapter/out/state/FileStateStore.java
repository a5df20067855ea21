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
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: DB 없이도 재시작 후 상태를 복원할 수 있도록 커서와 원장을 추가 전용 로그 파일로 남기기 위함.
 *
 * <p>기동 시 두 로그를 재생해 메모리에 올린다. 커서는 소스별 최댓값, 원장은 식별자별 첫 항목이 유효하다.
 * 마지막 줄이 줄바꿈 없이 끊겨 있으면 중단된 쓰기로 보고 잘라낸다.
 */
@IfBuildProperty(name = "app.state.backend", stringValue = "file")
@ApplicationScoped
public class FileStateStore implements CursorStorePort, DedupLedgerPort {

    private static final Logger log = Logger.getLogger(FileStateStore.class);

    static final String CURSOR_LOG = "cursors.log";
    static final String DEDUP_LOG = "dedup.log";
    private static final String SEPARATOR = "\t";
    private static final String NO_TARGET = "-";

    private final Path cursorLog;
    private final Path dedupLog;
    private final Map<String, Cursor> cursors = new ConcurrentHashMap<>();
    private final Map<String, DedupEntry> ledger = new ConcurrentHashMap<>();
    private final ClockPort clock;

    @Inject
    public FileStateStore(AppConfig appConfig, ClockPort clock) {
        this(Path.of(appConfig.state().directory()), clock);
    }

    FileStateStore(Path directory, ClockPort clock) {
        this.clock = clock;
        this.cursorLog = directory.resolve(CURSOR_LOG);
        this.dedupLog = directory.resolve(DEDUP_LOG);
        try {
            Files.createDirectories(directory);
            for (Path path : List.of(cursorLog, dedupLog)) {
                if (!Files.exists(path)) {
                    Files.createFile(path);
                }
            }
        } catch (IOException e) {
            throw new StateStoreException("상태 디렉터리 초기화 실패: " + directory, e);
        }
        for (String line : readValidLines(cursorLog)) {
            Cursor cursor = parseCursor(line);
            cursors.merge(cursor.sourceChatId(), cursor, (existing, replayed) -> existing.advanceTo(replayed.lastProcessedMessageId()));
        }
        for (String line : readValidLines(dedupLog)) {
            DedupEntry entry = parseEntry(line);
            ledger.putIfAbsent(key(entry.sourceChatId(), entry.messageId()), entry);
        }
        log.infof("파일 상태 저장소 로드 완료: 커서 %d개, 원장 %d건", cursors.size(), ledger.size());
    }

    @Override
    public Optional<Cursor> find(String sourceChatId) {
        return Optional.ofNullable(cursors.get(sourceChatId));
    }

    @Override
    public synchronized Cursor advance(String sourceChatId, long messageId) {
        Cursor current = cursors.getOrDefault(sourceChatId, Cursor.initial(sourceChatId));
        Cursor next = current.advanceTo(messageId);
        if (next.equals(current) && cursors.containsKey(sourceChatId)) {
            return current;
        }
        append(cursorLog, String.join(SEPARATOR, sourceChatId, String.valueOf(next.lastProcessedMessageId()),
                String.valueOf(clock.now().toEpochMilli())));
        cursors.put(sourceChatId, next);
        return next;
    }

    @Override
    public Optional<DedupEntry> find(String sourceChatId, long messageId) {
        return Optional.ofNullable(ledger.get(key(sourceChatId, messageId)));
    }

    @Override
    public synchronized boolean record(DedupEntry entry) {
        String key = key(entry.sourceChatId(), entry.messageId());
        if (ledger.containsKey(key)) {
            return false;
        }
        String target = entry.publishedTargetMessageId().isPresent()
                ? String.valueOf(entry.publishedTargetMessageId().getAsLong())
                : NO_TARGET;
        append(dedupLog, String.join(SEPARATOR, entry.sourceChatId(), String.valueOf(entry.messageId()),
                entry.outcome().name(), target, String.valueOf(entry.decidedAt().toEpochMilli())));
        ledger.put(key, entry);
        return true;
    }

    private void append(Path path, String line) {
        try {
            Files.writeString(path, line + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND, StandardOpenOption.SYNC);
        } catch (IOException e) {
            throw new StateStoreException("상태 로그 기록 실패: " + path, e);
        }
    }

    private List<String> readValidLines(Path path) {
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (content.isEmpty()) {
                return List.of();
            }
            List<String> lines = new ArrayList<>(content.lines().filter(line -> !line.isBlank()).toList());
            if (!content.endsWith("\n") && !lines.isEmpty()) {
                String torn = lines.remove(lines.size() - 1);
                log.warnf("중단된 쓰기로 보이는 마지막 줄을 버립니다 (%s): %s", path, torn);
                Files.writeString(path, lines.isEmpty() ? "" : String.join("\n", lines) + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.SYNC);
            }
            return lines;
        } catch (IOException e) {
            throw new StateStoreException("상태 로그를 읽을 수 없습니다: " + path, e);
        }
    }

    private Cursor parseCursor(String line) {
        String[] parts = line.split(SEPARATOR, -1);
        if (parts.length != 3) {
            throw new StateStoreException("커서 로그 형식이 올바르지 않습니다: " + line);
        }
        try {
            return new Cursor(parts[0], Long.parseLong(parts[1]));
        } catch (IllegalArgumentException e) {
            throw new StateStoreException("커서 로그 형식이 올바르지 않습니다: " + line, e);
        }
    }

    private DedupEntry parseEntry(String line) {
        String[] parts = line.split(SEPARATOR, -1);
        if (parts.length != 5) {
            throw new StateStoreException("원장 로그 형식이 올바르지 않습니다: " + line);
        }
        try {
            OptionalLong target = NO_TARGET.equals(parts[3]) ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(parts[3]));
            return new DedupEntry(parts[0], Long.parseLong(parts[1]), DedupOutcome.valueOf(parts[2]), target,
                    Instant.ofEpochMilli(Long.parseLong(parts[4])));
        } catch (IllegalArgumentException e) {
            throw new StateStoreException("원장 로그 형식이 올바르지 않습니다: " + line, e);
        }
    }

    private static String key(String sourceChatId, long messageId) {
        return sourceChatId + "#" + messageId;
    }
}
