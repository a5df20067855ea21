package com.my.offers.adapter.out.state;

import com.my.offers.domain.model.Cursor;
import com.my.offers.domain.model.DedupEntry;
import com.my.offers.domain.port.out.CursorStorePort;
import com.my.offers.domain.port.out.DedupLedgerPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.state.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryStateStore implements CursorStorePort, DedupLedgerPort {

    private final Map<String, Cursor> cursors = new ConcurrentHashMap<>();
    private final Map<String, DedupEntry> ledger = new ConcurrentHashMap<>();

    @Override
    public Optional<Cursor> find(String sourceChatId) {
        return Optional.ofNullable(cursors.get(sourceChatId));
    }

    @Override
    public Cursor advance(String sourceChatId, long messageId) {
        return cursors.merge(sourceChatId, new Cursor(sourceChatId, messageId),
                (existing, proposed) -> existing.advanceTo(proposed.lastProcessedMessageId()));
    }

    @Override
    public Optional<DedupEntry> find(String sourceChatId, long messageId) {
        return Optional.ofNullable(ledger.get(key(sourceChatId, messageId)));
    }

    @Override
    public boolean record(DedupEntry entry) {
        return ledger.putIfAbsent(key(entry.sourceChatId(), entry.messageId()), entry) == null;
    }

    public int ledgerSize() {
        return ledger.size();
    }

    private static String key(String sourceChatId, long messageId) {
        return sourceChatId + "#" + messageId;
    }
}
