package com.my.offers.domain.service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 게시가 보류된 메시지를 소스별로 추적한다.
 *
 * <p>오케스트레이터가 보류를 표시하면 해당 소스의 더 큰 id 메시지는 결정되지 않고 미뤄지며, 리스너는 저장된
 * 커서부터 다시 읽어 보류된 메시지를 재전달한다. 소스당 보류 항목은 최대 하나다.
 */
public class PendingRedeliveries {

    public record Redelivery(long messageId, int attempts, Instant requestedAt, boolean rewound) {
    }

    private final Map<String, Redelivery> bySource = new ConcurrentHashMap<>();

    public Redelivery markPending(String sourceChatId, long messageId, Instant now) {
        return bySource.compute(sourceChatId, (key, existing) -> {
            int attempts = existing != null && existing.messageId() == messageId ? existing.attempts() + 1 : 1;
            return new Redelivery(messageId, attempts, now, false);
        });
    }

    public boolean blocks(String sourceChatId, long messageId) {
        Redelivery redelivery = bySource.get(sourceChatId);
        return redelivery != null && messageId > redelivery.messageId();
    }

    public Optional<Redelivery> find(String sourceChatId) {
        return Optional.ofNullable(bySource.get(sourceChatId));
    }

    public Optional<Redelivery> awaitingRewind(String sourceChatId) {
        return find(sourceChatId).filter(redelivery -> !redelivery.rewound());
    }

    public void markRewound(String sourceChatId) {
        bySource.computeIfPresent(sourceChatId, (key, existing) ->
                new Redelivery(existing.messageId(), existing.attempts(), existing.requestedAt(), true));
    }

    /**
     * @return 해당 id의 보류 항목을 지웠으면 true
     */
    public boolean clear(String sourceChatId, long messageId) {
        Redelivery existing = bySource.get(sourceChatId);
        return existing != null && existing.messageId() == messageId && bySource.remove(sourceChatId, existing);
    }

    public int size() {
        return bySource.size();
    }
}
