package com.my.offers.domain.model;

import java.util.Objects;

/**
 * 왜: 소스별로 마지막으로 종결 결정에 도달한 메시지 id를 기록해 재시작 후 이어서 처리하기 위함.
 */
public record Cursor(String sourceChatId, long lastProcessedMessageId) {

    public Cursor {
        Objects.requireNonNull(sourceChatId, "sourceChatId");
        if (lastProcessedMessageId < 0) {
            throw new IllegalArgumentException("lastProcessedMessageId는 음수일 수 없습니다.");
        }
    }

    public static Cursor initial(String sourceChatId) {
        return new Cursor(sourceChatId, 0L);
    }

    public Cursor advanceTo(long messageId) {
        return new Cursor(sourceChatId, Math.max(lastProcessedMessageId, messageId));
    }
}
