package com.my.offers.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * 왜: 종결 결정이 내려진 메시지 식별자를 한 번만 기록해 재전달 시 중복 게시를 막기 위함.
 */
public record DedupEntry(String sourceChatId,
                         long messageId,
                         DedupOutcome outcome,
                         OptionalLong publishedTargetMessageId,
                         Instant decidedAt) {

    public DedupEntry {
        Objects.requireNonNull(sourceChatId, "sourceChatId");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(decidedAt, "decidedAt");
        publishedTargetMessageId = publishedTargetMessageId == null ? OptionalLong.empty() : publishedTargetMessageId;
        if (outcome == DedupOutcome.REJECTED && publishedTargetMessageId.isPresent()) {
            throw new IllegalArgumentException("거절된 메시지는 게시 id를 가질 수 없습니다.");
        }
    }

    public static DedupEntry rejected(CanonicalMessage message, Instant decidedAt) {
        return new DedupEntry(message.sourceChatId(), message.messageId(), DedupOutcome.REJECTED, OptionalLong.empty(), decidedAt);
    }

    public static DedupEntry published(CanonicalMessage message, OptionalLong targetMessageId, Instant decidedAt) {
        return new DedupEntry(message.sourceChatId(), message.messageId(), DedupOutcome.PUBLISHED, targetMessageId, decidedAt);
    }
}
