package com.my.offers.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 왜: 소스 채널별 플랫폼 메시지를 파이프라인 전체가 공유하는 불변 레코드로 고정하기 위함.
 * 식별자는 (sourceChatId, messageId) 이다.
 */
public record CanonicalMessage(String sourceChatId,
                               long messageId,
                               Instant timestamp,
                               String sourceTitle,
                               String text,
                               List<MediaRef> mediaRefs,
                               String rawPayload) {

    public CanonicalMessage {
        Objects.requireNonNull(sourceChatId, "sourceChatId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (sourceChatId.isBlank()) {
            throw new IllegalArgumentException("sourceChatId는 비어 있을 수 없습니다.");
        }
        if (messageId <= 0) {
            throw new IllegalArgumentException("messageId는 양수여야 합니다: " + messageId);
        }
        sourceTitle = sourceTitle == null || sourceTitle.isBlank() ? sourceChatId : sourceTitle;
        text = text == null ? "" : text;
        mediaRefs = mediaRefs == null ? List.of() : List.copyOf(mediaRefs);
        rawPayload = rawPayload == null ? "" : rawPayload;
    }

    public boolean hasText() {
        return !text.isBlank();
    }

    public boolean hasMedia() {
        return !mediaRefs.isEmpty();
    }

    public String identity() {
        return sourceChatId + "#" + messageId;
    }
}
