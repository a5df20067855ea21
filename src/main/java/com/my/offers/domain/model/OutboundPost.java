package com.my.offers.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 목적지 채널로 나갈 게시물(본문, 포워딩할 미디어)을 원본 메시지와 함께 묶어 Publisher에 넘기기 위함.
 */
public record OutboundPost(CanonicalMessage source, String text, List<MediaRef> media) {

    public OutboundPost {
        Objects.requireNonNull(source, "source");
        text = text == null ? "" : text;
        media = media == null ? List.of() : List.copyOf(media);
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
