package com.my.offers.domain.model;

import java.util.Objects;

/**
 * 왜: 원본 메시지에 붙은 미디어를 플랫폼 중립적인 핸들로 가리켜 포워딩 대상을 고정하기 위함.
 */
public record MediaRef(String sourceChatId, long messageId, String kind) {

    public MediaRef {
        Objects.requireNonNull(sourceChatId, "sourceChatId");
        Objects.requireNonNull(kind, "kind");
    }
}
