package com.my.offers.domain.port.out;

/**
 * 왜: 게시 본문 재작성 공급자(LLM 등)를 도메인에서 분리하기 위함. 실패 시 원문을 그대로 돌려준다.
 */
public interface OfferRewritePort {
    String rewrite(String originalText);
}
