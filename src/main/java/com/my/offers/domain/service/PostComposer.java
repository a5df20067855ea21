package com.my.offers.domain.service;

import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.OutboundPost;
import com.my.offers.domain.model.ScoreResult;
import com.my.offers.domain.port.out.OfferRewritePort;
import org.jboss.logging.Logger;

/**
 * 왜: 목적지 게시물의 머리말(출처, 점수, 사유)과 본문 형식을 한 곳에서 결정하기 위함.
 */
public class PostComposer {

    private static final Logger log = Logger.getLogger(PostComposer.class);

    static final String HEADLINE = "🔥 Интересное предложение";

    private final OfferRewritePort rewritePort;

    public PostComposer(OfferRewritePort rewritePort) {
        this.rewritePort = rewritePort;
    }

    public OutboundPost compose(CanonicalMessage message, ScoreResult score) {
        String header = HEADLINE + "\n"
                + "Источник: " + message.sourceTitle() + "\n"
                + "Score: " + score.score() + " (" + score.reasonText() + ")";
        String body = message.hasText() ? rewrite(message) : "";
        String text = (header + "\n\n" + body).strip();
        return new OutboundPost(message, text, message.mediaRefs());
    }

    private String rewrite(CanonicalMessage message) {
        try {
            String rewritten = rewritePort.rewrite(message.text());
            return rewritten == null || rewritten.isBlank() ? message.text() : rewritten.strip();
        } catch (RuntimeException e) {
            log.warnf("본문 재작성 실패로 원문을 사용합니다 (%s): %s", message.identity(), e.getMessage());
            return message.text();
        }
    }
}
