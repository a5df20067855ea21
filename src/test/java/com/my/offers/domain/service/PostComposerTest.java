package com.my.offers.domain.service;

import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.MediaRef;
import com.my.offers.domain.model.OutboundPost;
import com.my.offers.domain.model.ScoreResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PostComposerTest {

    private static final ScoreResult SCORE = new ScoreResult(true, 4, Set.of("iphone"), Optional.empty(),
            List.of("include_keywords:iphone", "low_price:890"));

    private static CanonicalMessage message(String text, List<MediaRef> media) {
        return new CanonicalMessage("@deals", 3, Instant.EPOCH, "Лучшие скидки", text, media, "");
    }

    @Test
    void prepends_header_with_source_and_score() {
        PostComposer composer = new PostComposer(text -> text);

        OutboundPost post = composer.compose(message("iPhone за 890₽", List.of()), SCORE);

        assertThat(post.text()).isEqualTo("""
                🔥 Интересное предложение
                Источник: Лучшие скидки
                Score: 4 (include_keywords:iphone, low_price:890)

                iPhone за 890₽""");
    }

    @Test
    void uses_rewritten_body() {
        PostComposer composer = new PostComposer(text -> "- iPhone\n- Цена на МП: 890₽\n");

        OutboundPost post = composer.compose(message("iPhone за 890₽", List.of()), SCORE);

        assertThat(post.text()).endsWith("\n\n- iPhone\n- Цена на МП: 890₽");
    }

    @Test
    void falls_back_to_original_when_rewrite_fails_or_is_blank() {
        PostComposer failing = new PostComposer(text -> {
            throw new IllegalStateException("quota exceeded");
        });
        PostComposer blank = new PostComposer(text -> "  ");

        assertThat(failing.compose(message("iPhone за 890₽", List.of()), SCORE).text()).endsWith("iPhone за 890₽");
        assertThat(blank.compose(message("iPhone за 890₽", List.of()), SCORE).text()).endsWith("iPhone за 890₽");
    }

    @Test
    void media_only_message_keeps_header_and_media() {
        MediaRef photo = new MediaRef("-100", 3, "photo");
        PostComposer composer = new PostComposer(text -> {
            throw new AssertionError("no body to rewrite");
        });

        OutboundPost post = composer.compose(message("", List.of(photo)), SCORE);

        assertThat(post.text()).startsWith(PostComposer.HEADLINE).endsWith("low_price:890)");
        assertThat(post.media()).containsExactly(photo);
    }
}
