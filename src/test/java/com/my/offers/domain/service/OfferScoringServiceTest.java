package com.my.offers.domain.service;

import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RuleSet;
import com.my.offers.domain.model.ScoreResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OfferScoringServiceTest {

    private final OfferScoringService service = new OfferScoringService();

    private static CanonicalMessage message(String text) {
        return new CanonicalMessage("@deals", 10, Instant.parse("2026-01-01T00:00:00Z"), "Deals", text, List.of(), "");
    }

    @Test
    void include_low_price_and_big_discount_add_up() {
        RuleSet rules = RuleSet.withDefaults(Map.of("#include_term", 1), List.of(), 3);

        ScoreResult result = service.evaluate(message("Скидка 50%! Цена 890₽ #include_term"), rules);

        assertThat(result.accepted()).isTrue();
        assertThat(result.score()).isEqualTo(5);
        assertThat(result.matchedIncludeTerms()).containsExactly("#include_term");
        assertThat(result.excludeHit()).isEmpty();
        assertThat(result.reasons()).containsExactly("include_keywords:#include_term", "low_price:890", "big_discount:50");
    }

    @Test
    void exclude_keyword_wins_over_everything() {
        RuleSet rules = RuleSet.withDefaults(Map.of("#include_term", 1), List.of("Б/У"), 3);

        ScoreResult result = service.evaluate(message("Скидка 50%! Цена 890₽ #include_term, состояние б/у"), rules);

        assertThat(result.accepted()).isFalse();
        assertThat(result.score()).isZero();
        assertThat(result.excludeHit()).contains("б/у");
        assertThat(result.reasons()).containsExactly("exclude_keyword:б/у");
    }

    @Test
    void lowest_price_decides_the_price_bonus() {
        RuleSet rules = RuleSet.withDefaults(Map.of(), List.of(), 2);

        ScoreResult result = service.evaluate(message("Было 1200 руб, сейчас 890 руб"), rules);

        assertThat(result.score()).isEqualTo(2);
        assertThat(result.reasons()).contains("low_price:890").doesNotContain("mid_price:1200");
        assertThat(result.accepted()).isTrue();
    }

    @Test
    void mid_price_and_small_discount_give_weak_bonuses() {
        RuleSet rules = RuleSet.withDefaults(Map.of(), List.of(), 3);

        ScoreResult result = service.evaluate(message("Кроссовки за 1 290 ₽, скидка 30%"), rules);

        assertThat(result.score()).isEqualTo(2);
        assertThat(result.accepted()).isFalse();
        assertThat(result.reasons()).containsExactly("mid_price:1290", "discount:30", "below_min_score");
    }

    @Test
    void keyword_matching_is_case_insensitive_and_weighted() {
        RuleSet rules = RuleSet.withDefaults(Map.of("airpods", 3, "наушники", 1), List.of(), 4);

        ScoreResult result = service.evaluate(message("Наушники AirPods Pro"), rules);

        assertThat(result.score()).isEqualTo(4);
        assertThat(result.accepted()).isTrue();
        assertThat(result.matchedIncludeTerms()).containsExactlyInAnyOrder("airpods", "наушники");
    }

    @Test
    void empty_text_is_scored_with_a_reason() {
        RuleSet rules = RuleSet.withDefaults(Map.of("x", 1), List.of(), 0);

        ScoreResult result = service.evaluate(message(""), rules);

        assertThat(result.accepted()).isTrue();
        assertThat(result.score()).isZero();
        assertThat(result.reasons()).containsExactly("empty_text");
    }

    @Test
    void same_input_gives_same_result() {
        RuleSet rules = RuleSet.withDefaults(Map.of("iphone", 2, "чехол", 1), List.of("подделка"), 2);
        CanonicalMessage msg = message("iPhone чехол -45% всего 499 р.");

        ScoreResult first = service.evaluate(msg, rules);
        ScoreResult second = service.evaluate(msg, rules);

        assertThat(second).isEqualTo(first);
        assertThat(first.reasonText()).isEqualTo("include_keywords:iphone,чехол, low_price:499, big_discount:45");
    }
}
