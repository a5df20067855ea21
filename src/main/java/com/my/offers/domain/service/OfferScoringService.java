package com.my.offers.domain.service;

import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RuleSet;
import com.my.offers.domain.model.ScoreResult;
import com.my.offers.domain.port.in.ScoreOfferUseCase;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 왜: 키워드, 가격, 할인 규칙으로 게시물의 흥미도를 결정적으로 계산하기 위함. I/O와 상태가 없다.
 */
public class OfferScoringService implements ScoreOfferUseCase {

    static final int STRONG_BONUS = 2;
    static final int WEAK_BONUS = 1;

    @Override
    public ScoreResult evaluate(CanonicalMessage message, RuleSet rules) {
        String text = message.text();
        String normalized = text.toLowerCase(Locale.ROOT);

        // 제외 키워드는 다른 모든 점수보다 우선한다
        for (String excluded : rules.excludeKeywords()) {
            if (normalized.contains(excluded)) {
                return ScoreResult.excluded(excluded);
            }
        }

        List<String> reasons = new ArrayList<>();
        if (text.isBlank()) {
            reasons.add("empty_text");
        }
        int score = 0;

        TreeSet<String> matched = new TreeSet<>();
        for (Map.Entry<String, Integer> include : rules.includeWeights().entrySet()) {
            if (normalized.contains(include.getKey())) {
                matched.add(include.getKey());
                score += include.getValue();
            }
        }
        if (!matched.isEmpty()) {
            reasons.add("include_keywords:" + String.join(",", matched));
        }

        Optional<BigDecimal> price = OfferNumberExtractor.lowestPrice(text);
        if (price.isPresent()) {
            BigDecimal lowest = price.get();
            if (lowest.compareTo(BigDecimal.valueOf(rules.lowPriceThreshold())) <= 0) {
                score += STRONG_BONUS;
                reasons.add("low_price:" + plain(lowest));
            } else if (lowest.compareTo(BigDecimal.valueOf(rules.midPriceThreshold())) <= 0) {
                score += WEAK_BONUS;
                reasons.add("mid_price:" + plain(lowest));
            }
        }

        Optional<BigDecimal> discount = OfferNumberExtractor.highestDiscount(text);
        if (discount.isPresent()) {
            BigDecimal highest = discount.get();
            if (highest.compareTo(BigDecimal.valueOf(rules.highDiscountThreshold())) >= 0) {
                score += STRONG_BONUS;
                reasons.add("big_discount:" + plain(highest));
            } else if (highest.compareTo(BigDecimal.valueOf(rules.lowDiscountThreshold())) >= 0) {
                score += WEAK_BONUS;
                reasons.add("discount:" + plain(highest));
            }
        }

        boolean accepted = score >= rules.minScore();
        if (!accepted) {
            reasons.add("below_min_score");
        }
        return new ScoreResult(accepted, score, matched, Optional.empty(), reasons);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
