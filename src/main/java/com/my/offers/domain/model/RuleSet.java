package com.my.offers.domain.model;

import com.my.offers.domain.exception.ConfigurationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 왜: 점수 규칙(키워드 가중치, 가격/할인 임계값, 최소 점수)을 검증된 하나의 값으로 묶어 엔진에 전달하기 위함.
 * 키워드는 소문자로 정규화된다.
 */
public record RuleSet(Map<String, Integer> includeWeights,
                      List<String> excludeKeywords,
                      int minScore,
                      int lowPriceThreshold,
                      int midPriceThreshold,
                      int highDiscountThreshold,
                      int lowDiscountThreshold) {

    public static final int DEFAULT_LOW_PRICE = 990;
    public static final int DEFAULT_MID_PRICE = 1490;
    public static final int DEFAULT_HIGH_DISCOUNT = 40;
    public static final int DEFAULT_LOW_DISCOUNT = 25;

    public RuleSet {
        Objects.requireNonNull(includeWeights, "includeWeights");
        Objects.requireNonNull(excludeKeywords, "excludeKeywords");
        Map<String, Integer> normalized = new LinkedHashMap<>();
        includeWeights.forEach((term, weight) -> {
            String key = normalize(term);
            if (key.isEmpty()) {
                return;
            }
            if (weight == null || weight < 0) {
                throw new ConfigurationException("include 키워드 가중치가 올바르지 않습니다: " + term + "=" + weight);
            }
            normalized.merge(key, weight, Math::max);
        });
        includeWeights = Collections.unmodifiableMap(normalized);
        excludeKeywords = excludeKeywords.stream()
                .map(RuleSet::normalize)
                .filter(term -> !term.isEmpty())
                .distinct()
                .toList();
        if (lowPriceThreshold < 0 || midPriceThreshold < lowPriceThreshold) {
            throw new ConfigurationException("가격 임계값이 올바르지 않습니다: low=" + lowPriceThreshold + ", mid=" + midPriceThreshold);
        }
        if (lowDiscountThreshold < 0 || highDiscountThreshold < lowDiscountThreshold || highDiscountThreshold > 100) {
            throw new ConfigurationException("할인 임계값이 올바르지 않습니다: low=" + lowDiscountThreshold + ", high=" + highDiscountThreshold);
        }
    }

    public static RuleSet withDefaults(Map<String, Integer> includeWeights, List<String> excludeKeywords, int minScore) {
        return new RuleSet(includeWeights, excludeKeywords, minScore,
                DEFAULT_LOW_PRICE, DEFAULT_MID_PRICE, DEFAULT_HIGH_DISCOUNT, DEFAULT_LOW_DISCOUNT);
    }

    private static String normalize(String term) {
        return term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
    }
}
