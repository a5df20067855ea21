package com.my.offers.domain.service;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 게시물 본문에서 가격과 할인율을 뽑아내는 순수 유틸리티.
 *
 * <p>여러 값이 있으면 채택에 가장 유리한 값(최저가, 최대 할인)을 고른다. 해석할 수 없는 숫자는 무시하며
 * 예외를 던지지 않는다.
 */
public final class OfferNumberExtractor {

    private static final String SPACES = "[ \\u00A0\\u202F\\u2009]";

    private static final Pattern PRICE = Pattern.compile(
            "(?<![\\d.,])(\\d{1,3}(?:(?:" + SPACES + "|[.,])\\d{3})+|\\d+)(?:[.,](\\d{1,2}))?(?![\\d])"
                    + SPACES + "?(?:₽|руб|р\\.|р(?![а-яё])|rub)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern DISCOUNT_PREFIXED = Pattern.compile(
            "(?:[-−–]" + SPACES + "?|(?:скидк[а-яё]*|discount|sale)[^\\d%\\n]{0,15})(\\d{1,3}(?:[.,]\\d{1,2})?)" + SPACES + "?%",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern DISCOUNT_SUFFIXED = Pattern.compile(
            "(?<![\\d.,])(\\d{1,3}(?:[.,]\\d{1,2})?)" + SPACES + "?%" + SPACES + "?(?:скидк|off|discount)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private OfferNumberExtractor() {
    }

    public static Optional<BigDecimal> lowestPrice(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        BigDecimal lowest = null;
        Matcher matcher = PRICE.matcher(text);
        while (matcher.find()) {
            Optional<BigDecimal> price = parsePrice(matcher.group(1), matcher.group(2));
            if (price.isPresent() && (lowest == null || price.get().compareTo(lowest) < 0)) {
                lowest = price.get();
            }
        }
        return Optional.ofNullable(lowest);
    }

    public static Optional<BigDecimal> highestDiscount(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        BigDecimal highest = null;
        for (Pattern pattern : new Pattern[]{DISCOUNT_PREFIXED, DISCOUNT_SUFFIXED}) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                Optional<BigDecimal> discount = parseDiscount(matcher.group(1));
                if (discount.isPresent() && (highest == null || discount.get().compareTo(highest) > 0)) {
                    highest = discount.get();
                }
            }
        }
        return Optional.ofNullable(highest);
    }

    static Optional<BigDecimal> parsePrice(String integerPart, String fractionPart) {
        String digits = integerPart.replaceAll("[^\\d]", "");
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        try {
            BigDecimal value = fractionPart == null
                    ? new BigDecimal(digits)
                    : new BigDecimal(digits + "." + fractionPart);
            return value.signum() > 0 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    static Optional<BigDecimal> parseDiscount(String raw) {
        try {
            BigDecimal value = new BigDecimal(raw.replace(',', '.'));
            if (value.signum() <= 0 || value.compareTo(HUNDRED) >= 0) {
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
