package com.my.offers.config;

import com.my.offers.domain.exception.ConfigurationException;
import com.my.offers.domain.model.RelayTargets;
import com.my.offers.domain.model.RetryPolicy;
import com.my.offers.domain.model.RuleSet;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 왜: 설정 매핑 값을 도메인 값(규칙 세트, 대상 채널, 재시도 정책)으로 변환하고 잘못된 값은 기동 단계에서 거부하기 위함.
 */
public final class RelaySettings {

    private static final Pattern WEIGHTED_TERM = Pattern.compile("^(.*):(\\d+)$");

    private RelaySettings() {
    }

    public static RuleSet ruleSet(AppConfig.RulesConfig rules) {
        Map<String, Integer> includeWeights = new LinkedHashMap<>();
        for (String entry : rules.includeKeywords().orElse(List.of())) {
            parseIncludeKeyword(entry, includeWeights);
        }
        List<String> exclude = rules.excludeKeywords().orElse(List.of()).stream()
                .map(String::trim)
                .filter(term -> !term.isEmpty())
                .toList();
        return new RuleSet(includeWeights, exclude, rules.minScore(),
                rules.lowPriceThreshold(), rules.midPriceThreshold(),
                rules.highDiscountThreshold(), rules.lowDiscountThreshold());
    }

    static void parseIncludeKeyword(String entry, Map<String, Integer> into) {
        String value = entry == null ? "" : entry.trim();
        if (value.isEmpty()) {
            return;
        }
        Matcher matcher = WEIGHTED_TERM.matcher(value);
        if (!matcher.matches()) {
            into.put(value, 1);
            return;
        }
        String term = matcher.group(1).trim();
        if (term.isEmpty()) {
            throw new ConfigurationException("include 키워드가 비어 있습니다: " + entry);
        }
        try {
            into.put(term, Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("include 키워드 가중치를 해석할 수 없습니다: " + entry, e);
        }
    }

    public static RelayTargets targets(AppConfig.RelayConfig relay) {
        List<String> fromFile = loadSourceChatsFromFile(Path.of(relay.targetsFile()));
        List<String> sources = fromFile.isEmpty()
                ? relay.sourceChats().orElse(List.of()).stream().map(String::trim).filter(s -> !s.isEmpty()).toList()
                : fromFile;
        if (sources.isEmpty()) {
            throw new ConfigurationException("소스 채널이 설정되지 않았습니다. " + relay.targetsFile() + " 또는 app.relay.source-chats 를 채워주세요.");
        }
        String target = relay.targetChat().map(String::trim).orElse("");
        if (target.isEmpty()) {
            throw new ConfigurationException("app.relay.target-chat 이 설정되어야 합니다.");
        }
        if (sources.contains(target)) {
            throw new ConfigurationException("목적지 채널이 소스 채널 목록에 포함되어 있습니다: " + target);
        }
        return new RelayTargets(sources.stream().distinct().toList(), target, relay.dryRun());
    }

    static List<String> loadSourceChatsFromFile(Path path) {
        if (!Files.exists(path)) {
            return List.of();
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .toList();
        } catch (IOException e) {
            throw new ConfigurationException("소스 채널 파일을 읽을 수 없습니다: " + path, e);
        }
    }

    public static RetryPolicy listenerBackoff(AppConfig.ListenerConfig listener) {
        try {
            return new RetryPolicy(Integer.MAX_VALUE,
                    Duration.ofMillis(listener.initialBackoffMillis()),
                    Duration.ofMillis(listener.maxBackoffMillis()));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("리스너 백오프 설정이 올바르지 않습니다: " + e.getMessage(), e);
        }
    }
}
