package com.my.offers.config;

import com.my.offers.domain.exception.ConfigurationException;
import com.my.offers.domain.model.RelayTargets;
import com.my.offers.domain.model.RetryPolicy;
import com.my.offers.domain.model.RuleSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelaySettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void parses_weighted_and_plain_keywords() {
        TestAppConfig config = new TestAppConfig();
        config.includeKeywords = Optional.of(List.of("iPhone:3", " чехол ", "#wb:2", "time:12:30:1"));
        config.excludeKeywords = Optional.of(List.of("Б/У", " "));

        RuleSet rules = RelaySettings.ruleSet(config.rules());

        assertThat(rules.includeWeights()).containsExactly(
                Map.entry("iphone", 3), Map.entry("чехол", 1), Map.entry("#wb", 2), Map.entry("time:12:30", 1));
        assertThat(rules.excludeKeywords()).containsExactly("б/у");
        assertThat(rules.minScore()).isEqualTo(2);
        assertThat(rules.lowPriceThreshold()).isEqualTo(990);
    }

    @Test
    void weight_without_term_is_rejected() {
        Map<String, Integer> into = new LinkedHashMap<>();

        assertThatThrownBy(() -> RelaySettings.parseIncludeKeyword(":5", into))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void inverted_price_thresholds_are_rejected() {
        TestAppConfig config = new TestAppConfig();
        config.lowPriceThreshold = 2000;

        assertThatThrownBy(() -> RelaySettings.ruleSet(config.rules()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("가격 임계값");
    }

    @Test
    void targets_file_wins_over_inline_sources() throws Exception {
        Path file = tempDir.resolve("targets.txt");
        Files.writeString(file, "# 소스 채널\n@wb_deals\n\n  @ozon_deals  \n@wb_deals\n");
        TestAppConfig config = new TestAppConfig();
        config.targetsFile = file.toString();
        config.dryRun = true;

        RelayTargets targets = RelaySettings.targets(config.relay());

        assertThat(targets.sourceChats()).containsExactly("@wb_deals", "@ozon_deals");
        assertThat(targets.destinationChat()).isEqualTo("@best");
        assertThat(targets.dryRun()).isTrue();
    }

    @Test
    void falls_back_to_inline_sources() {
        TestAppConfig config = new TestAppConfig();
        config.sourceChats = Optional.of(List.of("@a", " @b ", ""));

        assertThat(RelaySettings.targets(config.relay()).sourceChats()).containsExactly("@a", "@b");
    }

    @Test
    void missing_sources_or_target_are_configuration_errors() {
        TestAppConfig noSources = new TestAppConfig();
        noSources.sourceChats = Optional.empty();
        TestAppConfig noTarget = new TestAppConfig();
        noTarget.targetChat = Optional.of("  ");
        TestAppConfig loop = new TestAppConfig();
        loop.targetChat = Optional.of("@deals");

        assertThatThrownBy(() -> RelaySettings.targets(noSources.relay())).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RelaySettings.targets(noTarget.relay())).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> RelaySettings.targets(loop.relay()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("@deals");
    }

    @Test
    void listener_backoff_settings_become_a_capped_policy() {
        TestAppConfig config = new TestAppConfig();

        RetryPolicy listener = RelaySettings.listenerBackoff(config.listener());

        assertThat(listener.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(listener.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(listener.delayAfter(20)).isEqualTo(Duration.ofMinutes(1));

        config.listenerInitialBackoffMillis = 5000;
        config.listenerMaxBackoffMillis = 1000;
        assertThatThrownBy(() -> RelaySettings.listenerBackoff(config.listener()))
                .isInstanceOf(ConfigurationException.class);
    }
}
