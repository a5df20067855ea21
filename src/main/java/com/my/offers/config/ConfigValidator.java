package com.my.offers.config;

import com.my.offers.domain.exception.ConfigurationException;
import com.my.offers.domain.model.RelayTargets;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        RelaySettings.ruleSet(appConfig.rules());
        RelaySettings.listenerBackoff(appConfig.listener());
        RelayTargets targets = RelaySettings.targets(appConfig.relay());

        validatePositive("app.relay.queue-capacity", appConfig.relay().queueCapacity());
        validatePositive("app.relay.poll-interval-millis", appConfig.relay().pollIntervalMillis());
        validatePositive("app.telegram.buffer-size", appConfig.telegram().bufferSize());
        validatePositive("app.telegram.poll-timeout-seconds", appConfig.telegram().pollTimeoutSeconds());
        validateRequired("app.telegram.bot-token", appConfig.telegram().botToken().orElse(null), !targets.dryRun());
        if (appConfig.rewrite().enabled()) {
            validateRequired("app.openai.api-key", appConfig.openai().apiKey().orElse(null), true);
        }
        log.infof("설정 검증 완료: 소스 %d개, 목적지 %s, dry-run=%s",
                targets.sourceChats().size(), targets.destinationChat(), targets.dryRun());
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new ConfigurationException(message);
            }
            log.warn(message);
        }
    }

    private void validatePositive(String name, long value) {
        if (value <= 0) {
            throw new ConfigurationException("양수여야 하는 설정입니다: " + name + "=" + value);
        }
    }
}
