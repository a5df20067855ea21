package com.my.offers.adapter.out.llm;

import com.my.offers.config.AppConfig;
import com.my.offers.domain.port.out.OfferRewritePort;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Fallback;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * 왜: 게시 본문을 채널 문체로 다시 쓰되, 모델 호출이 실패해도 게시 자체는 원문으로 진행되게 하기 위함.
 */
@ApplicationScoped
@IfBuildProperty(name = "app.rewrite.enabled", stringValue = "true")
public class OpenAiRewriteAdapter implements OfferRewritePort {

    private static final Logger log = Logger.getLogger(OpenAiRewriteAdapter.class);

    private final OfferRewriter rewriter;

    @Inject
    public OpenAiRewriteAdapter(AppConfig appConfig) {
        OpenAiChatModel model = OpenAiChatModel.builder()
                .apiKey(appConfig.openai().apiKey().orElse(""))
                .modelName(appConfig.openai().model())
                .temperature(appConfig.openai().temperature())
                .timeout(Duration.ofSeconds(appConfig.openai().timeoutSeconds()))
                .build();
        this.rewriter = AiServices.builder(OfferRewriter.class)
                .chatLanguageModel(model)
                .build();
    }

    OpenAiRewriteAdapter(OfferRewriter rewriter) {
        this.rewriter = rewriter;
    }

    @Override
    @Retry(maxRetries = 2, delay = 1000)
    @Fallback(fallbackMethod = "keepOriginal")
    public String rewrite(String originalText) {
        String rewritten = rewriter.rewrite(originalText);
        if (rewritten == null || rewritten.isBlank()) {
            return originalText;
        }
        log.debug("본문 재작성 완료");
        return rewritten.strip();
    }

    String keepOriginal(String originalText) {
        log.warn("본문 재작성에 실패해 원문을 유지합니다");
        return originalText;
    }

    interface OfferRewriter {
        @SystemMessage("Ты редактор Telegram-канала с акцентом на короткий, чистый и продающий стиль.")
        @UserMessage("""
                Перепиши текст объявления для Telegram в едином стиле.
                Сохрани факты, цену, условия, контакты и эмодзи по смыслу.
                Не добавляй вымышленные данные. Верни только итоговый текст поста без пояснений.

                ФОРМАТ ОТВЕТА:
                - [название товара] (если есть)
                - Цена на МП: [цена без кэшбека] (если есть)
                - Цена с кэшбеком: [цена с кэшбеком] (если есть)
                - Кэшбек: [процент кэшбека]% (если есть)
                - [условия заказа + ссылка на аккаунт в телеграме] (если есть)

                Если отсутствует какой-то из пунктов, то не включай его в ответ.

                Исходный текст:
                {{text}}
                """)
        String rewrite(@V("text") String text);
    }
}
