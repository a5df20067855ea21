package com.my.offers.adapter.out.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.offers.config.AppConfig;
import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.exception.PublishException;
import com.my.offers.domain.exception.PublishRejectedException;
import com.my.offers.domain.model.MediaRef;
import com.my.offers.domain.port.out.DestinationPort;
import io.smallrye.faulttolerance.api.CustomBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 텔레그램 Bot API 호출(getUpdates, sendMessage, forwardMessage)을 캡슐화해 포트 구현을 단순화하기 위함.
 *
 * <p>게시 호출의 일시적 실패는 Fault Tolerance 인터셉터가 {@link TelegramRetryBackoff} 간격으로 재시도한다.
 * 횟수와 초기 지연은 {@code com.my.offers.adapter.out.telegram.TelegramBotClient/sendText/Retry/maxRetries} 형식의
 * 설정으로 바꿀 수 있다.
 */
@ApplicationScoped
public class TelegramBotClient implements DestinationPort {

    private static final Logger log = Logger.getLogger(TelegramBotClient.class);

    static final int MAX_TEXT_LENGTH = 4096;
    static final List<String> MEDIA_FIELDS = List.of("photo", "video", "document", "animation", "audio", "voice", "video_note");
    private static final String ALLOWED_UPDATES = "[\"channel_post\",\"message\"]";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;

    @Inject
    public TelegramBotClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper,
                appConfig.telegram().botToken()
                        .filter(token -> !token.isBlank())
                        .map(token -> appConfig.telegram().apiBaseUrl() + "/bot" + token)
                        .orElse(""));
    }

    TelegramBotClient(HttpClient httpClient, ObjectMapper objectMapper, String apiBase) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
    }

    public boolean isConfigured() {
        return !apiBase.isBlank();
    }

    UpdateBatch fetchUpdates(long offset, int timeoutSeconds) {
        if (!isConfigured()) {
            throw new ListenerException("텔레그램 봇 토큰이 설정되지 않았습니다.");
        }
        String url = apiBase + "/getUpdates?timeout=" + timeoutSeconds
                + "&allowed_updates=" + URLEncoder.encode(ALLOWED_UPDATES, StandardCharsets.UTF_8)
                + (offset > 0 ? "&offset=" + offset : "");
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds + 5L))
                .GET()
                .build();
        JsonNode body;
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            body = objectMapper.readTree(response.body());
            if (response.statusCode() >= 400 || !body.path("ok").asBoolean(false)) {
                throw new ListenerException("getUpdates 실패 status=" + response.statusCode()
                        + " description=" + body.path("description").asText(""));
            }
        } catch (IOException e) {
            throw new ListenerException("getUpdates 호출 중 예외: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ListenerException("getUpdates 호출 중 인터럽트", e);
        }

        long nextOffset = offset;
        List<ChannelPost> posts = new ArrayList<>();
        for (JsonNode update : body.path("result")) {
            long updateId = update.path("update_id").asLong(-1);
            nextOffset = Math.max(nextOffset, updateId + 1);
            JsonNode message = update.has("channel_post") ? update.path("channel_post") : update.path("message");
            toChannelPost(updateId, message).ifPresent(posts::add);
        }
        return new UpdateBatch(nextOffset, posts);
    }

    Optional<ChannelPost> toChannelPost(long updateId, JsonNode message) {
        if (message.isMissingNode() || message.isNull()) {
            return Optional.empty();
        }
        JsonNode chat = message.path("chat");
        long chatId = chat.path("id").asLong(0);
        long messageId = message.path("message_id").asLong(0);
        if (chatId == 0 || messageId <= 0) {
            return Optional.empty();
        }
        String text = message.hasNonNull("text")
                ? message.path("text").asText("")
                : message.path("caption").asText("");
        List<String> mediaKinds = MEDIA_FIELDS.stream().filter(message::hasNonNull).toList();
        String title = chat.hasNonNull("title") ? chat.path("title").asText() : null;
        String username = chat.hasNonNull("username") ? chat.path("username").asText() : null;
        Instant date = Instant.ofEpochSecond(message.path("date").asLong(0));
        return Optional.of(new ChannelPost(updateId, chatId, username, title, messageId, date, text, mediaKinds, message.toString()));
    }

    @Override
    @Retry(maxRetries = 4, delay = 1000, jitter = 0, maxDuration = 10, durationUnit = ChronoUnit.MINUTES,
            retryOn = PublishException.class, abortOn = PublishRejectedException.class)
    @CustomBackoff(TelegramRetryBackoff.class)
    public long sendText(String destinationChat, String text) {
        return call("sendMessage", new SendMessageRequest(destinationChat, truncate(text), true));
    }

    static String truncate(String text) {
        if (text.length() <= MAX_TEXT_LENGTH) {
            return text;
        }
        int cut = MAX_TEXT_LENGTH - 1;
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut) + "…";
    }

    @Override
    @Retry(maxRetries = 4, delay = 1000, jitter = 0, maxDuration = 10, durationUnit = ChronoUnit.MINUTES,
            retryOn = PublishException.class, abortOn = PublishRejectedException.class)
    @CustomBackoff(TelegramRetryBackoff.class)
    public long forward(String destinationChat, MediaRef media) {
        return call("forwardMessage", new ForwardMessageRequest(destinationChat, media.sourceChatId(), media.messageId()));
    }

    private long call(String method, Object payload) {
        if (!isConfigured()) {
            throw PublishException.permanentFailure("텔레그램 봇 토큰이 설정되지 않아 " + method + " 를 호출할 수 없습니다.");
        }
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + "/" + method))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(15))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw PublishException.transientFailure(method + " 호출 중 예외: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw PublishException.transientFailure(method + " 호출 중 인터럽트", e);
        }
        ApiResponse body = parse(method, response);
        if (response.statusCode() < 400 && body.ok() && body.result() != null) {
            return body.result().path("message_id").asLong(0);
        }
        throw classify(method, response.statusCode(), body);
    }

    private ApiResponse parse(String method, HttpResponse<String> response) {
        ApiResponse body;
        try {
            body = objectMapper.readValue(response.body(), ApiResponse.class);
        } catch (JsonProcessingException e) {
            if (response.statusCode() >= 500 || response.statusCode() == 429) {
                return new ApiResponse(false, response.statusCode(), response.body(), null, null);
            }
            throw PublishException.transientFailure(method + " 응답을 해석할 수 없습니다 status=" + response.statusCode(), e);
        }
        if (body == null) {
            throw PublishException.transientFailure(method + " 응답 본문이 비어 있습니다 status=" + response.statusCode(), null);
        }
        return body;
    }

    static PublishException classify(String method, int status, ApiResponse body) {
        int code = body.errorCode() != null ? body.errorCode() : status;
        String description = method + " 실패 code=" + code + " description=" + body.description();
        if (code == 429) {
            int retryAfter = body.parameters() == null ? 0 : body.parameters().path("retry_after").asInt(0);
            log.warnf("텔레그램 전송 속도 제한: %d초 후 재시도 가능", retryAfter);
            return PublishException.rateLimited(description, Duration.ofSeconds(retryAfter));
        }
        if (code >= 500 || code < 400) {
            return PublishException.transientFailure(description, null);
        }
        return PublishException.permanentFailure(description);
    }

    record UpdateBatch(long nextOffset, List<ChannelPost> posts) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SendMessageRequest(@JsonProperty("chat_id") String chatId,
                                      @JsonProperty("text") String text,
                                      @JsonProperty("disable_web_page_preview") Boolean disableWebPagePreview) {
    }

    private record ForwardMessageRequest(@JsonProperty("chat_id") String chatId,
                                         @JsonProperty("from_chat_id") String fromChatId,
                                         @JsonProperty("message_id") long messageId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiResponse(@JsonProperty("ok") boolean ok,
                       @JsonProperty("error_code") Integer errorCode,
                       @JsonProperty("description") String description,
                       @JsonProperty("parameters") JsonNode parameters,
                       @JsonProperty("result") JsonNode result) {
    }
}
