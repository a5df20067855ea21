package com.my.offers.adapter.out.telegram;

import com.my.offers.config.AppConfig;
import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.Cursor;
import com.my.offers.domain.model.MediaRef;
import com.my.offers.domain.port.out.ChannelFeedPort;
import com.my.offers.domain.port.out.CursorStorePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 왜: 봇 계정 하나로 받은 업데이트를 소스 채널별로 나눠 보관하고, 리스너가 커서 이후의 메시지를 당겨갈 수 있도록 하기 위함.
 *
 * <p>채널당 최근 {@code bufferSize}개만 보관한다. 결정되지 않은 게시물의 업데이트는 확정하지 않으므로 재시작 후
 * 텔레그램이 다시 보내준다.
 * 소스는 숫자 id, {@code @username}, {@code t.me/username} 형식으로 지정할 수 있다.
 */
@ApplicationScoped
public class TelegramChannelFeed implements ChannelFeedPort {

    private final int bufferSize;
    private final Map<Long, NavigableMap<Long, ChannelPost>> buffers = new ConcurrentHashMap<>();
    private final Map<String, Long> chatIdsByUsername = new ConcurrentHashMap<>();
    private volatile String lastFailure;

    @Inject
    public TelegramChannelFeed(AppConfig appConfig) {
        this(appConfig.telegram().bufferSize());
    }

    TelegramChannelFeed(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    void accept(Collection<ChannelPost> posts) {
        for (ChannelPost post : posts) {
            if (post.username() != null) {
                chatIdsByUsername.put(post.username().toLowerCase(Locale.ROOT), post.chatId());
            }
            NavigableMap<Long, ChannelPost> buffer = buffers.computeIfAbsent(post.chatId(), id -> new ConcurrentSkipListMap<>());
            buffer.putIfAbsent(post.messageId(), post);
            while (buffer.size() > bufferSize) {
                buffer.pollFirstEntry();
            }
        }
    }

    void markHealthy() {
        lastFailure = null;
    }

    void markFailure(String reason) {
        lastFailure = reason == null ? "unknown" : reason;
    }

    @Override
    public List<CanonicalMessage> fetchAfter(String sourceChatId, long afterMessageId) {
        String failure = lastFailure;
        if (failure != null) {
            throw new ListenerException("텔레그램 피드를 사용할 수 없습니다: " + failure);
        }
        Optional<Long> chatId = resolve(sourceChatId);
        if (chatId.isEmpty()) {
            return List.of();
        }
        NavigableMap<Long, ChannelPost> buffer = buffers.get(chatId.get());
        if (buffer == null) {
            return List.of();
        }
        return buffer.tailMap(afterMessageId, false).values().stream()
                .map(post -> toCanonical(sourceChatId, post))
                .toList();
    }

    /**
     * 소스 커서 이후에 남아 있는 버퍼 게시물 중 가장 작은 update_id. 이 값보다 앞선 업데이트만 텔레그램에 확정할 수 있다.
     * 소스가 아닌 채팅의 게시물은 결정을 기다리지 않는다.
     */
    OptionalLong oldestUndecidedUpdate(Collection<String> sources, CursorStorePort cursorStore) {
        OptionalLong oldest = OptionalLong.empty();
        for (String source : sources) {
            NavigableMap<Long, ChannelPost> buffer = resolve(source).map(buffers::get).orElse(null);
            if (buffer == null) {
                continue;
            }
            long cursor = cursorStore.find(source).map(Cursor::lastProcessedMessageId).orElse(0L);
            OptionalLong candidate = buffer.tailMap(cursor, false).values().stream()
                    .mapToLong(ChannelPost::updateId)
                    .min();
            if (candidate.isPresent() && (oldest.isEmpty() || candidate.getAsLong() < oldest.getAsLong())) {
                oldest = candidate;
            }
        }
        return oldest;
    }

    Optional<Long> resolve(String sourceChatId) {
        String ref = sourceChatId.trim();
        int linkIndex = ref.indexOf("t.me/");
        if (linkIndex >= 0) {
            ref = "@" + ref.substring(linkIndex + "t.me/".length()).replaceAll("/.*$", "");
        }
        if (ref.startsWith("@")) {
            return Optional.ofNullable(chatIdsByUsername.get(ref.substring(1).toLowerCase(Locale.ROOT)));
        }
        try {
            return Optional.of(Long.parseLong(ref));
        } catch (NumberFormatException e) {
            return Optional.ofNullable(chatIdsByUsername.get(ref.toLowerCase(Locale.ROOT)));
        }
    }

    private static CanonicalMessage toCanonical(String sourceChatId, ChannelPost post) {
        List<MediaRef> media = post.mediaKinds().isEmpty()
                ? List.of()
                : List.of(new MediaRef(String.valueOf(post.chatId()), post.messageId(), post.mediaKinds().get(0)));
        return new CanonicalMessage(sourceChatId, post.messageId(), post.date(), post.title(), post.text(), media, post.rawPayload());
    }
}
