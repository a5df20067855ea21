package com.my.offers.adapter.out.telegram;

import com.my.offers.adapter.out.state.InMemoryStateStore;
import com.my.offers.config.TestAppConfig;
import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RelayTargets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramUpdatePollerTest {

    private static final RelayTargets TARGETS = new RelayTargets(List.of("@wb_deals"), "@best", false);

    private TelegramBotClient botClient;
    private InMemoryStateStore store;
    private TelegramChannelFeed feed;
    private TelegramUpdatePoller poller;

    @BeforeEach
    void setUp() {
        botClient = mock(TelegramBotClient.class);
        store = new InMemoryStateStore();
        feed = new TelegramChannelFeed(100);
        poller = new TelegramUpdatePoller(botClient, feed, store, TARGETS, new TestAppConfig());
    }

    private static ChannelPost post(long updateId, long messageId) {
        return new ChannelPost(updateId, -1001, "wb_deals", "WB", messageId, Instant.EPOCH, "text " + messageId, List.of(), "{}");
    }

    @Test
    void buffers_updates_and_holds_offset_until_decided() {
        when(botClient.isConfigured()).thenReturn(true);
        when(botClient.fetchUpdates(anyLong(), anyInt())).thenReturn(new TelegramBotClient.UpdateBatch(91, List.of(post(90, 4))));

        poller.pollSafely();

        assertThat(poller.offset()).isEqualTo(90);
        assertThat(feed.fetchAfter("@wb_deals", 0)).hasSize(1);

        store.advance("@wb_deals", 4);
        poller.pollSafely();

        assertThat(poller.offset()).isEqualTo(91);
    }

    @Test
    void posts_from_other_chats_do_not_hold_the_offset() {
        ChannelPost foreign = new ChannelPost(70, -1002, "someone", "Other", 1, Instant.EPOCH, "hi", List.of(), "{}");
        when(botClient.isConfigured()).thenReturn(true);
        when(botClient.fetchUpdates(0, 30)).thenReturn(new TelegramBotClient.UpdateBatch(71, List.of(foreign)));

        poller.pollSafely();

        assertThat(poller.offset()).isEqualTo(71);
    }

    @Test
    void undecided_post_is_delivered_again_after_restart() {
        ScriptedTelegram telegram = new ScriptedTelegram(List.of(post(91, 5)));
        when(botClient.isConfigured()).thenReturn(true);
        when(botClient.fetchUpdates(anyLong(), anyInt()))
                .thenAnswer(invocation -> telegram.getUpdates(invocation.getArgument(0)));

        poller.pollSafely();
        poller.pollSafely();
        assertThat(feed.fetchAfter("@wb_deals", 0)).extracting(CanonicalMessage::messageId).containsExactly(5L);

        TelegramChannelFeed restartedFeed = new TelegramChannelFeed(100);
        TelegramUpdatePoller restarted = new TelegramUpdatePoller(botClient, restartedFeed, store, TARGETS, new TestAppConfig());
        restarted.pollSafely();

        assertThat(restartedFeed.fetchAfter("@wb_deals", 0)).extracting(CanonicalMessage::messageId).containsExactly(5L);

        store.advance("@wb_deals", 5);
        restarted.pollSafely();
        restarted.pollSafely();

        TelegramChannelFeed afterDecision = new TelegramChannelFeed(100);
        new TelegramUpdatePoller(botClient, afterDecision, store, TARGETS, new TestAppConfig()).pollSafely();
        assertThat(afterDecision.fetchAfter("@wb_deals", 0)).isEmpty();
    }

    @Test
    void failure_makes_the_feed_unavailable_until_next_success() {
        when(botClient.isConfigured()).thenReturn(true);
        when(botClient.fetchUpdates(anyLong(), anyInt()))
                .thenThrow(new ListenerException("getUpdates 실패 status=502"))
                .thenReturn(new TelegramBotClient.UpdateBatch(0, List.of()));

        poller.pollSafely();
        assertThatThrownBy(() -> feed.fetchAfter("@wb_deals", 0)).isInstanceOf(ListenerException.class);
        assertThat(poller.offset()).isZero();

        poller.pollSafely();
        assertThat(feed.fetchAfter("@wb_deals", 0)).isEmpty();
    }

    @Test
    void skips_polling_without_a_token() {
        when(botClient.isConfigured()).thenReturn(false);

        poller.pollSafely();

        verify(botClient, never()).fetchUpdates(anyLong(), anyInt());
    }

    /**
     * getUpdates의 offset 규칙을 흉내 낸다. offset보다 작은 업데이트는 확정되어 다시 오지 않는다.
     */
    private static final class ScriptedTelegram {

        private final List<ChannelPost> pending;
        private long confirmed;

        ScriptedTelegram(List<ChannelPost> updates) {
            this.pending = new ArrayList<>(updates);
        }

        TelegramBotClient.UpdateBatch getUpdates(long offset) {
            confirmed = Math.max(confirmed, offset);
            pending.removeIf(post -> post.updateId() < confirmed);
            long next = offset;
            for (ChannelPost post : pending) {
                next = Math.max(next, post.updateId() + 1);
            }
            return new TelegramBotClient.UpdateBatch(next, List.copyOf(pending));
        }
    }
}
