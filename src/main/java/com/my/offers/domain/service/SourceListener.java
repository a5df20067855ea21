package com.my.offers.domain.service;

import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.Cursor;
import com.my.offers.domain.model.RetryPolicy;
import com.my.offers.domain.port.out.ChannelFeedPort;
import com.my.offers.domain.port.out.ClockPort;
import com.my.offers.domain.port.out.CursorStorePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;

/**
 * 소스 채널 하나의 피드를 id 순서의 {@link CanonicalMessage} 흐름으로 바꿔 공용 큐에 넣는다.
 *
 * <p>읽기 위치는 저장된 커서에서 시작하며(커서 값은 제외), 재연결이나 재전달 요청이 있으면 다시 커서 값으로
 * 되돌아간다. 메모리 상의 위치는 커서 이후 이미 큐에 넣은 메시지를 반복하지 않기 위한 것뿐이다.
 */
public class SourceListener {

    private static final Logger log = Logger.getLogger(SourceListener.class);

    private static final long UNKNOWN_POSITION = -1L;

    private final String sourceChatId;
    private final ChannelFeedPort feed;
    private final CursorStorePort cursorStore;
    private final PendingRedeliveries pending;
    private final BlockingQueue<CanonicalMessage> queue;
    private final RetryPolicy reconnectBackoff;
    private final Duration pollInterval;
    private final ClockPort clock;

    private long position = UNKNOWN_POSITION;
    private int consecutiveFailures;

    public SourceListener(String sourceChatId,
                          ChannelFeedPort feed,
                          CursorStorePort cursorStore,
                          PendingRedeliveries pending,
                          BlockingQueue<CanonicalMessage> queue,
                          RetryPolicy reconnectBackoff,
                          Duration pollInterval,
                          ClockPort clock) {
        this.sourceChatId = sourceChatId;
        this.feed = feed;
        this.cursorStore = cursorStore;
        this.pending = pending;
        this.queue = queue;
        this.reconnectBackoff = reconnectBackoff;
        this.pollInterval = pollInterval;
        this.clock = clock;
    }

    public String sourceChatId() {
        return sourceChatId;
    }

    /**
     * 피드를 한 번 읽어 새 메시지를 큐에 넣는다.
     *
     * @return 다음 호출까지 기다릴 시간
     */
    public Duration poll() throws InterruptedException {
        Optional<PendingRedeliveries.Redelivery> redelivery = pending.awaitingRewind(sourceChatId);
        if (redelivery.isPresent()) {
            Instant due = redelivery.get().requestedAt().plus(reconnectBackoff.delayAfter(redelivery.get().attempts()));
            Instant now = clock.now();
            if (now.isBefore(due)) {
                return Duration.between(now, due);
            }
            position = UNKNOWN_POSITION;
        }

        if (position == UNKNOWN_POSITION) {
            position = cursorStore.find(sourceChatId).map(Cursor::lastProcessedMessageId).orElse(0L);
        }

        List<CanonicalMessage> batch;
        try {
            batch = feed.fetchAfter(sourceChatId, position);
        } catch (ListenerException e) {
            consecutiveFailures++;
            position = UNKNOWN_POSITION;
            Duration delay = reconnectBackoff.delayAfter(consecutiveFailures);
            log.warnf("소스 %s 피드 조회 실패 (%d회 연속), %dms 후 재연결: %s",
                    sourceChatId, consecutiveFailures, delay.toMillis(), e.getMessage());
            return delay;
        }
        if (consecutiveFailures > 0) {
            log.infof("소스 %s 피드 재연결됨, 커서 %d 부터 이어서 읽습니다", sourceChatId, position);
            consecutiveFailures = 0;
        }

        if (redelivery.isPresent()) {
            pending.markRewound(sourceChatId);
            releaseIfUnavailable(redelivery.get(), batch);
        }

        for (CanonicalMessage message : batch) {
            if (message.messageId() <= position) {
                continue;
            }
            queue.put(message);
            position = message.messageId();
        }
        return pollInterval;
    }

    private void releaseIfUnavailable(PendingRedeliveries.Redelivery requested, List<CanonicalMessage> batch) {
        boolean available = batch.stream().anyMatch(message -> message.messageId() == requested.messageId());
        if (!available && pending.clear(sourceChatId, requested.messageId())) {
            log.warnf("소스 %s 메시지 %d 는 플랫폼에서 더 이상 제공되지 않아 재시도를 포기합니다",
                    sourceChatId, requested.messageId());
        }
    }
}
