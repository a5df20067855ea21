package com.my.offers.adapter.out.telegram;

import com.my.offers.config.AppConfig;
import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.model.RelayTargets;
import com.my.offers.domain.port.out.CursorStorePort;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 텔레그램 업데이트를 주기적으로 롱폴링해 채널 피드 버퍼를 채우는 작업 스케줄러가 필요하기 때문.
 *
 * <p>getUpdates의 offset은 그 앞의 업데이트를 모두 확정한다. 그래서 offset은 소스 커서가 아직 넘지 않은
 * 가장 오래된 버퍼 게시물에서 멈추고, 결정이 끝난 만큼만 앞으로 나간다.
 */
@Startup
@ApplicationScoped
public class TelegramUpdatePoller {

    private static final Logger log = Logger.getLogger(TelegramUpdatePoller.class);

    private final TelegramBotClient botClient;
    private final TelegramChannelFeed feed;
    private final CursorStorePort cursorStore;
    private final RelayTargets targets;
    private final long pollIntervalMillis;
    private final int pollTimeoutSeconds;
    private ScheduledExecutorService executor;
    private volatile long offset = 0L;
    private volatile boolean warnedUnconfigured;

    @Inject
    public TelegramUpdatePoller(TelegramBotClient botClient,
                                TelegramChannelFeed feed,
                                CursorStorePort cursorStore,
                                RelayTargets targets,
                                AppConfig appConfig) {
        this.botClient = botClient;
        this.feed = feed;
        this.cursorStore = cursorStore;
        this.targets = targets;
        this.pollIntervalMillis = appConfig.telegram().pollIntervalMillis();
        this.pollTimeoutSeconds = appConfig.telegram().pollTimeoutSeconds();
    }

    @PostConstruct
    void start() {
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "telegram-poller");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::pollSafely, 0, pollIntervalMillis, TimeUnit.MILLISECONDS);
    }

    void pollSafely() {
        if (!botClient.isConfigured()) {
            if (!warnedUnconfigured) {
                log.warn("텔레그램 봇 토큰이 설정되지 않아 업데이트 폴링을 건너뜁니다.");
                warnedUnconfigured = true;
            }
            return;
        }
        try {
            TelegramBotClient.UpdateBatch batch = botClient.fetchUpdates(offset, pollTimeoutSeconds);
            feed.accept(batch.posts());
            feed.markHealthy();
            OptionalLong undecided = feed.oldestUndecidedUpdate(targets.sourceChats(), cursorStore);
            offset = undecided.isPresent() ? Math.min(batch.nextOffset(), undecided.getAsLong()) : batch.nextOffset();
        } catch (ListenerException e) {
            feed.markFailure(e.getMessage());
            log.warnf("텔레그램 폴링 실패: %s", e.getMessage());
        } catch (RuntimeException e) {
            feed.markFailure(e.getMessage());
            log.errorf(e, "텔레그램 폴링 중 예상치 못한 예외");
        }
    }

    long offset() {
        return offset;
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
