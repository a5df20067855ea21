package com.my.offers.adapter.in.relay;

import com.my.offers.config.AppConfig;
import com.my.offers.config.RelaySettings;
import com.my.offers.domain.exception.StateStoreException;
import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RelayTargets;
import com.my.offers.domain.model.RetryPolicy;
import com.my.offers.domain.port.in.RelayMessageUseCase;
import com.my.offers.domain.port.out.ChannelFeedPort;
import com.my.offers.domain.port.out.ClockPort;
import com.my.offers.domain.port.out.CursorStorePort;
import com.my.offers.domain.service.PendingRedeliveries;
import com.my.offers.domain.service.SourceListener;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

/**
 * 소스 리스너마다 하나의 실행 단위를 두고, 모든 리스너가 채우는 단일 큐를 한 스레드가 순서대로 소비하도록 묶는다.
 *
 * <p>상태 저장소 오류나 예상하지 못한 결정 오류가 나면 소비를 멈추고 종료 코드 1로 프로세스 종료를 요청한다.
 * 종료 시 진행 중인 게시는 끝까지 기다리며, 큐에 남은 미결정 메시지는 재시작 후 커서부터 다시 읽힌다.
 */
@Startup
@ApplicationScoped
public class RelayRuntime {

    private static final Logger log = Logger.getLogger(RelayRuntime.class);

    private static final long QUEUE_POLL_MILLIS = 200;

    public record Settings(int queueCapacity, Duration pollInterval, RetryPolicy reconnectBackoff, Duration shutdownGrace) {
    }

    public record Status(boolean running, String fatalError, int sources, int queued, int pending) {
    }

    private final RelayMessageUseCase relay;
    private final ChannelFeedPort feed;
    private final CursorStorePort cursorStore;
    private final PendingRedeliveries pending;
    private final RelayTargets targets;
    private final ClockPort clock;
    private final Settings settings;
    private final IntConsumer exitHandler;

    private final List<SourceListener> listeners = new ArrayList<>();
    private BlockingQueue<CanonicalMessage> queue;
    private ScheduledExecutorService listenerExecutor;
    private ExecutorService pipelineExecutor;
    private volatile boolean running;
    private volatile String fatalError;

    @Inject
    public RelayRuntime(RelayMessageUseCase relay,
                        ChannelFeedPort feed,
                        CursorStorePort cursorStore,
                        PendingRedeliveries pending,
                        RelayTargets targets,
                        ClockPort clock,
                        AppConfig appConfig) {
        this(relay, feed, cursorStore, pending, targets, clock,
                new Settings(appConfig.relay().queueCapacity(),
                        Duration.ofMillis(appConfig.relay().pollIntervalMillis()),
                        RelaySettings.listenerBackoff(appConfig.listener()),
                        Duration.ofSeconds(appConfig.relay().shutdownGraceSeconds())),
                Quarkus::asyncExit);
    }

    public RelayRuntime(RelayMessageUseCase relay,
                        ChannelFeedPort feed,
                        CursorStorePort cursorStore,
                        PendingRedeliveries pending,
                        RelayTargets targets,
                        ClockPort clock,
                        Settings settings,
                        IntConsumer exitHandler) {
        this.relay = relay;
        this.feed = feed;
        this.cursorStore = cursorStore;
        this.pending = pending;
        this.targets = targets;
        this.clock = clock;
        this.settings = settings;
        this.exitHandler = exitHandler;
    }

    @PostConstruct
    public void start() {
        queue = new ArrayBlockingQueue<>(settings.queueCapacity());
        for (String source : targets.sourceChats()) {
            listeners.add(new SourceListener(source, feed, cursorStore, pending, queue,
                    settings.reconnectBackoff(), settings.pollInterval(), clock));
        }
        running = true;
        listenerExecutor = Executors.newScheduledThreadPool(Math.max(1, listeners.size()), named("source-listener-"));
        pipelineExecutor = Executors.newSingleThreadExecutor(named("relay-pipeline-"));
        pipelineExecutor.execute(this::consume);
        for (SourceListener listener : listeners) {
            schedule(listener, Duration.ZERO);
        }
        log.infof("릴레이 시작: 소스 %s -> %s (dry-run=%s)", targets.sourceChats(), targets.destinationChat(), targets.dryRun());
    }

    private void schedule(SourceListener listener, Duration delay) {
        if (!running) {
            return;
        }
        try {
            listenerExecutor.schedule(() -> listen(listener), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debugf("리스너 %s 스케줄 중단 (종료 중)", listener.sourceChatId());
        }
    }

    private void listen(SourceListener listener) {
        Duration next = settings.pollInterval();
        try {
            next = listener.poll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (StateStoreException e) {
            fail("소스 " + listener.sourceChatId() + " 커서 조회 실패", e);
            return;
        } catch (RuntimeException e) {
            log.errorf(e, "소스 %s 리스너 예외, 다음 주기에 다시 시도합니다", listener.sourceChatId());
        }
        schedule(listener, next);
    }

    private void consume() {
        while (running) {
            CanonicalMessage message;
            try {
                message = queue.poll(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (message == null) {
                continue;
            }
            try {
                relay.handle(message);
            } catch (StateStoreException e) {
                fail("상태 저장소 오류로 처리를 중단합니다 (" + message.identity() + ")", e);
                return;
            } catch (RuntimeException e) {
                fail("메시지 결정 중 예상치 못한 오류 (" + message.identity() + ")", e);
                return;
            }
        }
    }

    private synchronized void fail(String reason, Exception cause) {
        if (fatalError != null) {
            return;
        }
        fatalError = reason + ": " + cause.getMessage();
        running = false;
        log.errorf(cause, "치명적 오류: %s", reason);
        listenerExecutor.shutdownNow();
        exitHandler.accept(1);
    }

    public Status status() {
        return new Status(running, fatalError, listeners.size(), queue == null ? 0 : queue.size(), pending.size());
    }

    @PreDestroy
    public void stop() {
        running = false;
        if (listenerExecutor != null) {
            listenerExecutor.shutdownNow();
        }
        if (pipelineExecutor == null) {
            return;
        }
        pipelineExecutor.shutdown();
        try {
            if (!pipelineExecutor.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warnf("진행 중인 게시가 %d초 안에 끝나지 않아 강제로 중단합니다", settings.shutdownGrace().toSeconds());
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            pipelineExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.infof("릴레이 종료: 미결정 메시지 %d건은 재시작 후 다시 읽힙니다", queue.size());
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
