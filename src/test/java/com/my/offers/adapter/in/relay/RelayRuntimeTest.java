package com.my.offers.adapter.in.relay;

import com.my.offers.adapter.out.state.InMemoryStateStore;
import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.exception.StateStoreException;
import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RelayTargets;
import com.my.offers.domain.model.RetryPolicy;
import com.my.offers.domain.model.RuleSet;
import com.my.offers.domain.port.in.RelayMessageUseCase;
import com.my.offers.domain.port.out.ChannelFeedPort;
import com.my.offers.domain.port.out.DestinationPort;
import com.my.offers.domain.service.OfferPublisher;
import com.my.offers.domain.service.OfferScoringService;
import com.my.offers.domain.service.PendingRedeliveries;
import com.my.offers.domain.service.PostComposer;
import com.my.offers.domain.service.RelayPipelineService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RelayRuntimeTest {

    private static final RelayRuntime.Settings SETTINGS = new RelayRuntime.Settings(
            100, Duration.ofMillis(20), new RetryPolicy(Integer.MAX_VALUE, Duration.ofMillis(10), Duration.ofMillis(50)),
            Duration.ofSeconds(2));

    private final Map<String, NavigableMap<Long, CanonicalMessage>> channels = new ConcurrentHashMap<>();
    private final ChannelFeedPort feed = (source, after) -> {
        if (source.equals("@broken")) {
            throw new ListenerException("connection refused");
        }
        return List.copyOf(channels.getOrDefault(source, new ConcurrentSkipListMap<>()).tailMap(after, false).values());
    };

    private DestinationPort destination;
    private InMemoryStateStore store;
    private PendingRedeliveries pending;
    private AtomicInteger exitCode;
    private CountDownLatch exited;
    private RelayRuntime runtime;

    @BeforeEach
    void setUp() {
        destination = mock(DestinationPort.class);
        when(destination.sendText(anyString(), anyString())).thenReturn(1L);
        store = new InMemoryStateStore();
        pending = new PendingRedeliveries();
        exitCode = new AtomicInteger(-1);
        exited = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private void post(String source, long id, String text) {
        channels.computeIfAbsent(source, key -> new ConcurrentSkipListMap<>())
                .put(id, new CanonicalMessage(source, id, Instant.now(), source, text, List.of(), ""));
    }

    private RelayRuntime start(RelayMessageUseCase relay, List<String> sources) {
        RelayTargets targets = new RelayTargets(sources, "@best", false);
        runtime = new RelayRuntime(relay, feed, store, pending, targets, Instant::now, SETTINGS, code -> {
            exitCode.set(code);
            exited.countDown();
        });
        runtime.start();
        return runtime;
    }

    private RelayMessageUseCase pipeline() {
        RuleSet rules = RuleSet.withDefaults(Map.of("iphone", 2), List.of(), 2);
        OfferPublisher publisher = new OfferPublisher(destination, "@best");
        return new RelayPipelineService(new OfferScoringService(), rules, new PostComposer(text -> text),
                publisher, store, store, pending, Instant::now, false);
    }

    @Test
    void relays_offers_from_every_source() {
        post("@a", 1, "iPhone 15 за 79 990 ₽");
        post("@a", 2, "просто текст");
        post("@b", 10, "Чехол для iPhone");

        start(pipeline(), List.of("@a", "@b"));

        verify(destination, timeout(3000).times(2)).sendText(eq("@best"), contains("iPhone"));
        post("@a", 3, "iPhone SE");
        verify(destination, timeout(3000).times(1)).sendText(eq("@best"), contains("iPhone SE"));
        verify(destination, timeout(3000).times(3)).sendText(eq("@best"), anyString());

        assertThat(store.find("@a", 2)).isPresent();
        assertThat(runtime.status().running()).isTrue();
        assertThat(runtime.status().sources()).isEqualTo(2);
    }

    @Test
    void broken_source_does_not_stop_the_others() {
        post("@a", 1, "iPhone 15");

        start(pipeline(), List.of("@broken", "@a"));

        verify(destination, timeout(3000)).sendText(eq("@best"), contains("iPhone 15"));
        assertThat(exitCode.get()).isEqualTo(-1);
    }

    @Test
    void state_store_failure_stops_the_process() throws Exception {
        RelayMessageUseCase failing = mock(RelayMessageUseCase.class);
        when(failing.handle(any())).thenThrow(new StateStoreException("disk full"));
        post("@a", 1, "iPhone 15");

        start(failing, List.of("@a"));

        assertThat(exited.await(3, TimeUnit.SECONDS)).isTrue();
        assertThat(exitCode.get()).isEqualTo(1);
        assertThat(runtime.status().running()).isFalse();
        assertThat(runtime.status().fatalError()).contains("disk full");
        verify(failing, times(1)).handle(any());
    }

    @Test
    void unexpected_publish_error_does_not_stop_the_process() {
        when(destination.sendText(eq("@best"), anyString()))
                .thenThrow(new IllegalStateException("unexpected response"))
                .thenReturn(42L);
        post("@a", 1, "iPhone 15 за 79 990 ₽");

        start(pipeline(), List.of("@a"));

        verify(destination, timeout(3000).times(2)).sendText(eq("@best"), contains("iPhone 15"));
        assertThat(exitCode.get()).isEqualTo(-1);
        assertThat(runtime.status().running()).isTrue();
        assertThat(runtime.status().fatalError()).isNull();
    }

    @Test
    void stop_waits_for_the_pipeline_and_is_clean() {
        start(pipeline(), List.of("@a"));

        runtime.stop();

        assertThat(runtime.status().running()).isFalse();
        assertThat(runtime.status().fatalError()).isNull();
        assertThat(exitCode.get()).isEqualTo(-1);
    }
}
