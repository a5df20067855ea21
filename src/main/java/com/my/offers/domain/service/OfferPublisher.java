package com.my.offers.domain.service;

import com.my.offers.domain.exception.PublishException;
import com.my.offers.domain.model.MediaRef;
import com.my.offers.domain.model.OutboundPost;
import com.my.offers.domain.model.PublishOutcome;
import com.my.offers.domain.port.out.DestinationPort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 목적지 채널로의 게시(본문 후 미디어 포워딩)를 한 번에 하나씩 직렬화하기 위함.
 *
 * <p>dry-run 모드에서는 네트워크 호출 없이 합성 성공 결과를 돌려준다. 일시적 실패의 재시도는 {@link DestinationPort}
 * 구현이 맡고, 그 뒤에도 실패하면 {@link PublishException}이 그대로 전달된다.
 */
public class OfferPublisher {

    private static final Logger log = Logger.getLogger(OfferPublisher.class);

    private final DestinationPort destinationPort;
    private final String destinationChat;
    private final ReentrantLock publishLock = new ReentrantLock(true);

    public OfferPublisher(DestinationPort destinationPort, String destinationChat) {
        this.destinationPort = Objects.requireNonNull(destinationPort, "destinationPort");
        this.destinationChat = Objects.requireNonNull(destinationChat, "destinationChat");
    }

    public PublishOutcome publish(OutboundPost post, boolean dryRun) {
        publishLock.lock();
        try {
            if (dryRun) {
                log.infof("[DRY_RUN] %s -> %s: %s", post.source().identity(), destinationChat, abbreviate(post.text()));
                return PublishOutcome.dryRunOutcome();
            }
            OptionalLong first = OptionalLong.empty();
            if (post.hasText()) {
                first = OptionalLong.of(destinationPort.sendText(destinationChat, post.text()));
            }
            List<Long> forwarded = new ArrayList<>();
            for (MediaRef media : post.media()) {
                long id = destinationPort.forward(destinationChat, media);
                forwarded.add(id);
                if (first.isEmpty()) {
                    first = OptionalLong.of(id);
                }
            }
            return new PublishOutcome(first, forwarded, false);
        } finally {
            publishLock.unlock();
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 250 ? text : text.substring(0, 250) + "…";
    }
}
