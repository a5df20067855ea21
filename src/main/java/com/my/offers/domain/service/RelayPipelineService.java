package com.my.offers.domain.service;

import com.my.offers.domain.exception.PublishException;
import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.DedupEntry;
import com.my.offers.domain.model.OutboundPost;
import com.my.offers.domain.model.PublishOutcome;
import com.my.offers.domain.model.RelayDecision;
import com.my.offers.domain.model.RuleSet;
import com.my.offers.domain.model.ScoreResult;
import com.my.offers.domain.port.in.RelayMessageUseCase;
import com.my.offers.domain.port.in.ScoreOfferUseCase;
import com.my.offers.domain.port.out.ClockPort;
import com.my.offers.domain.port.out.CursorStorePort;
import com.my.offers.domain.port.out.DedupLedgerPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.util.Optional;

/**
 * 모든 소스 리스너가 공유하는 단일 결정 지점.
 *
 * <p>메시지마다 중복 확인, 채점, 게시를 순서대로 수행하고, 종결 결정이 나면 중복 원장을 먼저 기록한 뒤 커서를
 * 전진시킨다. 게시가 실패하면 아무것도 기록하지 않고 메시지를 보류 상태로 남긴다. 단일 스레드에서 호출되어야 한다.
 */
public class RelayPipelineService implements RelayMessageUseCase {

    private static final Logger log = Logger.getLogger(RelayPipelineService.class);

    private final ScoreOfferUseCase scoring;
    private final RuleSet rules;
    private final PostComposer composer;
    private final OfferPublisher publisher;
    private final CursorStorePort cursorStore;
    private final DedupLedgerPort dedupLedger;
    private final PendingRedeliveries pending;
    private final ClockPort clock;
    private final boolean dryRun;

    public RelayPipelineService(ScoreOfferUseCase scoring,
                                RuleSet rules,
                                PostComposer composer,
                                OfferPublisher publisher,
                                CursorStorePort cursorStore,
                                DedupLedgerPort dedupLedger,
                                PendingRedeliveries pending,
                                ClockPort clock,
                                boolean dryRun) {
        this.scoring = scoring;
        this.rules = rules;
        this.composer = composer;
        this.publisher = publisher;
        this.cursorStore = cursorStore;
        this.dedupLedger = dedupLedger;
        this.pending = pending;
        this.clock = clock;
        this.dryRun = dryRun;
    }

    @Override
    public RelayDecision handle(CanonicalMessage message) {
        MDC.put("sourceChat", message.sourceChatId());
        MDC.put("messageId", String.valueOf(message.messageId()));
        try {
            return decide(message);
        } finally {
            MDC.remove("sourceChat");
            MDC.remove("messageId");
        }
    }

    private RelayDecision decide(CanonicalMessage message) {
        String source = message.sourceChatId();
        if (pending.blocks(source, message.messageId())) {
            log.debugf("보류 중인 메시지 이후라 결정을 미룹니다: %s", message.identity());
            return RelayDecision.DEFERRED;
        }

        Optional<DedupEntry> existing = dedupLedger.find(source, message.messageId());
        if (existing.isPresent()) {
            // 원장 기록 직후 중단된 경우 커서만 따라잡는다
            cursorStore.advance(source, message.messageId());
            pending.clear(source, message.messageId());
            log.debugf("이미 결정된 메시지를 건너뜁니다: %s (%s)", message.identity(), existing.get().outcome());
            return RelayDecision.DUPLICATE;
        }

        ScoreResult score = scoring.evaluate(message, rules);
        if (!score.accepted()) {
            dedupLedger.record(DedupEntry.rejected(message, clock.now()));
            cursorStore.advance(source, message.messageId());
            pending.clear(source, message.messageId());
            log.infof("REJECTED %s score=%d reason=%s", message.identity(), score.score(), score.reasonText());
            return RelayDecision.REJECTED;
        }

        OutboundPost post = composer.compose(message, score);
        PublishOutcome outcome;
        try {
            outcome = publisher.publish(post, dryRun);
        } catch (PublishException e) {
            PendingRedeliveries.Redelivery redelivery = pending.markPending(source, message.messageId(), clock.now());
            if (e.permanent()) {
                log.errorf("PENDING %s 목적지에서 게시를 거부했습니다. 운영자 확인이 필요합니다 (시도 %d): %s",
                        message.identity(), redelivery.attempts(), e.getMessage());
            } else {
                log.warnf("PENDING %s 게시 실패, 커서 위치부터 다시 시도합니다 (시도 %d): %s",
                        message.identity(), redelivery.attempts(), e.getMessage());
            }
            return RelayDecision.PENDING;
        } catch (RuntimeException e) {
            PendingRedeliveries.Redelivery redelivery = pending.markPending(source, message.messageId(), clock.now());
            log.errorf(e, "PENDING %s 게시 중 예상하지 못한 오류 (시도 %d)", message.identity(), redelivery.attempts());
            return RelayDecision.PENDING;
        }

        boolean recorded = dedupLedger.record(DedupEntry.published(message, outcome.targetMessageId(), clock.now()));
        if (!recorded) {
            log.warnf("중복 원장에 이미 항목이 있어 게시 기록을 덮어쓰지 않았습니다: %s", message.identity());
        }
        cursorStore.advance(source, message.messageId());
        pending.clear(source, message.messageId());
        if (outcome.dryRun()) {
            log.infof("PUBLISHED %s score=%d (dry-run) reason=%s", message.identity(), score.score(), score.reasonText());
        } else {
            log.infof("PUBLISHED %s score=%d target=%s media=%d",
                    message.identity(), score.score(), outcome.targetMessageId(), outcome.forwardedMessageIds().size());
        }
        return RelayDecision.PUBLISHED;
    }
}
