package com.my.offers.config;

import com.my.offers.adapter.out.clock.SystemClockAdapter;
import com.my.offers.domain.model.RelayTargets;
import com.my.offers.domain.model.RuleSet;
import com.my.offers.domain.port.in.RelayMessageUseCase;
import com.my.offers.domain.port.in.ScoreOfferUseCase;
import com.my.offers.domain.port.out.ClockPort;
import com.my.offers.domain.port.out.CursorStorePort;
import com.my.offers.domain.port.out.DedupLedgerPort;
import com.my.offers.domain.port.out.DestinationPort;
import com.my.offers.domain.port.out.OfferRewritePort;
import com.my.offers.domain.service.OfferPublisher;
import com.my.offers.domain.service.OfferScoringService;
import com.my.offers.domain.service.PendingRedeliveries;
import com.my.offers.domain.service.PostComposer;
import com.my.offers.domain.service.RelayPipelineService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @Singleton
    public RuleSet ruleSet(AppConfig appConfig) {
        return RelaySettings.ruleSet(appConfig.rules());
    }

    @Produces
    @Singleton
    public RelayTargets relayTargets(AppConfig appConfig) {
        return RelaySettings.targets(appConfig.relay());
    }

    @Produces
    @ApplicationScoped
    public ScoreOfferUseCase scoreOfferUseCase() {
        return new OfferScoringService();
    }

    @Produces
    @Singleton
    public PendingRedeliveries pendingRedeliveries() {
        return new PendingRedeliveries();
    }

    @Produces
    @Singleton
    public PostComposer postComposer(OfferRewritePort offerRewritePort) {
        return new PostComposer(offerRewritePort);
    }

    @Produces
    @Singleton
    public OfferPublisher offerPublisher(DestinationPort destinationPort, RelayTargets targets) {
        return new OfferPublisher(destinationPort, targets.destinationChat());
    }

    @Produces
    @ApplicationScoped
    public RelayMessageUseCase relayMessageUseCase(ScoreOfferUseCase scoreOfferUseCase,
                                                   RuleSet ruleSet,
                                                   PostComposer postComposer,
                                                   OfferPublisher offerPublisher,
                                                   CursorStorePort cursorStorePort,
                                                   DedupLedgerPort dedupLedgerPort,
                                                   PendingRedeliveries pendingRedeliveries,
                                                   ClockPort clockPort,
                                                   RelayTargets targets) {
        return new RelayPipelineService(scoreOfferUseCase, ruleSet, postComposer, offerPublisher,
                cursorStorePort, dedupLedgerPort, pendingRedeliveries, clockPort, targets.dryRun());
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }
}
