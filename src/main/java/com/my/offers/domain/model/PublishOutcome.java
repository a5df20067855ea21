package com.my.offers.domain.model;

import java.util.List;
import java.util.OptionalLong;

/**
 * 왜: 목적지 채널에 게시된 결과(첫 게시물 id, 포워딩된 미디어 id)를 호출자에게 돌려주기 위함.
 */
public record PublishOutcome(OptionalLong targetMessageId, List<Long> forwardedMessageIds, boolean dryRun) {

    public PublishOutcome {
        targetMessageId = targetMessageId == null ? OptionalLong.empty() : targetMessageId;
        forwardedMessageIds = List.copyOf(forwardedMessageIds);
    }

    public static PublishOutcome dryRunOutcome() {
        return new PublishOutcome(OptionalLong.empty(), List.of(), true);
    }
}
