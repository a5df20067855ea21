package com.my.offers.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 감시할 소스 채널 목록과 단일 목적지 채널, dry-run 여부를 한 곳에서 확정하기 위함.
 */
public record RelayTargets(List<String> sourceChats, String destinationChat, boolean dryRun) {

    public RelayTargets {
        Objects.requireNonNull(destinationChat, "destinationChat");
        sourceChats = List.copyOf(sourceChats);
    }
}
