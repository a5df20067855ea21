package com.my.offers.domain.port.out;

import com.my.offers.domain.model.DedupEntry;

import java.util.Optional;

/**
 * 왜: 종결 결정된 메시지 식별자를 영속적으로 기록해 재전달 시 중복 게시를 막기 위함.
 * 모든 메서드는 실패 시 StateStoreException을 던진다.
 */
public interface DedupLedgerPort {

    Optional<DedupEntry> find(String sourceChatId, long messageId);

    /**
     * 같은 식별자의 항목이 없을 때만 기록한다. 기존 항목은 덮어쓰지 않는다.
     *
     * @return 새로 기록했으면 true
     */
    boolean record(DedupEntry entry);
}
