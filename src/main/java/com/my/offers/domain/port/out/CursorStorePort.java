package com.my.offers.domain.port.out;

import com.my.offers.domain.model.Cursor;

import java.util.Optional;

/**
 * 왜: 소스별 처리 위치를 재시작 이후에도 유지하는 저장소 계약을 도메인에 고정하기 위함.
 * 모든 메서드는 실패 시 StateStoreException을 던진다.
 */
public interface CursorStorePort {

    Optional<Cursor> find(String sourceChatId);

    /**
     * 저장된 값과 messageId 중 큰 값으로 커서를 올리고 결과 커서를 돌려준다. 커서는 절대 감소하지 않는다.
     */
    Cursor advance(String sourceChatId, long messageId);
}
