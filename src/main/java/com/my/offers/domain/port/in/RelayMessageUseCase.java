package com.my.offers.domain.port.in;

import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RelayDecision;

/**
 * 왜: 모든 소스에서 들어온 메시지를 단일 진입점으로 수렴시켜 중복 방지와 커서 전진 순서를 한 곳에서 보장하기 위함.
 */
public interface RelayMessageUseCase {
    RelayDecision handle(CanonicalMessage message);
}
