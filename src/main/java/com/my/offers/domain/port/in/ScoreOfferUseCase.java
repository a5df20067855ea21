package com.my.offers.domain.port.in;

import com.my.offers.domain.model.CanonicalMessage;
import com.my.offers.domain.model.RuleSet;
import com.my.offers.domain.model.ScoreResult;

/**
 * 왜: 메시지 채점을 부수효과 없는 순수 계약으로 노출하기 위함.
 */
public interface ScoreOfferUseCase {
    ScoreResult evaluate(CanonicalMessage message, RuleSet rules);
}
