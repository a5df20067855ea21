package com.my.offers.domain.model;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 점수 계산 결과를 저장하지 않는 파생 값으로 다루어 규칙 변경 시 이력 마이그레이션이 필요 없도록 하기 위함.
 */
public record ScoreResult(boolean accepted,
                          int score,
                          Set<String> matchedIncludeTerms,
                          Optional<String> excludeHit,
                          List<String> reasons) {

    public ScoreResult {
        matchedIncludeTerms = Set.copyOf(matchedIncludeTerms);
        excludeHit = excludeHit == null ? Optional.empty() : excludeHit;
        reasons = List.copyOf(reasons);
    }

    public static ScoreResult excluded(String term) {
        return new ScoreResult(false, 0, Set.of(), Optional.of(term), List.of("exclude_keyword:" + term));
    }

    public String reasonText() {
        return reasons.isEmpty() ? "no-reason" : String.join(", ", reasons);
    }
}
