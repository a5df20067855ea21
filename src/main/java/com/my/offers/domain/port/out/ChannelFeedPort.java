package com.my.offers.domain.port.out;

import com.my.offers.domain.exception.ListenerException;
import com.my.offers.domain.model.CanonicalMessage;

import java.util.List;

/**
 * 왜: 플랫폼의 콜백/폴링 방식과 무관하게 소스 채널별 메시지를 id 순서로 당겨올 수 있도록 하기 위함.
 */
public interface ChannelFeedPort {

    /**
     * @return afterMessageId 보다 큰 id의 메시지들, id 오름차순
     * @throws ListenerException 피드를 일시적으로 사용할 수 없을 때
     */
    List<CanonicalMessage> fetchAfter(String sourceChatId, long afterMessageId);
}
