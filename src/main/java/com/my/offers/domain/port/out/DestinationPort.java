package com.my.offers.domain.port.out;

import com.my.offers.domain.model.MediaRef;

/**
 * 왜: 목적지 채널로의 텍스트 게시와 미디어 포워딩을 플랫폼 API에서 분리하기 위함.
 * 실패는 PublishException으로 알린다.
 */
public interface DestinationPort {

    long sendText(String destinationChat, String text);

    long forward(String destinationChat, MediaRef media);
}
