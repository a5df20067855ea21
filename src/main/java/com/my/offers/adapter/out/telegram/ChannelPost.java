package com.my.offers.adapter.out.telegram;

import java.time.Instant;
import java.util.List;

/**
 * 텔레그램 업데이트에서 꺼낸 채널/그룹 게시물. chatId는 플랫폼의 숫자 id, updateId는 getUpdates 확정 위치다.
 */
record ChannelPost(long updateId,
                   long chatId,
                   String username,
                   String title,
                   long messageId,
                   Instant date,
                   String text,
                   List<String> mediaKinds,
                   String rawPayload) {

    ChannelPost {
        mediaKinds = List.copyOf(mediaKinds);
    }
}
