package com.ryuqq.transmap.application.port;

import com.ryuqq.transmap.application.item.EmittedItem;

/**
 * 생성된 항목을 받는 외부 emitter SPI.
 *
 * <p>소스 텍스트 포맷팅, 헤더 생성, 파일 기록은 구현체의 책임입니다.</p>
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public interface ItemEmitter {

    /**
     * 생성된 항목 전달.
     *
     * @param item 생성 결과
     */
    void emit(EmittedItem item);
}
