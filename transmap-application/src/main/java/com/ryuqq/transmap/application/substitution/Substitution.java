package com.ryuqq.transmap.application.substitution;

/**
 * 치환 결과.
 *
 * @param text 치환된 텍스트
 * @param counter 치환 후의 단계 카운터
 *
 * @author Transmap Team
 * @since 1.0.0
 */
public record Substitution(String text, StepCounter counter) {

    public Substitution {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (counter == null) {
            throw new IllegalArgumentException("counter cannot be null");
        }
    }
}
