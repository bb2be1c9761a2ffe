package com.ryuqq.workflow.core.context;

import java.time.Instant;

/**
 * 실행 중 기록된 시점 표식.
 *
 * @param name 체크포인트 이름 (예: saga.forward.start)
 * @param timestamp 기록 시각
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record Checkpoint(
    String name,
    Instant timestamp
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비어 있거나 timestamp가 null인 경우
     */
    public Checkpoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }
}
