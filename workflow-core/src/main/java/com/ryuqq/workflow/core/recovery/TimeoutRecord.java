package com.ryuqq.workflow.core.recovery;

import java.time.Duration;

/**
 * 타임아웃 발생 기록.
 *
 * <p>추적이 활성화된 TimeoutPrimitive가 타임아웃마다
 * {@code context.state["timeout_history"]}에 하나씩 추가합니다.</p>
 *
 * @param primitiveName 타임아웃된 내부 Primitive 이름
 * @param timeout 설정된 타임아웃
 * @param fallbackUsed fallback 실행 여부
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record TimeoutRecord(
    String primitiveName,
    Duration timeout,
    boolean fallbackUsed
) {
}
