package com.ryuqq.workflow.core.recovery;

/**
 * RetryPrimitive 한 번의 실행 결과 요약.
 *
 * <p>{@code context.state["retry_statistics"]} 목록에 실행마다 하나씩 추가됩니다.</p>
 *
 * @param primitiveName 재시도 대상 Primitive 이름
 * @param attempts 총 시도 횟수
 * @param success 최종 성공 여부
 * @param errorType 최종 실패 예외의 simple name (성공 시 null)
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public record RetryStatistics(
    String primitiveName,
    int attempts,
    boolean success,
    String errorType
) {
}
