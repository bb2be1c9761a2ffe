package com.ryuqq.workflow.core.exception;

/**
 * Primitive 구성 오류.
 *
 * <p>Primitive 그래프를 조립하는 시점(생성자)에 잘못된 설정이 전달된 경우 발생합니다.
 * 실행 시점이 아닌 구성 시점에 즉시 실패(Fail-Fast)합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>빈 Sequential / Parallel 목록</li>
 *   <li>0 이하의 timeout 또는 TTL</li>
 *   <li>음수 maxRetries</li>
 * </ul>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class PrimitiveConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public PrimitiveConfigurationException(String message) {
        super(message);
    }
}
