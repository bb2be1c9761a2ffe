package com.ryuqq.workflow.core.exception;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Primitive 실행 시간 초과.
 *
 * <p>TimeoutPrimitive에 fallback이 없을 때 deadline을 넘기면 발생합니다.
 * 설정된 timeout 값을 그대로 보관하므로 호출자는 어떤 deadline이 적용되었는지 확인할 수 있습니다.</p>
 *
 * @author Workflow Team
 * @since 1.0.0
 */
public class PrimitiveTimeoutException extends TimeoutException {

    private static final long serialVersionUID = 1L;

    private final String primitiveName;
    private final Duration timeout;

    /**
     * 생성자.
     *
     * @param primitiveName 시간 초과된 Primitive 이름
     * @param timeout 설정된 timeout
     */
    public PrimitiveTimeoutException(String primitiveName, Duration timeout) {
        super(String.format("Primitive '%s' exceeded timeout of %d ms", primitiveName, timeout.toMillis()));
        this.primitiveName = primitiveName;
        this.timeout = timeout;
    }

    /**
     * 시간 초과된 Primitive 이름 조회.
     *
     * @return Primitive 이름
     */
    public String getPrimitiveName() {
        return primitiveName;
    }

    /**
     * 설정된 timeout 조회.
     *
     * @return timeout
     */
    public Duration getTimeout() {
        return timeout;
    }
}
