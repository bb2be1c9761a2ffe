package com.ryuqq.workflow.core.recovery;

import com.ryuqq.workflow.core.context.WorkflowContext;
import com.ryuqq.workflow.core.primitive.WorkflowPrimitive;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FallbackPrimitiveTest {

    @Mock
    private WorkflowPrimitive<String, String> primary;

    @Mock
    private WorkflowPrimitive<String, String> fallback;

    private final WorkflowContext context = WorkflowContext.of("fallback-test");

    @Test
    void primary_성공_시_fallback_미호출() throws Exception {
        // given
        when(primary.execute("in", context)).thenReturn("primary");

        // when
        String result = new FallbackPrimitive<>(primary, fallback).execute("in", context);

        // then
        assertThat(result).isEqualTo("primary");
        verifyNoInteractions(fallback);
    }

    @Test
    void primary_실패_시_동일_입력과_Context로_fallback_실행() throws Exception {
        // given
        when(primary.execute("in", context)).thenThrow(new IOException("down"));
        when(fallback.execute("in", context)).thenReturn("fallback");

        // when
        String result = new FallbackPrimitive<>(primary, fallback).execute("in", context);

        // then
        assertThat(result).isEqualTo("fallback");
    }

    @Test
    void 둘_다_실패하면_fallback_예외가_변경_없이_전파() throws Exception {
        // given
        IOException primaryFailure = new IOException("primary");
        IllegalStateException fallbackFailure = new IllegalStateException("fallback");
        when(primary.execute("in", context)).thenThrow(primaryFailure);
        when(fallback.execute("in", context)).thenThrow(fallbackFailure);

        // when & then
        assertThatThrownBy(() -> new FallbackPrimitive<>(primary, fallback).execute("in", context))
            .isSameAs(fallbackFailure);
        assertThat(fallbackFailure.getSuppressed()).isEmpty();
    }

    @Test
    void 같은_예외_인스턴스를_다시_던져도_자기_자신을_suppress_하지_않음() throws Exception {
        // given
        IOException shared = new IOException("shared");
        when(primary.execute("in", context)).thenThrow(shared);
        when(fallback.execute("in", context)).thenThrow(shared);

        // when & then
        assertThatThrownBy(() -> new FallbackPrimitive<>(primary, fallback).execute("in", context))
            .isSameAs(shared);
        assertThat(shared.getSuppressed()).isEmpty();
    }

    @Test
    void 공유_예외_인스턴스로_반복_실패해도_예외가_누적되지_않음() throws Exception {
        // given
        IOException primaryFailure = new IOException("primary");
        IllegalStateException sharedFallbackFailure = new IllegalStateException("fallback");
        when(primary.execute("in", context)).thenThrow(primaryFailure);
        when(fallback.execute("in", context)).thenThrow(sharedFallbackFailure);
        FallbackPrimitive<String, String> primitive = new FallbackPrimitive<>(primary, fallback);

        // when
        for (int i = 0; i < 100; i++) {
            assertThatThrownBy(() -> primitive.execute("in", context)).isSameAs(sharedFallbackFailure);
        }

        // then
        assertThat(sharedFallbackFailure.getSuppressed()).isEmpty();
        assertThat(primaryFailure.getSuppressed()).isEmpty();
        verify(fallback, times(100)).execute("in", context);
    }
}
