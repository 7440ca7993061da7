package org.javai.resilient.client;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CorrelationIdsTest {

    @AfterEach
    void clear() {
        ThreadContext.clearMap();
    }

    @Test
    void fromThreadContext_readsRequestId() {
        ThreadContext.put(CorrelationIds.THREAD_CONTEXT_KEY, "req-1");

        assertThat(CorrelationIds.fromThreadContext().get()).isEqualTo("req-1");
    }

    @Test
    void fromThreadContext_blankIsAbsent() {
        ThreadContext.put(CorrelationIds.THREAD_CONTEXT_KEY, " ");

        assertThat(CorrelationIds.fromThreadContext().get()).isNull();
    }

    @Test
    void withRequestId_restoresPreviousBinding() {
        ThreadContext.put(CorrelationIds.THREAD_CONTEXT_KEY, "outer");

        String seen = CorrelationIds.withRequestId("inner", () -> CorrelationIds.fromThreadContext().get());

        assertThat(seen).isEqualTo("inner");
        assertThat(ThreadContext.get(CorrelationIds.THREAD_CONTEXT_KEY)).isEqualTo("outer");
    }

    @Test
    void withRequestId_removesBindingWhenNoneBefore() {
        CorrelationIds.withRequestId("only", () -> "done");

        assertThat(ThreadContext.containsKey(CorrelationIds.THREAD_CONTEXT_KEY)).isFalse();
    }

    @Test
    void none_suppliesNothing() {
        assertThat(CorrelationIds.none().get()).isNull();
    }
}
