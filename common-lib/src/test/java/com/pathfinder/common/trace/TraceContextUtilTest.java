package com.pathfinder.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    @DisplayName("traceId is readable from the Reactor Context downstream")
    void propagatesTraceId() {
        Mono<String> traced = TraceContextUtil.withTraceId(
            Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))), "abc-123");
        assertEquals("abc-123", traced.block());
    }

    @Test
    @DisplayName("blank or missing traceId → unknown")
    void blankTraceId() {
        Mono<String> traced = TraceContextUtil.withTraceId(
            Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))), "  ");
        assertEquals(TraceContextUtil.UNKNOWN, traced.block());
        assertEquals(TraceContextUtil.UNKNOWN,
            Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getTraceId(ctx))).block());
    }

    @Test
    @DisplayName("MDC holds the traceId only while the log action runs")
    void mdcScoped() {
        AtomicReference<String> seen = new AtomicReference<>();
        TraceContextUtil.withMdc("t-42", () -> seen.set(MDC.get(TraceContextUtil.TRACE_ID_KEY)));
        assertEquals("t-42", seen.get());
        assertNull(MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }
}
