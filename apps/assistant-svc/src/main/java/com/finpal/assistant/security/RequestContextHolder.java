package com.finpal.assistant.security;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Per-request trace id and, once a bearer token has been resolved, the caller's phone.
 * Both are mirrored into the logging MDC; the phone only in masked form.
 */
public final class RequestContextHolder {

    public static final String MDC_TRACE_ID = "trace_id";
    public static final String MDC_USER = "user";

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void start(String traceId) {
        CONTEXT.set(new RequestContext(null, traceId));
        MDC.put(MDC_TRACE_ID, traceId);
    }

    public static void setPhone(String phone) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(new RequestContext(phone, current != null ? current.traceId() : null));
        MDC.put(MDC_USER, IdentifierMasker.mask(phone));
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> currentTraceId() {
        return get().map(RequestContext::traceId);
    }

    public static Optional<String> currentPhone() {
        return get().map(RequestContext::phone);
    }

    public static void clear() {
        CONTEXT.remove();
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_USER);
    }

    public record RequestContext(String phone, String traceId) {
    }
}
