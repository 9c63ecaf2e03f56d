package com.costwatch.analysis.web;

import java.util.Optional;

/**
 * Per-thread trace context for HTTP requests and scheduled runs.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(String traceId, Origin origin) {

        public enum Origin {
            HTTP,
            SCHEDULED
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String traceId;
            private Origin origin = Origin.HTTP;

            public Builder traceId(String traceId) {
                this.traceId = traceId;
                return this;
            }

            public Builder origin(Origin origin) {
                this.origin = origin;
                return this;
            }

            public RequestContext build() {
                return new RequestContext(traceId, origin);
            }
        }
    }
}
