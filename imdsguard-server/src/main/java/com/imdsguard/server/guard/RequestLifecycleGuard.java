package com.imdsguard.server.guard;

import com.imdsguard.server.identity.ClientIdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a security-sensitive handler under a deadline, turns its outcome into the HTTP response and records one
 * response metric per request.
 *
 * <p>The handler executes on {@code executor} while the request thread waits. When the deadline passes the task
 * is cancelled with interruption and the caller gets a 504; the handler thread never touches the servlet response,
 * so an overrunning handler cannot corrupt it.
 */
@Slf4j
public class RequestLifecycleGuard {

    private static final String INTERNAL_ERROR = "internal error";

    private final ClientIdentityResolver identityResolver;
    private final ResponseMetrics metrics;
    private final ExecutorService executor;
    private final Duration maxDuration;

    public RequestLifecycleGuard(
            ClientIdentityResolver identityResolver,
            ResponseMetrics metrics,
            ExecutorService executor,
            Duration maxDuration) {
        this.identityResolver = identityResolver;
        this.metrics = metrics;
        this.executor = executor;
        this.maxDuration = maxDuration;
    }

    public void execute(String name, HttpServletRequest request, HttpServletResponse response, GuardedHandler handler)
            throws IOException {
        Instant deadline = Instant.now().plus(maxDuration);
        HandlerContext context = HandlerContext.resolve(identityResolver, request, deadline);

        HandlerResult result = null;
        HandlerException failure = null;
        try {
            result = invoke(handler, context);
        } catch (HandlerException e) {
            failure = e;
        }

        int status = failure != null ? failure.status() : result.status();
        metrics.record(name, status);

        if (failure != null) {
            logFailure(name, request, context, failure);
            writeError(response, failure);
        } else {
            write(response, result);
        }
    }

    private HandlerResult invoke(GuardedHandler handler, HandlerContext context) throws HandlerException {
        Future<HandlerResult> task;
        try {
            task = executor.submit(() -> handler.handle(context));
        } catch (RejectedExecutionException e) {
            throw new HandlerException(503, "server shutting down", "handler executor rejected task", e);
        }
        try {
            return task.get(context.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new HandlerException(504, "request timed out", "handler exceeded " + maxDuration, e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new HandlerException(503, "request interrupted", "request thread interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HandlerException handlerException) {
                throw handlerException;
            }
            throw new HandlerException(500, INTERNAL_ERROR, "unexpected handler failure: " + cause, cause);
        }
    }

    private static void logFailure(
            String name, HttpServletRequest request, HandlerContext context, HandlerException failure) {
        String identity = context.resolvedIdentity().orElse("-");
        if (failure.status() >= 500) {
            log.error(
                    "error processing request: handler={}, method={}, path={}, identity={}, status={}: {}",
                    name,
                    request.getMethod(),
                    request.getRequestURI(),
                    identity,
                    failure.status(),
                    failure.getMessage(),
                    failure.getCause());
        } else {
            log.warn(
                    "error processing request: handler={}, method={}, path={}, identity={}, status={}: {}",
                    name,
                    request.getMethod(),
                    request.getRequestURI(),
                    identity,
                    failure.status(),
                    failure.getMessage());
        }
    }

    private static void write(HttpServletResponse response, HandlerResult result) throws IOException {
        response.setStatus(result.status());
        response.setContentType(result.contentType());
        response.setContentLength(result.body().length);
        response.getOutputStream().write(result.body());
    }

    private static void writeError(HttpServletResponse response, HandlerException failure) throws IOException {
        byte[] body = (failure.clientMessage() + "\n").getBytes(StandardCharsets.UTF_8);
        response.setStatus(failure.status());
        response.setContentType(HandlerResult.TEXT_PLAIN);
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setContentLength(body.length);
        response.getOutputStream().write(body);
    }
}
