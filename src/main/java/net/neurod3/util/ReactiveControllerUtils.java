package net.neurod3.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Utility class for common reactive controller patterns.
 * Blocking catalog work runs on the bounded elastic scheduler; failures propagate so the
 * exception handler can pick the status.
 */
@Slf4j
public final class ReactiveControllerUtils {

    private ReactiveControllerUtils() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Run blocking work off the request thread.
     */
    public static <T> Mono<T> blocking(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 200 OK with the value. Server-side failures are logged once here; client errors are not.
     */
    public static <T> Mono<ResponseEntity<T>> ok(Mono<T> data, String context) {
        return data.map(ResponseEntity::ok)
            .doOnError(ex -> {
                if (isClientError(ex)) {
                    log.debug("{}: {}", context, ex.getMessage());
                } else {
                    log.error("{}: {}", context, ex.getMessage(), ex);
                }
            });
    }

    private static boolean isClientError(Throwable ex) {
        return (ex instanceof ResponseStatusException rse && rse.getStatusCode().is4xxClientError())
            || ex instanceof IllegalArgumentException;
    }
}
