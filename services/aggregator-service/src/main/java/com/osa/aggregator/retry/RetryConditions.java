package com.osa.aggregator.retry;

import com.osa.aggregator.backend.BackendException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import org.springframework.web.client.ResourceAccessException;

public final class RetryConditions {
    private static final Predicate<RuntimeException> DEFAULT = RetryConditions::isTransient;

    private RetryConditions() {
    }

    public static Predicate<RuntimeException> defaultCondition() {
        return DEFAULT;
    }

    public static Predicate<RuntimeException> never() {
        return error -> false;
    }

    /**
     * Network failures, timeouts, HTTP 5xx and HTTP 429 are transient.
     */
    public static boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof BackendException) {
            BackendException backendError = (BackendException) error;
            switch (backendError.getKind()) {
                case NETWORK:
                case TIMEOUT:
                case RATE_LIMITED:
                    return true;
                case HTTP_ERROR:
                    Integer status = backendError.getStatusCode();
                    return status != null && (status >= 500 || status == 429);
                default:
                    return false;
            }
        }
        if (error instanceof ResourceAccessException) {
            return true;
        }
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current instanceof ConnectException
                || current instanceof SocketTimeoutException
                || current instanceof UnknownHostException
                || current instanceof SocketException
                || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
