package com.uptimesentinel.checker.http;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

final class FailureClassifier {
    private FailureClassifier() {
    }

    static String describe(String url, Duration timeout, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);

        if (inChain(error, HttpTimeoutException.class)
                || inChain(error, TimeoutException.class)
                || lowered.contains("timed out")) {
            return "Request timed out after " + timeout.toMillis() + " ms";
        }
        if (isUnknownHost(url, error, lowered)) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (inChain(error, SSLException.class)) {
            return "TLS failure for " + url + ": " + rootText;
        }
        if (inChain(error, ConnectException.class)) {
            return "Connection failure for " + url + ": " + rootText;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }

    private static boolean isUnknownHost(String url, Throwable error, String lowered) {
        String host = URI.create(url).getHost();
        if (host != null && host.endsWith(".invalid")) {
            return true;
        }
        return inChain(error, UnknownHostException.class)
                || inChain(error, UnresolvedAddressException.class)
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename");
    }

    private static boolean inChain(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
