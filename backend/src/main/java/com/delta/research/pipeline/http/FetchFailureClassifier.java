package com.delta.research.pipeline.http;

import com.delta.research.pipeline.model.HttpFetchResult;

import java.util.Locale;

/**
 * Diagnostic category for a failed fetch. Both categories retry the same way.
 */
public final class FetchFailureClassifier {
    public static final String DNS_OR_INVALID_HOST = "dns_or_invalid_host";
    public static final String HTTP_ERROR_OR_STATUS = "http_error_or_status";

    private FetchFailureClassifier() {
    }

    public static String classify(HttpFetchResult result) {
        if (result == null) {
            return HTTP_ERROR_OR_STATUS;
        }
        return classify(result.errorCode(), result.errorMessage());
    }

    public static String classify(String errorCode, String errorMessage) {
        String code = errorCode == null ? "" : errorCode.toLowerCase(Locale.ROOT);
        if (code.equals("invalid_url")) {
            return DNS_OR_INVALID_HOST;
        }
        if (code.equals("io_error")) {
            String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
            if (lower.contains("unknownhost")
                || lower.contains("unresolvedaddress")
                || lower.contains("name or service not known")
                || lower.contains("nodename nor servname")
                || lower.contains("no such host")) {
                return DNS_OR_INVALID_HOST;
            }
        }
        return HTTP_ERROR_OR_STATUS;
    }

    /**
     * Short error key stored on the source, e.g. {@code http_404} or {@code timeout}.
     */
    public static String errorKey(HttpFetchResult result) {
        if (result == null) {
            return "http_error";
        }
        if (result.errorCode() != null) {
            return result.errorCode();
        }
        return "http_" + result.statusCode();
    }
}
