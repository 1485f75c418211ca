package com.premiergroup.ad_autopilot.client.google;

import com.google.ads.googleads.v20.errors.GoogleAdsError;
import com.google.ads.googleads.v20.errors.GoogleAdsException;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.DeadlineExceededException;
import com.premiergroup.ad_autopilot.exception.ExternalApiException;
import com.premiergroup.ad_autopilot.exception.ExternalRejectedException;
import com.premiergroup.ad_autopilot.exception.ExternalTimeoutException;
import com.premiergroup.ad_autopilot.exception.ExternalTransientException;

import java.util.stream.Collectors;

/**
 * Maps Google Ads client failures onto the platform-neutral error taxonomy.
 */
final class GoogleAdsErrors {

    private GoogleAdsErrors() {
    }

    static ExternalApiException translate(String operation, ApiException e) {
        if (e instanceof GoogleAdsException gae) {
            String detail = gae.getGoogleAdsFailure().getErrorsList().stream()
                    .map(GoogleAdsError::getMessage)
                    .collect(Collectors.joining("; "));
            String message = operation + " failed (request " + gae.getRequestId() + "): " + detail;
            boolean transientFailure = gae.getGoogleAdsFailure().getErrorsList().stream()
                    .anyMatch(GoogleAdsErrors::isTransient);
            return transientFailure
                    ? new ExternalTransientException(message, e)
                    : new ExternalRejectedException(message, e);
        }
        if (e instanceof DeadlineExceededException) {
            return new ExternalTimeoutException(operation + " exceeded the client deadline", e);
        }
        if (e.isRetryable()) {
            return new ExternalTransientException(operation + " failed: " + e.getStatusCode().getCode(), e);
        }
        return new ExternalRejectedException(operation + " failed: " + e.getMessage(), e);
    }

    private static boolean isTransient(GoogleAdsError error) {
        return switch (error.getErrorCode().getErrorCodeCase()) {
            case QUOTA_ERROR, INTERNAL_ERROR -> true;
            default -> false;
        };
    }
}
