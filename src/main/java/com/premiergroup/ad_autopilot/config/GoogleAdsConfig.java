package com.premiergroup.ad_autopilot.config;

import com.google.ads.googleads.lib.GoogleAdsClient;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Google Ads client for the manager account that owns every autopilot account.
 * Turned off with {@code google.ads.enabled=false}; the platform client beans
 * disappear with it.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "google.ads.enabled", havingValue = "true", matchIfMissing = true)
@Log4j2
public class GoogleAdsConfig {

    private static final List<String> ADWORDS_SCOPE = List.of("https://www.googleapis.com/auth/adwords");

    @Bean
    public GoogleAdsClient googleAdsClient(
            @Value("${google.ads.developer-token}") String developerToken,
            @Value("${google.ads.mcc-customer-id}") long managerCustomerId,
            @Value("${google.ads.credentials-json:}") String credentialsJson,
            @Value("${google.ads.credentials-file:}") String credentialsFile
    ) throws IOException {

        GoogleCredentials credentials = serviceAccount(credentialsJson, credentialsFile).createScoped(ADWORDS_SCOPE);
        log.info("Google Ads client logs in through manager account {}", managerCustomerId);

        return GoogleAdsClient.newBuilder()
                .setCredentials(credentials)
                .setDeveloperToken(developerToken)
                .setLoginCustomerId(managerCustomerId)
                .build();
    }

    /**
     * Service account key, inline JSON first, then a key file.
     */
    static ServiceAccountCredentials serviceAccount(String json, String file) throws IOException {
        if (json != null && !json.isBlank()) {
            try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
                return asServiceAccount(GoogleCredentials.fromStream(in));
            }
        }
        if (file != null && !file.isBlank()) {
            try (InputStream in = Files.newInputStream(Path.of(file))) {
                return asServiceAccount(GoogleCredentials.fromStream(in));
            }
        }
        throw new IllegalStateException(
                "Set google.ads.credentials-json or google.ads.credentials-file, or google.ads.enabled=false");
    }

    private static ServiceAccountCredentials asServiceAccount(GoogleCredentials credentials) {
        if (credentials instanceof ServiceAccountCredentials serviceAccount) {
            return serviceAccount;
        }
        throw new IllegalStateException("Google Ads credentials must be a service account key, got "
                + credentials.getClass().getSimpleName());
    }
}
