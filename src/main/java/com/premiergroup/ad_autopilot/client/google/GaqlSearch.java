package com.premiergroup.ad_autopilot.client.google;

import com.google.ads.googleads.lib.GoogleAdsClient;
import com.google.ads.googleads.v20.services.GoogleAdsRow;
import com.google.ads.googleads.v20.services.GoogleAdsServiceClient;
import com.google.ads.googleads.v20.services.SearchGoogleAdsStreamRequest;
import com.google.ads.googleads.v20.services.SearchGoogleAdsStreamResponse;
import com.google.api.gax.rpc.ApiException;

import java.util.ArrayList;
import java.util.List;

final class GaqlSearch {

    private GaqlSearch() {
    }

    static List<GoogleAdsRow> stream(GoogleAdsClient client, long customerId, String query) {
        try (GoogleAdsServiceClient service = client.getVersion20().createGoogleAdsServiceClient()) {

            SearchGoogleAdsStreamRequest req = SearchGoogleAdsStreamRequest.newBuilder()
                    .setCustomerId(Long.toString(customerId))
                    .setQuery(query)
                    .build();

            List<GoogleAdsRow> rows = new ArrayList<>();
            for (SearchGoogleAdsStreamResponse resp : service.searchStreamCallable().call(req)) {
                rows.addAll(resp.getResultsList());
            }
            return rows;
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("GAQL search", e);
        }
    }

    /**
     * Parses a numeric platform id; GAQL queries are built from these, so anything else is refused.
     */
    static long id(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Not a numeric platform id: " + value);
        }
    }
}
