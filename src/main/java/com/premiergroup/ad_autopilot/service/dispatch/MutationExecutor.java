package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.dto.AdCreationRequest;
import com.premiergroup.ad_autopilot.entity.MutationResult;
import com.premiergroup.ad_autopilot.enums.ErrorCode;
import com.premiergroup.ad_autopilot.enums.MutationOutcome;
import com.premiergroup.ad_autopilot.enums.MutationType;
import com.premiergroup.ad_autopilot.exception.ExternalApiException;
import com.premiergroup.ad_autopilot.exception.MutationValidationException;
import com.premiergroup.ad_autopilot.service.pool.PlacementPool;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

/**
 * Applies one prepared mutation and turns the outcome into a result row.
 * Nothing thrown here escapes: every failure becomes a FAILED result.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class MutationExecutor {

    private final CampaignApiClient campaignApi;
    private final PlacementPool placementPool;
    private final ExternalCallGuard guard;

    public MutationResult execute(PreparedMutation m, long customerId, boolean dryRun) {
        if (dryRun) {
            if (m.type() == MutationType.LAUNCH_IN_PLACEMENT && m.placement() != null) {
                placementPool.release(m.placement());
            }
            log.info("[dry run] {} {} on customer {}", m.type(), m.targetRef(), customerId);
            return result(m, MutationOutcome.SUCCESS, null, null, "dry run: no call made");
        }

        try {
            String payload = apply(m, customerId);
            log.info("Applied {} {} on customer {}", m.type(), m.targetRef(), customerId);
            return result(m, MutationOutcome.SUCCESS, null, null, payload);
        } catch (ExternalApiException e) {
            String message = e.getErrorCode() == ErrorCode.TIMEOUT
                    ? e.getMessage() + "; the change may still have been applied"
                    : e.getMessage();
            log.warn("{} {} on customer {} failed with {}: {}", m.type(), m.targetRef(), customerId,
                    e.getErrorCode(), e.getMessage());
            return result(m, MutationOutcome.FAILED, e.getErrorCode(), message, null);
        } catch (MutationValidationException e) {
            log.warn("{} {} on customer {} no longer valid: {}", m.type(), m.targetRef(), customerId, e.getMessage());
            return result(m, MutationOutcome.FAILED, e.getErrorCode(), e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("Unexpected failure applying {} {} on customer {}", m.type(), m.targetRef(), customerId, e);
            return result(m, MutationOutcome.FAILED, ErrorCode.UNKNOWN,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), null);
        }
    }

    private String apply(PreparedMutation m, long customerId) {
        return switch (m.type()) {
            case PAUSE_CAMPAIGN, RESUME_CAMPAIGN -> guard.call(describe(m),
                    () -> campaignApi.setCampaignEnabled(customerId, m.campaignId(),
                            m.type() == MutationType.RESUME_CAMPAIGN));

            case UPDATE_CAMPAIGN_BUDGET -> guard.call(describe(m),
                    () -> campaignApi.updateCampaignBudget(customerId, m.campaignId(), m.amountMicros()));

            case PAUSE_PLACEMENT -> m.placement() != null
                    ? placementPool.deactivate(customerId, m.placement())
                    : guard.call(describe(m), () -> campaignApi.setPlacementEnabled(customerId, m.placementId(), false));

            case RESUME_PLACEMENT -> guard.call(describe(m),
                    () -> campaignApi.setPlacementEnabled(customerId, m.placementId(), true));

            case PAUSE_AD, RESUME_AD -> guard.call(describe(m),
                    () -> campaignApi.setAdEnabled(customerId, m.placementId(), m.adId(),
                            m.type() == MutationType.RESUME_AD));

            case RETIRE_PLACEMENT -> placementPool.retire(customerId, m.placement());

            case LAUNCH_IN_PLACEMENT -> launch(m, customerId);
        };
    }

    /**
     * Activate, attach the endpoint once if there is one, create one ad per
     * creative, then count the use.
     */
    private String launch(PreparedMutation m, long customerId) {
        StringBuilder payload = new StringBuilder(
                placementPool.activate(customerId, m.campaignId(), m.placement(), m.settings()));

        try {
            if (m.endpoint() != null) {
                payload.append(';').append(guard.call("attach endpoint to " + m.placementId(),
                        () -> campaignApi.attachContactEndpoint(customerId, m.placementId(), m.endpoint())));
            }
            for (String creativeRef : m.creativeRefs()) {
                AdCreationRequest request = new AdCreationRequest(m.placementId(), creativeRef, true);
                payload.append(';').append(guard.call("create ad " + creativeRef + " in " + m.placementId(),
                        () -> campaignApi.createAd(customerId, request)));
            }
        } catch (RuntimeException e) {
            log.warn("Launch into placement {} stopped after activation; placement is left active",
                    m.placementId());
            throw e;
        }

        placementPool.recordUse(m.placement());
        return payload.toString();
    }

    private static String describe(PreparedMutation m) {
        return m.type() + " " + m.targetRef();
    }

    private static MutationResult result(PreparedMutation m, MutationOutcome outcome, ErrorCode code,
                                         String message, String payload) {
        return MutationResult.builder()
                .mutationIndex(m.index())
                .mutationType(m.type())
                .targetRef(m.targetRef())
                .outcome(outcome)
                .errorCode(code)
                .errorMessage(truncate(message))
                .responsePayload(payload)
                .build();
    }

    static String truncate(String message) {
        return message == null || message.length() <= 2000 ? message : message.substring(0, 2000);
    }
}
