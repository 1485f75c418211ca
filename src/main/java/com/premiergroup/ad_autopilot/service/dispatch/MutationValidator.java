package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.dto.ExternalPlacement;
import com.premiergroup.ad_autopilot.dto.PlacementSettings;
import com.premiergroup.ad_autopilot.dto.ProposedMutation;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.ErrorCode;
import com.premiergroup.ad_autopilot.enums.MutationType;
import com.premiergroup.ad_autopilot.enums.ObjectiveType.EndpointPolicy;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.exception.ExternalApiException;
import com.premiergroup.ad_autopilot.exception.MutationValidationException;
import com.premiergroup.ad_autopilot.repository.DirectiveRepository;
import com.premiergroup.ad_autopilot.repository.PlacementRepository;
import com.premiergroup.ad_autopilot.service.endpoint.EndpointContext;
import com.premiergroup.ad_autopilot.service.endpoint.EndpointResolver;
import com.premiergroup.ad_autopilot.service.loop.ControlLoopSettings;
import com.premiergroup.ad_autopilot.service.pool.PlacementPool;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks one proposed mutation against the account and resolves what it
 * needs. A launch reserves its placement here, so an exhausted pool or a
 * missing required endpoint is caught before anything reaches the platform.
 */
@Component
@Log4j2
@RequiredArgsConstructor
public class MutationValidator {

    static final String PARAM_DAILY_BUDGET = "daily_budget";
    static final String PARAM_CPC_BID = "cpc_bid";
    static final String PARAM_CREATIVE_REFS = "creative_refs";

    private final DirectiveRepository directiveRepository;
    private final PlacementRepository placementRepository;
    private final PlacementPool placementPool;
    private final EndpointResolver endpointResolver;
    private final CampaignApiClient campaignApi;
    private final ExternalCallGuard guard;

    public PreparedMutation prepare(int index, ProposedMutation mutation, AdAccount account,
                                    ControlLoopSettings settings) {
        if (mutation == null || mutation.type() == null) {
            throw new MutationValidationException("Mutation type is missing");
        }
        String target = mutation.targetRef() == null ? "" : mutation.targetRef().trim();
        if (target.isEmpty()) {
            throw new MutationValidationException("target_ref is missing");
        }

        PreparedMutation.PreparedMutationBuilder prepared = PreparedMutation.builder()
                .index(index)
                .type(mutation.type())
                .targetRef(target);

        return switch (mutation.type()) {
            case PAUSE_CAMPAIGN, RESUME_CAMPAIGN -> prepared
                    .campaignId(ownedCampaign(account, target))
                    .targetKey("campaign:" + target)
                    .build();

            case UPDATE_CAMPAIGN_BUDGET -> {
                BigDecimal budget = decimalParam(mutation.params(), PARAM_DAILY_BUDGET);
                if (budget == null) {
                    throw new MutationValidationException(PARAM_DAILY_BUDGET + " is required");
                }
                yield prepared
                        .campaignId(ownedCampaign(account, target))
                        .amountMicros(toMicros(checkBudget(budget, settings)))
                        .targetKey("campaign:" + target)
                        .build();
            }

            case PAUSE_PLACEMENT, RESUME_PLACEMENT -> preparePlacementToggle(prepared, mutation.type(), account, target);

            case PAUSE_AD, RESUME_AD -> {
                String[] parts = target.split("~", -1);
                if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                    throw new MutationValidationException("Ad target must look like placementId~adId: " + target);
                }
                numeric(parts[1]);
                Optional<Placement> pooled = registeredPlacement(account, parts[0]);
                if (pooled.isEmpty()) {
                    ownedExternalPlacement(account, parts[0]);
                }
                yield prepared
                        .placementId(parts[0])
                        .adId(parts[1])
                        .targetKey("placement:" + parts[0])
                        .build();
            }

            case RETIRE_PLACEMENT -> {
                Placement placement = registeredPlacement(account, target)
                        .orElseThrow(() -> new MutationValidationException(
                                "Placement " + target + " is not registered in any pool of account " + account.getId()));
                if (placement.getStatus() == PlacementStatus.RETIRED) {
                    throw new MutationValidationException("Placement " + target + " is already retired");
                }
                yield prepared
                        .placement(placement)
                        .placementId(target)
                        .targetKey("placement:" + target)
                        .build();
            }

            case LAUNCH_IN_PLACEMENT -> prepareLaunch(prepared, mutation, account, settings, target);
        };
    }

    private PreparedMutation preparePlacementToggle(PreparedMutation.PreparedMutationBuilder prepared,
                                                    MutationType type, AdAccount account, String target) {
        Optional<Placement> pooled = registeredPlacement(account, target);
        if (pooled.isPresent()) {
            Placement placement = pooled.get();
            if (type == MutationType.RESUME_PLACEMENT) {
                throw new MutationValidationException(
                        "Pooled placement " + target + " is only started through " + MutationType.LAUNCH_IN_PLACEMENT);
            }
            if (placement.getStatus() != PlacementStatus.ACTIVE) {
                throw new MutationValidationException(
                        "Placement " + target + " is " + placement.getStatus() + ", not active");
            }
            prepared.placement(placement);
        } else {
            ownedExternalPlacement(account, target);
        }
        return prepared
                .placementId(target)
                .targetKey("placement:" + target)
                .build();
    }

    private PreparedMutation prepareLaunch(PreparedMutation.PreparedMutationBuilder prepared, ProposedMutation mutation,
                                           AdAccount account, ControlLoopSettings settings, String target) {
        Long directiveId = numeric(target);
        Directive directive = directiveRepository.findByIdAndAccount_Id(directiveId, account.getId())
                .orElseThrow(() -> new MutationValidationException(
                        "Directive " + directiveId + " not found for account " + account.getId()));
        if (!Boolean.TRUE.equals(directive.getIsActive())) {
            throw new MutationValidationException("Directive " + directiveId + " is not active");
        }
        if (directive.getExternalCampaignId() == null) {
            throw new MutationValidationException("Directive " + directiveId + " has no external campaign");
        }

        List<String> creatives = creativeRefs(mutation.params(), directive);
        if (creatives.isEmpty()) {
            throw new MutationValidationException("Directive " + directiveId + " has no creatives to launch");
        }

        BigDecimal budget = decimalParam(mutation.params(), PARAM_DAILY_BUDGET);
        BigDecimal bid = decimalParam(mutation.params(), PARAM_CPC_BID);
        if (bid != null && bid.signum() <= 0) {
            throw new MutationValidationException(PARAM_CPC_BID + " must be positive");
        }
        PlacementSettings placementSettings = new PlacementSettings(
                budget == null ? null : toMicros(checkBudget(budget, settings)),
                bid == null ? null : toMicros(bid));

        // endpoint before the pool: a rejected launch must not hold a reservation
        String endpoint = null;
        EndpointPolicy policy = directive.getObjective().getEndpointPolicy();
        if (policy != EndpointPolicy.NONE) {
            endpoint = endpointResolver.resolve(EndpointContext.of(directive, account)).orElse(null);
            if (endpoint == null && policy == EndpointPolicy.REQUIRED) {
                throw new MutationValidationException("No contact endpoint resolvable for directive " + directiveId
                        + " (objective " + directive.getObjective() + " requires one)");
            }
        }

        Placement placement = placementPool.acquire(directiveId)
                .orElseThrow(() -> new MutationValidationException(ErrorCode.RESOURCE_EXHAUSTED,
                        "No idle placement left: provision more placements for directive " + directiveId));

        return prepared
                .campaignId(directive.getExternalCampaignId())
                .placement(placement)
                .placementId(placement.getExternalId())
                .settings(placementSettings)
                .creativeRefs(creatives)
                .endpoint(endpoint)
                .targetKey("campaign:" + directive.getExternalCampaignId())
                .build();
    }

    private String ownedCampaign(AdAccount account, String campaignId) {
        numeric(campaignId);
        if (!directiveRepository.existsByAccount_IdAndExternalCampaignId(account.getId(), campaignId)) {
            throw new MutationValidationException(
                    "Campaign " + campaignId + " is not managed for account " + account.getId());
        }
        return campaignId;
    }

    private Optional<Placement> registeredPlacement(AdAccount account, String externalId) {
        numeric(externalId);
        return placementRepository.findFirstByDirective_Account_IdAndExternalId(account.getId(), externalId);
    }

    /**
     * A placement outside the pools is accepted when the platform places it in
     * one of the account's campaigns.
     */
    private void ownedExternalPlacement(AdAccount account, String placementId) {
        ExternalPlacement external;
        try {
            external = guard.call("placement lookup " + placementId,
                    () -> campaignApi.getPlacement(account.getCustomerId(), placementId));
        } catch (ExternalApiException e) {
            throw new MutationValidationException(e.getErrorCode(),
                    "Could not verify placement " + placementId + ": " + e.getMessage());
        }
        if (!directiveRepository.existsByAccount_IdAndExternalCampaignId(account.getId(), external.campaignId())) {
            throw new MutationValidationException(
                    "Placement " + placementId + " is not in a campaign managed for account " + account.getId());
        }
    }

    private List<String> creativeRefs(Map<String, Object> params, Directive directive) {
        Object raw = params.get(PARAM_CREATIVE_REFS);
        if (raw == null) {
            return List.copyOf(directive.getCreativeRefs());
        }
        if (!(raw instanceof List<?> list)) {
            throw new MutationValidationException(PARAM_CREATIVE_REFS + " must be a list");
        }
        List<String> refs = list.stream()
                .map(o -> o == null ? "" : o.toString().trim())
                .toList();
        if (refs.stream().anyMatch(String::isEmpty)) {
            throw new MutationValidationException(PARAM_CREATIVE_REFS + " contains a blank entry");
        }
        refs.forEach(MutationValidator::numeric);
        return refs;
    }

    private static BigDecimal checkBudget(BigDecimal budget, ControlLoopSettings settings) {
        if (budget.signum() <= 0) {
            throw new MutationValidationException(PARAM_DAILY_BUDGET + " must be positive");
        }
        if (budget.compareTo(settings.maxDailyBudget()) > 0) {
            throw new MutationValidationException(PARAM_DAILY_BUDGET + " " + budget.toPlainString()
                    + " exceeds the limit of " + settings.maxDailyBudget().toPlainString());
        }
        return budget;
    }

    private static BigDecimal decimalParam(Map<String, Object> params, String key) {
        Object raw = params.get(key);
        if (raw == null) {
            return null;
        }
        try {
            return new BigDecimal(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new MutationValidationException(key + " is not a number: " + raw);
        }
    }

    private static long toMicros(BigDecimal amount) {
        return amount.movePointRight(6).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static Long numeric(String id) {
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new MutationValidationException("Not a numeric id: " + id);
        }
    }
}
