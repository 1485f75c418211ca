package com.premiergroup.ad_autopilot.client.google;

import com.google.ads.googleads.lib.GoogleAdsClient;
import com.google.ads.googleads.lib.utils.FieldMasks;
import com.google.ads.googleads.v20.common.CallAsset;
import com.google.ads.googleads.v20.enums.AdGroupAdStatusEnum.AdGroupAdStatus;
import com.google.ads.googleads.v20.enums.AdGroupStatusEnum.AdGroupStatus;
import com.google.ads.googleads.v20.enums.AssetFieldTypeEnum.AssetFieldType;
import com.google.ads.googleads.v20.enums.CampaignStatusEnum.CampaignStatus;
import com.google.ads.googleads.v20.resources.Ad;
import com.google.ads.googleads.v20.resources.AdGroup;
import com.google.ads.googleads.v20.resources.AdGroupAd;
import com.google.ads.googleads.v20.resources.AdGroupAsset;
import com.google.ads.googleads.v20.resources.Asset;
import com.google.ads.googleads.v20.resources.Campaign;
import com.google.ads.googleads.v20.resources.CampaignBudget;
import com.google.ads.googleads.v20.services.AdGroupAdOperation;
import com.google.ads.googleads.v20.services.AdGroupAdServiceClient;
import com.google.ads.googleads.v20.services.AdGroupAssetOperation;
import com.google.ads.googleads.v20.services.AdGroupAssetServiceClient;
import com.google.ads.googleads.v20.services.AdGroupOperation;
import com.google.ads.googleads.v20.services.AdGroupServiceClient;
import com.google.ads.googleads.v20.services.AssetOperation;
import com.google.ads.googleads.v20.services.AssetServiceClient;
import com.google.ads.googleads.v20.services.CampaignBudgetOperation;
import com.google.ads.googleads.v20.services.CampaignBudgetServiceClient;
import com.google.ads.googleads.v20.services.CampaignOperation;
import com.google.ads.googleads.v20.services.CampaignServiceClient;
import com.google.ads.googleads.v20.services.GoogleAdsRow;
import com.google.ads.googleads.v20.services.MutateAdGroupAdsResponse;
import com.google.ads.googleads.v20.services.MutateAdGroupAssetsResponse;
import com.google.ads.googleads.v20.services.MutateAdGroupsResponse;
import com.google.ads.googleads.v20.services.MutateAssetsResponse;
import com.google.ads.googleads.v20.services.MutateCampaignBudgetsResponse;
import com.google.ads.googleads.v20.services.MutateCampaignsResponse;
import com.google.ads.googleads.v20.utils.ResourceNames;
import com.google.api.gax.rpc.ApiException;
import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.dto.AdCreationRequest;
import com.premiergroup.ad_autopilot.dto.ExternalPlacement;
import com.premiergroup.ad_autopilot.dto.PlacementSettings;
import com.premiergroup.ad_autopilot.exception.ExternalRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.premiergroup.ad_autopilot.client.google.GaqlSearch.id;

/**
 * Campaign-management operations on Google Ads. A placement is an ad group,
 * a creative reference is the id of an existing ad and a contact endpoint is
 * published as a call asset.
 */
@Service
@Log4j2
@RequiredArgsConstructor
@ConditionalOnProperty(name = "google.ads.enabled", havingValue = "true", matchIfMissing = true)
public class GoogleAdsCampaignApi implements CampaignApiClient {

    private final GoogleAdsClient googleAdsClient;

    @Value("${google.ads.call-asset-country-code:US}")
    private String callAssetCountryCode;

    @Override
    public ExternalPlacement getPlacement(long customerId, String placementId) {
        String query = "SELECT ad_group.id, ad_group.name, ad_group.status, campaign.id "
                + "FROM ad_group WHERE ad_group.id = " + id(placementId);

        GoogleAdsRow row = GaqlSearch.stream(googleAdsClient, customerId, query).stream()
                .findFirst()
                .orElseThrow(() -> new ExternalRejectedException("Ad group " + placementId + " not found"));

        return new ExternalPlacement(
                String.valueOf(row.getAdGroup().getId()),
                row.getAdGroup().getName(),
                String.valueOf(row.getCampaign().getId()),
                row.getAdGroup().getStatus().name());
    }

    @Override
    public Optional<String> findProfileEndpoint(long customerId, String campaignId) {
        String query = String.join(" ", List.of(
                "SELECT asset.call_asset.phone_number",
                "FROM campaign_asset",
                "WHERE campaign.id =", String.valueOf(id(campaignId)),
                "AND campaign_asset.field_type = 'CALL'",
                "AND campaign_asset.status = 'ENABLED'",
                "LIMIT 1"
        ));

        return GaqlSearch.stream(googleAdsClient, customerId, query).stream()
                .map(row -> row.getAsset().getCallAsset().getPhoneNumber())
                .filter(phone -> !phone.isBlank())
                .findFirst();
    }

    @Override
    public String setCampaignEnabled(long customerId, String campaignId, boolean enabled) {
        Campaign campaign = Campaign.newBuilder()
                .setResourceName(ResourceNames.campaign(customerId, id(campaignId)))
                .setStatus(enabled ? CampaignStatus.ENABLED : CampaignStatus.PAUSED)
                .build();

        CampaignOperation op = CampaignOperation.newBuilder()
                .setUpdate(campaign)
                .setUpdateMask(FieldMasks.allSetFieldsOf(campaign))
                .build();

        try (CampaignServiceClient client = googleAdsClient.getVersion20().createCampaignServiceClient()) {
            MutateCampaignsResponse response = client.mutateCampaigns(Long.toString(customerId), List.of(op));
            return response.getResults(0).getResourceName();
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("campaign status update", e);
        }
    }

    @Override
    public String setPlacementEnabled(long customerId, String placementId, boolean enabled) {
        AdGroup adGroup = AdGroup.newBuilder()
                .setResourceName(ResourceNames.adGroup(customerId, id(placementId)))
                .setStatus(enabled ? AdGroupStatus.ENABLED : AdGroupStatus.PAUSED)
                .build();
        return mutateAdGroup(customerId, adGroup);
    }

    @Override
    public String setAdEnabled(long customerId, String placementId, String adId, boolean enabled) {
        AdGroupAd adGroupAd = AdGroupAd.newBuilder()
                .setResourceName(ResourceNames.adGroupAd(customerId, id(placementId), id(adId)))
                .setStatus(enabled ? AdGroupAdStatus.ENABLED : AdGroupAdStatus.PAUSED)
                .build();

        AdGroupAdOperation op = AdGroupAdOperation.newBuilder()
                .setUpdate(adGroupAd)
                .setUpdateMask(FieldMasks.allSetFieldsOf(adGroupAd))
                .build();

        return mutateAdGroupAds(customerId, List.of(op)).getResults(0).getResourceName();
    }

    @Override
    public String updateCampaignBudget(long customerId, String campaignId, long amountMicros) {
        // budgets are shared objects; find the one this campaign points at
        String query = "SELECT campaign.campaign_budget FROM campaign WHERE campaign.id = " + id(campaignId);
        String budgetResource = GaqlSearch.stream(googleAdsClient, customerId, query).stream()
                .map(row -> row.getCampaign().getCampaignBudget())
                .filter(rn -> !rn.isBlank())
                .findFirst()
                .orElseThrow(() -> new ExternalRejectedException("Campaign " + campaignId + " has no budget"));

        CampaignBudget budget = CampaignBudget.newBuilder()
                .setResourceName(budgetResource)
                .setAmountMicros(amountMicros)
                .build();

        CampaignBudgetOperation op = CampaignBudgetOperation.newBuilder()
                .setUpdate(budget)
                .setUpdateMask(FieldMasks.allSetFieldsOf(budget))
                .build();

        try (CampaignBudgetServiceClient client = googleAdsClient.getVersion20().createCampaignBudgetServiceClient()) {
            MutateCampaignBudgetsResponse response =
                    client.mutateCampaignBudgets(Long.toString(customerId), List.of(op));
            return response.getResults(0).getResourceName();
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("budget update", e);
        }
    }

    @Override
    public String activatePlacement(long customerId, String campaignId, String placementId, PlacementSettings settings) {
        StringBuilder payload = new StringBuilder();

        // 1. budget override lives on the campaign
        if (settings.dailyBudgetMicros() != null) {
            payload.append(updateCampaignBudget(customerId, campaignId, settings.dailyBudgetMicros())).append(';');
        }

        // 2. bid override and status flip in one ad group update
        AdGroup.Builder adGroup = AdGroup.newBuilder()
                .setResourceName(ResourceNames.adGroup(customerId, id(placementId)))
                .setStatus(AdGroupStatus.ENABLED);
        if (settings.cpcBidMicros() != null) {
            adGroup.setCpcBidMicros(settings.cpcBidMicros());
        }
        payload.append(mutateAdGroup(customerId, adGroup.build()));
        return payload.toString();
    }

    @Override
    public String pausePlacementWithChildren(long customerId, String placementId) {
        String query = String.join(" ", List.of(
                "SELECT ad_group_ad.resource_name",
                "FROM ad_group_ad",
                "WHERE ad_group.id =", String.valueOf(id(placementId)),
                "AND ad_group_ad.status = 'ENABLED'"
        ));

        List<AdGroupAdOperation> ops = GaqlSearch.stream(googleAdsClient, customerId, query).stream()
                .map(row -> AdGroupAd.newBuilder()
                        .setResourceName(row.getAdGroupAd().getResourceName())
                        .setStatus(AdGroupAdStatus.PAUSED)
                        .build())
                .map(ad -> AdGroupAdOperation.newBuilder()
                        .setUpdate(ad)
                        .setUpdateMask(FieldMasks.allSetFieldsOf(ad))
                        .build())
                .toList();

        String adGroupResource = setPlacementEnabled(customerId, placementId, false);
        if (!ops.isEmpty()) {
            mutateAdGroupAds(customerId, ops);
        }
        log.info("Paused ad group {} with {} ads for customer {}", placementId, ops.size(), customerId);
        return adGroupResource + ";ads_paused=" + ops.size();
    }

    @Override
    public String attachContactEndpoint(long customerId, String placementId, String endpoint) {
        Asset asset = Asset.newBuilder()
                .setCallAsset(CallAsset.newBuilder()
                        .setCountryCode(callAssetCountryCode)
                        .setPhoneNumber(endpoint)
                        .build())
                .build();

        String assetResource;
        try (AssetServiceClient client = googleAdsClient.getVersion20().createAssetServiceClient()) {
            MutateAssetsResponse response = client.mutateAssets(Long.toString(customerId),
                    List.of(AssetOperation.newBuilder().setCreate(asset).build()));
            assetResource = response.getResults(0).getResourceName();
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("call asset creation", e);
        }

        AdGroupAsset link = AdGroupAsset.newBuilder()
                .setAdGroup(ResourceNames.adGroup(customerId, id(placementId)))
                .setAsset(assetResource)
                .setFieldType(AssetFieldType.CALL)
                .build();

        try (AdGroupAssetServiceClient client = googleAdsClient.getVersion20().createAdGroupAssetServiceClient()) {
            MutateAdGroupAssetsResponse response = client.mutateAdGroupAssets(Long.toString(customerId),
                    List.of(AdGroupAssetOperation.newBuilder().setCreate(link).build()));
            return response.getResults(0).getResourceName();
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("call asset link", e);
        }
    }

    @Override
    public String createAd(long customerId, AdCreationRequest request) {
        AdGroupAd adGroupAd = AdGroupAd.newBuilder()
                .setAdGroup(ResourceNames.adGroup(customerId, id(request.placementId())))
                .setAd(Ad.newBuilder()
                        .setResourceName(ResourceNames.ad(customerId, id(request.creativeRef())))
                        .build())
                .setStatus(request.enabled() ? AdGroupAdStatus.ENABLED : AdGroupAdStatus.PAUSED)
                .build();

        AdGroupAdOperation op = AdGroupAdOperation.newBuilder().setCreate(adGroupAd).build();
        return mutateAdGroupAds(customerId, List.of(op)).getResults(0).getResourceName();
    }

    private String mutateAdGroup(long customerId, AdGroup adGroup) {
        AdGroupOperation op = AdGroupOperation.newBuilder()
                .setUpdate(adGroup)
                .setUpdateMask(FieldMasks.allSetFieldsOf(adGroup))
                .build();

        try (AdGroupServiceClient client = googleAdsClient.getVersion20().createAdGroupServiceClient()) {
            MutateAdGroupsResponse response = client.mutateAdGroups(Long.toString(customerId), List.of(op));
            return response.getResults(0).getResourceName();
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("ad group update", e);
        }
    }

    private MutateAdGroupAdsResponse mutateAdGroupAds(long customerId, List<AdGroupAdOperation> ops) {
        try (AdGroupAdServiceClient client = googleAdsClient.getVersion20().createAdGroupAdServiceClient()) {
            return client.mutateAdGroupAds(Long.toString(customerId), ops);
        } catch (ApiException e) {
            throw GoogleAdsErrors.translate("ad update", e);
        }
    }
}
