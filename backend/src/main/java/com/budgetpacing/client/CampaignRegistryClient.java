package com.budgetpacing.client;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.CampaignInfo;
import com.budgetpacing.exception.AdPlatformException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/** Read-only view of the campaign registry. */
@Slf4j
@Component
public class CampaignRegistryClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public CampaignRegistryClient(
            @Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
            PacingProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getRegistry().getBaseUrl();
    }

    public Optional<CampaignInfo> getCampaign(String campaignId) {
        String endpoint = "/api/v1/campaigns/" + campaignId;
        try {
            return Optional.ofNullable(
                    restTemplate.getForObject(baseUrl + endpoint, CampaignInfo.class));
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new AdPlatformException(
                    "Registry lookup failed: " + e.getStatusText(), e.getStatusCode(), endpoint, e);
        } catch (HttpStatusCodeException e) {
            throw new AdPlatformException(
                    "Registry lookup failed: " + e.getStatusText(), e.getStatusCode(), endpoint, e);
        } catch (ResourceAccessException e) {
            throw new AdPlatformException("Campaign registry unreachable: " + e.getMessage(), e);
        }
    }
}
