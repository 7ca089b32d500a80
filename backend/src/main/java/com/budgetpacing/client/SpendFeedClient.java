package com.budgetpacing.client;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.SpendReport;
import com.budgetpacing.exception.AdPlatformException;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class SpendFeedClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public SpendFeedClient(
            @Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
            PacingProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getSpendFeed().getBaseUrl();
    }

    /** Latest cumulative figure for the campaign; empty when the feed has none yet */
    public Optional<SpendReport> fetchLatest(String campaignId) {
        String endpoint = "/api/v1/spend/" + campaignId + "/latest";
        try {
            return Optional.ofNullable(
                    restTemplate.getForObject(baseUrl + endpoint, SpendReport.class));
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return Optional.empty();
            }
            throw new AdPlatformException(
                    "Spend feed request failed: " + e.getStatusText(),
                    e.getStatusCode(),
                    endpoint,
                    e);
        } catch (ResourceAccessException e) {
            throw new AdPlatformException("Spend feed unreachable: " + e.getMessage(), e);
        }
    }
}
