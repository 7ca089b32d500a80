package com.budgetpacing.client;

import com.budgetpacing.config.PacingProperties;
import com.budgetpacing.dto.platform.BudgetChangeCommand;
import com.budgetpacing.dto.platform.BudgetChangeResponse;
import com.budgetpacing.exception.AdPlatformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Advertising-platform adapter. A single attempt per call; retries belong to the commit adapter so
 * that each attempt reuses the adjustment's idempotency key.
 */
@Slf4j
@Component
public class AdPlatformClient {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public AdPlatformClient(
            @Qualifier("collaboratorRestTemplate") RestTemplate restTemplate,
            PacingProperties properties) {
        this.restTemplate = restTemplate;
        this.baseUrl = properties.getPlatform().getBaseUrl();
    }

    public BudgetChangeResponse applyBudgetChange(BudgetChangeCommand command) {
        String endpoint = "/api/v1/campaigns/" + command.getCampaignId() + "/budget";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_KEY_HEADER, command.getIdempotencyKey());

        log.info(
                "Applying budget change: campaignId={}, newDailyBudget={}, pause={}, resume={},"
                        + " idempotencyKey={}",
                command.getCampaignId(),
                command.getNewDailyBudget(),
                command.isPause(),
                command.isResume(),
                command.getIdempotencyKey());

        try {
            ResponseEntity<BudgetChangeResponse> response =
                    restTemplate.exchange(
                            baseUrl + endpoint,
                            HttpMethod.PUT,
                            new HttpEntity<>(command, headers),
                            BudgetChangeResponse.class);
            BudgetChangeResponse body = response.getBody();
            if (body == null) {
                throw new AdPlatformException(
                        "Empty response from ad platform", HttpStatus.BAD_GATEWAY, endpoint);
            }
            return body;
        } catch (HttpStatusCodeException e) {
            throw new AdPlatformException(
                    "Ad platform rejected budget change: " + e.getStatusText(),
                    e.getStatusCode(),
                    endpoint,
                    e);
        } catch (ResourceAccessException e) {
            throw new AdPlatformException("Ad platform unreachable: " + e.getMessage(), e);
        }
    }
}
