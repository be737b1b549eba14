package com.flagship.wager_ledger.presenter;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.wager_ledger.wager.Leg;
import com.flagship.wager_ledger.wager.Wager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Presenter backed by the chat gateway's HTTP API. The gateway renders the bet slip and
 * posts it; it answers with the id of the posted message.
 */
@Service
@Slf4j
public class ChatGatewayPresenter implements Presenter {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public ChatGatewayPresenter(RestTemplateBuilder restTemplateBuilder,
                                @Value("${chat.gateway.base-url:http://localhost:8090}") String baseUrl) {
        this.restTemplate = restTemplateBuilder.build();
        this.baseUrl = baseUrl;
    }

    @Override
    public String postArtifact(Wager wager) throws PostFailureException {
        ArtifactRequest request = new ArtifactRequest(
            wager.getId(),
            wager.getOwnerId(),
            wager.getGroupId(),
            wager.getDestination(),
            wager.getType().name(),
            wager.getStake(),
            wager.getPrice(),
            wager.americanPrice(),
            wager.getLegs().stream().map(Leg::describe).toList()
        );
        JsonNode response;
        try {
            response = restTemplate.postForObject(baseUrl + "/artifacts", request, JsonNode.class);
        } catch (RestClientException e) {
            throw new PostFailureException("Chat gateway rejected artifact for wager " + wager.getId(), e);
        }
        if (response == null || !response.hasNonNull("messageRef") || response.get("messageRef").asText().isBlank()) {
            throw new PostFailureException("Chat gateway returned no message reference for wager " + wager.getId());
        }
        String ref = response.get("messageRef").asText();
        log.info("Posted wager {} to {} as {}", wager.getId(), wager.getDestination(), ref);
        return ref;
    }

    @Override
    public List<Destination> listDestinations(String groupId) {
        try {
            JsonNode response = restTemplate.getForObject(baseUrl + "/groups/{groupId}/destinations",
                    JsonNode.class, groupId);
            List<Destination> destinations = new ArrayList<>();
            if (response != null && response.isArray()) {
                for (JsonNode node : response) {
                    destinations.add(new Destination(node.path("id").asText(), node.path("name").asText()));
                }
            }
            return destinations;
        } catch (RestClientException e) {
            log.warn("Failed to list destinations for group {}: {}", groupId, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void publishNotice(String destination, String message) {
        try {
            restTemplate.postForObject(baseUrl + "/notices", new NoticeRequest(destination, message), Void.class);
        } catch (RestClientException e) {
            throw new NoticeDeliveryException("Chat gateway rejected notice for " + destination, e);
        }
    }

    @lombok.Value
    static class ArtifactRequest {
        UUID wagerId;
        String ownerId;
        String groupId;
        String destination;
        String wagerType;
        BigDecimal stake;
        BigDecimal price;
        long americanPrice;
        List<String> legs;
    }

    @lombok.Value
    static class NoticeRequest {
        String destination;
        String message;
    }
}
