package com.flagship.wager_ledger.presenter;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches upcoming games and rosters from the sports data service.
 *
 * Lookup failures are logged and answered with an empty list, which sends the wizard down
 * the manual entry path.
 */
@Service
@Slf4j
public class SportsDataClient implements EventDataProvider {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public SportsDataClient(RestTemplateBuilder restTemplateBuilder,
                            @Value("${sports-data.base-url:http://localhost:8091}") String baseUrl) {
        this.restTemplate = restTemplateBuilder.build();
        this.baseUrl = baseUrl;
    }

    @Override
    public List<ScheduledEvent> listUpcomingEvents(String league) {
        try {
            JsonNode response = restTemplate.getForObject(baseUrl + "/leagues/{league}/events?status=scheduled",
                    JsonNode.class, league);
            List<ScheduledEvent> events = new ArrayList<>();
            if (response != null && response.isArray()) {
                for (JsonNode node : response) {
                    events.add(new ScheduledEvent(
                        node.path("id").asText(),
                        league,
                        node.path("homeTeam").asText(),
                        node.path("awayTeam").asText(),
                        parseInstant(node.path("startTime").asText(null))
                    ));
                }
            }
            log.debug("Fetched {} upcoming events for {}", events.size(), league);
            return events;
        } catch (RestClientException e) {
            log.warn("Failed to fetch events for league {}: {}", league, e.getMessage());
            return List.of();
        }
    }

    /**
     * Reads the roster endpoint, which answers {@code {"home": [{"name": ...}], "away": [...]}}.
     */
    @Override
    public EventParticipants listParticipants(String eventRef) {
        try {
            JsonNode response = restTemplate.getForObject(baseUrl + "/events/{eventRef}/players",
                    JsonNode.class, eventRef);
            if (response == null) {
                return EventParticipants.none();
            }
            return new EventParticipants(playerNames(response.path("home")), playerNames(response.path("away")));
        } catch (RestClientException e) {
            log.warn("Failed to fetch participants for event {}: {}", eventRef, e.getMessage());
            return EventParticipants.none();
        }
    }

    private static List<String> playerNames(JsonNode side) {
        List<String> players = new ArrayList<>();
        if (side.isArray()) {
            for (JsonNode node : side) {
                String name = node.path("name").asText();
                if (!name.isBlank()) {
                    players.add(name);
                }
            }
        }
        return players;
    }

    private static Instant parseInstant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable start time {}", text);
            return null;
        }
    }
}
