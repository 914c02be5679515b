package com.phantom.service;

import com.phantom.config.CalendarSyncProperties;
import com.phantom.domain.model.Event;
import com.phantom.domain.model.User;
import com.phantom.domain.model.UserCalendarConnection;
import com.phantom.repository.EventRepository;
import com.phantom.repository.UserCalendarConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleCalendarSyncGateway implements CalendarSyncGateway {

    private final CalendarSyncProperties properties;
    private final UserCalendarConnectionRepository connectionRepository;
    private final EventRepository eventRepository;

    @Override
    public boolean isEnabled() {
        return properties.isOAuthConfigured();
    }

    @Override
    public void pushEvents(User user, List<Event> events) {
        UserCalendarConnection connection = connectionRepository.findByUser(user).orElse(null);
        String accessToken = resolveAccessToken(user, connection);
        if (connection == null || accessToken == null) {
            log.debug("No calendar connection for user {}, {} events not pushed", user.getId(), events.size());
            return;
        }

        RestClient client = RestClient.builder().baseUrl(properties.safeApiBase()).build();
        for (Event event : events) {
            try {
                Map<String, Object> payload = toPayload(event, user);
                if (event.getGoogleEventId() == null) {
                    Map<?, ?> response = client.post()
                            .uri("/calendars/{calendarId}/events", connection.getCalendarId())
                            .header("Authorization", "Bearer " + accessToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(payload)
                            .retrieve()
                            .body(Map.class);
                    if (response != null && response.get("id") instanceof String googleId) {
                        eventRepository.updateGoogleEventId(event.getId(), googleId);
                    }
                } else {
                    client.patch()
                            .uri("/calendars/{calendarId}/events/{eventId}", connection.getCalendarId(), event.getGoogleEventId())
                            .header("Authorization", "Bearer " + accessToken)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body(payload)
                            .retrieve()
                            .toBodilessEntity();
                }
            } catch (Exception e) {
                log.warn("Failed to push event {} to Google Calendar: {}", event.getId(), e.getMessage());
            }
        }
    }

    @Override
    public void removeEvents(User user, List<String> externalEventIds) {
        UserCalendarConnection connection = connectionRepository.findByUser(user).orElse(null);
        String accessToken = resolveAccessToken(user, connection);
        if (connection == null || accessToken == null) {
            return;
        }

        RestClient client = RestClient.builder().baseUrl(properties.safeApiBase()).build();
        for (String externalId : externalEventIds) {
            try {
                client.delete()
                        .uri("/calendars/{calendarId}/events/{eventId}", connection.getCalendarId(), externalId)
                        .header("Authorization", "Bearer " + accessToken)
                        .retrieve()
                        .toBodilessEntity();
            } catch (Exception e) {
                log.warn("Failed to delete Google Calendar event {}: {}", externalId, e.getMessage());
            }
        }
    }

    private Map<String, Object> toPayload(Event event, User user) {
        String timezone = user.getTimezone();
        Map<String, Object> payload = new HashMap<>();
        payload.put("summary", event.getTitle());
        if (event.getDescription() != null) {
            payload.put("description", event.getDescription());
        }
        payload.put("start", Map.of(
                "dateTime", event.getStartsAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "timeZone", timezone
        ));
        payload.put("end", Map.of(
                "dateTime", event.getEndsAt().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME),
                "timeZone", timezone
        ));
        return payload;
    }

    private String resolveAccessToken(User user, UserCalendarConnection connection) {
        if (connection == null || connection.getRefreshToken() == null || connection.getRefreshToken().isBlank()) {
            return null;
        }
        try {
            return getAccessToken(connection);
        } catch (Exception e) {
            log.error("Failed to resolve Google access token for user {}: {}", user.getId(), e.getMessage());
            return null;
        }
    }

    private synchronized String getAccessToken(UserCalendarConnection connection) {
        long now = System.currentTimeMillis() / 1000;
        if (connection.getAccessToken() != null
                && connection.getTokenExpiresAt() != null
                && connection.getTokenExpiresAt().toEpochSecond() - now > 30) {
            return connection.getAccessToken();
        }

        RestClient tokenClient = RestClient.builder().baseUrl(properties.safeTokenUri()).build();
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", properties.clientId());
        body.add("client_secret", properties.clientSecret());
        body.add("refresh_token", connection.getRefreshToken());
        body.add("grant_type", "refresh_token");

        try {
            Map<?, ?> tokenResp = tokenClient.post()
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(body)
                    .retrieve()
                    .body(Map.class);
            if (tokenResp == null || !(tokenResp.get("access_token") instanceof String token)) {
                throw new IllegalStateException("Google token response invalid: " + tokenResp);
            }
            Number expiresIn = tokenResp.get("expires_in") instanceof Number n ? n : 3600;
            connection.setAccessToken(token);
            connection.setTokenExpiresAt(OffsetDateTime.now().plusSeconds(expiresIn.longValue()));
            if (tokenResp.get("refresh_token") instanceof String newRefresh && !newRefresh.isBlank()) {
                connection.setRefreshToken(newRefresh);
            }
            connectionRepository.save(connection);
            return connection.getAccessToken();
        } catch (RestClientException e) {
            throw new IllegalStateException("Google OAuth token refresh failed: " + e.getMessage(), e);
        }
    }
}
