package com.vibecoding.pvecheck.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibecoding.pvecheck.config.ProbeOptions;
import com.vibecoding.pvecheck.config.ProxmoxClientProperties;
import com.vibecoding.pvecheck.exception.ClusterApiException;
import com.vibecoding.pvecheck.model.ResourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Proxmox VE REST API 클라이언트 (https://host:port/api2/json)
 *
 * 티켓 방식 인증: /access/ticket 으로 발급받은 티켓을 PVEAuthCookie 쿠키로 전달한다.
 */
public class ProxmoxApiClient implements ClusterApiClient {

    private static final Logger log = LoggerFactory.getLogger(ProxmoxApiClient.class);

    private static final String AUTH_COOKIE = "PVEAuthCookie";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String host;
    private final String baseUrl;
    private final ProbeOptions options;
    private final long ticketLifetimeSeconds;
    private final Clock clock;

    private String ticket;

    public ProxmoxApiClient(String host, ProbeOptions options, ProxmoxClientProperties properties,
                            RestTemplate restTemplate) {
        this(host, options, properties, restTemplate, Clock.systemUTC());
    }

    ProxmoxApiClient(String host, ProbeOptions options, ProxmoxClientProperties properties,
                     RestTemplate restTemplate, Clock clock) {
        this.host = host;
        this.options = options;
        this.restTemplate = restTemplate;
        this.baseUrl = "https://" + host + ":" + options.getPort() + properties.getApiBasePath();
        this.ticketLifetimeSeconds = properties.getTicketLifetimeSeconds();
        this.clock = clock;
    }

    @Override
    public boolean login() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("username", options.getLoginName());
        form.add("password", options.getPassword());

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    baseUrl + "/access/ticket",
                    HttpMethod.POST,
                    new HttpEntity<>(form, headers),
                    String.class
            );
            if (response.getBody() == null) {
                log.warn("Empty login response from {}", host);
                return false;
            }
            JsonNode data = objectMapper.readTree(response.getBody()).path("data");
            ticket = data.path("ticket").asText("");
        } catch (RestClientException | JsonProcessingException e) {
            log.warn("Login to {} as {} failed: {}", host, options.getLoginName(), e.getMessage());
            ticket = null;
            return false;
        }

        log.debug("Logged in to {} as {}", host, options.getLoginName());
        return !ticket.isEmpty();
    }

    /**
     * 티켓 형식: PVE:user@realm:HEXTIME::signature
     */
    @Override
    public boolean checkLoginTicket() {
        if (ticket == null || ticket.isEmpty()) {
            return false;
        }
        String[] parts = ticket.split(":");
        if (parts.length < 3) {
            log.warn("Unexpected ticket format from {}", host);
            return false;
        }
        long issuedAt;
        try {
            issuedAt = Long.parseLong(parts[2], 16);
        } catch (NumberFormatException e) {
            log.warn("Unexpected ticket timestamp '{}' from {}", parts[2], host);
            return false;
        }
        long age = clock.instant().getEpochSecond() - issuedAt;
        log.debug("Ticket from {} is {}s old", host, age);
        return age < ticketLifetimeSeconds;
    }

    @Override
    public ApiVersion apiVersion() {
        JsonNode data = fetch("/version");
        return ApiVersion.builder()
                .version(data.path("version").asText(""))
                .build();
    }

    @Override
    public List<ResourceObject> get(String path) {
        JsonNode data = fetch(path);
        if (!data.isArray()) {
            throw new ClusterApiException("Unexpected response for " + path + " from " + host + ": data is not a list");
        }
        List<ResourceObject> objects = new ArrayList<>();
        for (JsonNode item : data) {
            objects.add(ResourceObject.fromJson(item));
        }
        log.debug("GET {} returned {} objects", path, objects.size());
        return objects;
    }

    @Override
    public String getHost() {
        return host;
    }

    private JsonNode fetch(String path) {
        if (ticket == null) {
            throw new ClusterApiException("Not logged in to " + host);
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.COOKIE, AUTH_COOKIE + "=" + ticket);

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    baseUrl + path,
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    String.class
            );
            if (response.getBody() == null) {
                throw new ClusterApiException("Empty response for " + path + " from " + host);
            }
            return objectMapper.readTree(response.getBody()).path("data");
        } catch (RestClientException e) {
            log.error("GET {} on {} failed", path, host, e);
            throw new ClusterApiException("GET " + path + " on " + host + " failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new ClusterApiException("Invalid JSON for " + path + " from " + host, e);
        }
    }
}
