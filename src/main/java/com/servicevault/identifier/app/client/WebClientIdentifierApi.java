package com.servicevault.identifier.app.client;

import com.servicevault.identifier.app.exception.ConflictException;
import com.servicevault.identifier.app.exception.ForbiddenException;
import com.servicevault.identifier.app.exception.NotFoundException;
import com.servicevault.identifier.app.exception.ValidationException;
import com.servicevault.identifier.app.model.ApiError;
import com.servicevault.identifier.app.model.IdentifierStatusView;
import com.servicevault.identifier.app.model.PrivacySettingsPatch;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** {@link IdentifierApi} over HTTP, authenticated with the owner's session token. */
@Log4j2
public class WebClientIdentifierApi implements IdentifierApi {

  private final WebClient webClient;
  private final Duration timeout;

  public WebClientIdentifierApi(
      WebClient.Builder builder, String baseUrl, String sessionToken, Duration timeout) {
    Objects.requireNonNull(baseUrl, "baseUrl must not be null");
    this.webClient =
        builder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + sessionToken)
            .build();
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
  }

  @Override
  public IdentifierStatusView fetch(String propertyId) {
    return webClient
        .get()
        .uri("/identifier/{propertyId}", propertyId)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .onStatus(HttpStatusCode::isError, WebClientIdentifierApi::toException)
        .bodyToMono(IdentifierStatusView.class)
        .doOnError(
            e -> log.warn("client.fetch failed propertyId={} err={}", propertyId, e.toString()))
        .block(timeout);
  }

  @Override
  public IdentifierStatusView generate(String propertyId, PrivacySettingsPatch overrides) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("regenerate", true);
    if (overrides != null && !overrides.isEmpty()) body.put("privacySettings", overrides);
    return post(propertyId, body, "generate");
  }

  @Override
  public IdentifierStatusView updatePrivacy(String propertyId, PrivacySettingsPatch patch) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("privacySettings", patch == null ? PrivacySettingsPatch.empty() : patch);
    return post(propertyId, body, "updatePrivacy");
  }

  @Override
  public void revoke(String propertyId) {
    webClient
        .post()
        .uri("/identifier/{propertyId}/revoke", propertyId)
        .retrieve()
        .onStatus(HttpStatusCode::isError, WebClientIdentifierApi::toException)
        .toBodilessEntity()
        .doOnError(
            e -> log.warn("client.revoke failed propertyId={} err={}", propertyId, e.toString()))
        .block(timeout);
  }

  private IdentifierStatusView post(String propertyId, Map<String, Object> body, String action) {
    return webClient
        .post()
        .uri("/identifier/{propertyId}", propertyId)
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .onStatus(HttpStatusCode::isError, WebClientIdentifierApi::toException)
        .bodyToMono(IdentifierStatusView.class)
        .doOnError(
            e ->
                log.warn(
                    "client.{} failed propertyId={} err={}", action, propertyId, e.toString()))
        .block(timeout);
  }

  /** Maps an error response back onto the service's exception types. */
  static Mono<? extends Throwable> toException(ClientResponse response) {
    int status = response.statusCode().value();
    if (status != 400 && status != 403 && status != 404 && status != 409) {
      return response.createException();
    }
    return response
        .bodyToMono(ApiError.class)
        .onErrorReturn(new ApiError())
        .defaultIfEmpty(new ApiError())
        .map(body -> translate(status, body));
  }

  private static RuntimeException translate(int status, ApiError body) {
    String message = body.getMessage() == null ? "HTTP " + status : body.getMessage();
    switch (status) {
      case 400:
        return new ValidationException(message);
      case 403:
        return new ForbiddenException(message);
      case 404:
        return new NotFoundException(message);
      default:
        return new ConflictException(message, Boolean.TRUE.equals(body.getRegenerateRequired()));
    }
  }
}
