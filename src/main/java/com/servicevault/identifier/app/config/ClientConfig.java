package com.servicevault.identifier.app.config;

import com.servicevault.identifier.app.client.ClientViewCache;
import com.servicevault.identifier.app.client.IdentifierApi;
import com.servicevault.identifier.app.client.IdentifierSynchronizer;
import com.servicevault.identifier.app.client.WebClientIdentifierApi;
import java.time.Duration;
import lombok.Data;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Owner-side synchronizer wired against a remote identifier service. Off unless {@code
 * app.client.enabled=true}.
 */
@Log4j2
@Configuration
@ConditionalOnProperty(
    prefix = "app.client",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class ClientConfig {

  @ConfigurationProperties(prefix = "app.client")
  @Data
  public static class ClientProperties {
    private boolean enabled;
    private String baseUrl = "http://localhost:8080";
    private String sessionToken;
    private int timeoutSeconds = 10;
  }

  @Bean
  public IdentifierApi identifierApi(WebClient.Builder builder, ClientProperties props) {
    log.info(
        "client.init baseUrl={} timeoutSeconds={}", props.getBaseUrl(), props.getTimeoutSeconds());
    return new WebClientIdentifierApi(
        builder,
        props.getBaseUrl(),
        props.getSessionToken(),
        Duration.ofSeconds(props.getTimeoutSeconds()));
  }

  @Bean
  public ClientViewCache clientViewCache() {
    return new ClientViewCache();
  }

  @Bean
  public IdentifierSynchronizer identifierSynchronizer(IdentifierApi api, ClientViewCache cache) {
    return new IdentifierSynchronizer(api, cache);
  }
}
