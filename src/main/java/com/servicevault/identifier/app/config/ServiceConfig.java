package com.servicevault.identifier.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicevault.identifier.app.repository.memory.InMemoryPropertyCatalog;
import com.servicevault.identifier.app.repository.memory.InMemoryPropertyCatalog.CatalogSeed;
import com.servicevault.identifier.app.service.IdentifierTokenGenerator;
import com.servicevault.identifier.app.service.VisibilityResolver;
import com.servicevault.identifier.app.session.InMemorySessionResolver;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import lombok.Data;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/** Beans shared by every profile. Storage beans live in the profile-specific configurations. */
@Log4j2
@Configuration
public class ServiceConfig {

  @ConfigurationProperties(prefix = "app.identifier")
  @Data
  public static class IdentifierProperties {

    /** Origin of the public site, used to build the QR payload URL. */
    private String publicOrigin = "http://localhost:8080";

    /** Leading segment of every issued token. */
    private String tokenPrefix = "HOME";
  }

  // -------------------
  // Core
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public IdentifierTokenGenerator identifierTokenGenerator(
      IdentifierProperties properties, Clock clock) {
    return new IdentifierTokenGenerator(properties.getTokenPrefix(), clock);
  }

  @Bean
  public VisibilityResolver visibilityResolver() {
    return new VisibilityResolver();
  }

  // -------------------
  // Collaborators owned by other subsystems
  // -------------------

  @Bean
  public InMemorySessionResolver sessionResolver(
      @Value("${app.session.demo-token:}") String demoToken,
      @Value("${app.session.demo-user:demo-owner}") String demoUser) {
    InMemorySessionResolver sessions = new InMemorySessionResolver();
    if (!demoToken.isBlank()) {
      sessions.bind(demoToken, demoUser);
      log.info("session.demo bound userId={}", demoUser);
    }
    return sessions;
  }

  @Bean
  public InMemoryPropertyCatalog propertyCatalog(
      ObjectMapper om,
      ResourceLoader resourceLoader,
      @Value("${app.catalog.seed-resource:}") String seedResource) {
    InMemoryPropertyCatalog catalog = new InMemoryPropertyCatalog();
    if (seedResource == null || seedResource.isBlank()) {
      log.warn("catalog.seed none, in-memory catalog starts empty");
      return catalog;
    }

    Resource resource = resourceLoader.getResource(seedResource);
    if (!resource.exists()) {
      log.warn("catalog.seed missing resource={}", seedResource);
      return catalog;
    }
    try (InputStream in = resource.getInputStream()) {
      catalog.seed(om.readValue(in, CatalogSeed.class));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load catalog seed " + seedResource, e);
    }
    return catalog;
  }
}
