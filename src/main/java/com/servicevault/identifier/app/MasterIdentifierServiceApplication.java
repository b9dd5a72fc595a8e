package com.servicevault.identifier.app;

import com.servicevault.identifier.app.config.ClientConfig.ClientProperties;
import com.servicevault.identifier.app.config.ServiceConfig.IdentifierProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Master Identifier Service Spring Boot application.
 *
 * <p>The service issues and revokes the public token behind a property's QR code, stores the
 * owner's privacy settings and serves the privacy-scoped public history. Usage:
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties({IdentifierProperties.class, ClientProperties.class})
public class MasterIdentifierServiceApplication {

  /**
   * Main entry point for the Spring Boot application.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting Master Identifier Service application...");
    SpringApplication.run(MasterIdentifierServiceApplication.class, args);
    log.info("Master Identifier Service application started successfully.");
  }
}
