package com.servicevault.identifier.app.config;

import com.servicevault.identifier.app.repository.memory.InMemoryMasterIdentifierRepository;
import com.servicevault.identifier.app.service.DocumentLinkSigner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/** Storage for runs without an AWS profile (development and tests). */
@Configuration
@Profile("!local & !production")
public class InMemoryStoreConfig {

  @Bean
  public InMemoryMasterIdentifierRepository masterIdentifierRepository() {
    return new InMemoryMasterIdentifierRepository();
  }

  @Bean
  public DocumentLinkSigner documentLinkSigner() {
    return DocumentLinkSigner.none();
  }
}
