package io.b2mash.b2b.mailprovisioning.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration-backed host ports. A host application replaces them by declaring its own beans. */
@Configuration
@EnableConfigurationProperties(PlatformProperties.class)
public class PlatformConfig {

  private static final Logger log = LoggerFactory.getLogger(PlatformConfig.class);

  @Bean
  @ConditionalOnMissingBean(CustomerDirectory.class)
  CustomerDirectory customerDirectory(PlatformProperties properties) {
    if (properties.customers().isEmpty()) {
      log.warn("No customer directory configured; every customer id will be accepted");
    }
    return new ConfiguredCustomerDirectory(properties);
  }

  @Bean
  @ConditionalOnMissingBean(MembershipLimitations.class)
  MembershipLimitations membershipLimitations(PlatformProperties properties) {
    log.info("Using {} configured membership limitation(s)", properties.memberships().size());
    return new ConfiguredMembershipLimitations(properties);
  }
}
