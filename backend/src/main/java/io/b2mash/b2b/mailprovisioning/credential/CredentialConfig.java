package io.b2mash.b2b.mailprovisioning.credential;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CredentialProperties.class)
public class CredentialConfig {

  private static final Logger log = LoggerFactory.getLogger(CredentialConfig.class);

  @Bean
  PasswordCipher passwordCipher(CredentialProperties properties) {
    if (AesGcmPasswordCipher.isAvailable()) {
      return new AesGcmPasswordCipher(properties.siteSecret());
    }
    log.warn(
        "AES/GCM is not available in this JVM. One-time password tokens will be stored with "
            + "INSECURE base64 encoding. Do not run this configuration in production.");
    return new InsecureBase64PasswordCipher();
  }
}
