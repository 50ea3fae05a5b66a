package io.b2mash.b2b.mailprovisioning.emailaccount;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EmailAccountProperties.class)
public class EmailAccountConfig {}
