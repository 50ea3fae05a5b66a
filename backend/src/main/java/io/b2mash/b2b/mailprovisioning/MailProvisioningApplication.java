package io.b2mash.b2b.mailprovisioning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailProvisioningApplication {

  public static void main(String[] args) {
    SpringApplication.run(MailProvisioningApplication.class, args);
  }
}
