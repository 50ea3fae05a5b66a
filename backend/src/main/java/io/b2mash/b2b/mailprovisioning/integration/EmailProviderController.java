package io.b2mash.b2b.mailprovisioning.integration;

import io.b2mash.b2b.mailprovisioning.integration.EmailProviderService.ProviderSummary;
import io.b2mash.b2b.mailprovisioning.integration.mailbox.DnsRecord;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/email-providers")
public class EmailProviderController {

  private final EmailProviderService emailProviderService;

  public EmailProviderController(EmailProviderService emailProviderService) {
    this.emailProviderService = emailProviderService;
  }

  @GetMapping
  public ResponseEntity<List<ProviderSummary>> listProviders(
      @RequestParam(defaultValue = "true") boolean usableOnly) {
    return ResponseEntity.ok(emailProviderService.listProviders(usableOnly));
  }

  @GetMapping("/{providerId}/dns")
  public ResponseEntity<List<DnsRecord>> dnsInstructions(
      @PathVariable String providerId, @RequestParam String domain) {
    return ResponseEntity.ok(emailProviderService.dnsInstructions(providerId, domain));
  }

  @PostMapping("/{providerId}/test")
  public ResponseEntity<ConnectionTestResult> testConnection(@PathVariable String providerId) {
    return ResponseEntity.ok(emailProviderService.testConnection(providerId));
  }
}
