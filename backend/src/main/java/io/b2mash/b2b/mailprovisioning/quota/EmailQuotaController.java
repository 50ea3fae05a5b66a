package io.b2mash.b2b.mailprovisioning.quota;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/email-quota")
public class EmailQuotaController {

  private final EmailAccountQuotaService quotaService;

  public EmailQuotaController(EmailAccountQuotaService quotaService) {
    this.quotaService = quotaService;
  }

  @GetMapping
  public ResponseEntity<QuotaResponse> quota(
      @RequestParam UUID customerId, @RequestParam(required = false) UUID membershipId) {
    return ResponseEntity.ok(
        new QuotaResponse(
            customerId,
            membershipId,
            quotaService.countAccounts(customerId, membershipId),
            quotaService.remainingSlots(customerId, membershipId),
            quotaService.canCreateAccount(customerId, membershipId)));
  }

  public record QuotaResponse(
      UUID customerId,
      UUID membershipId,
      long used,
      RemainingSlots remaining,
      boolean canCreate) {}
}
