package io.b2mash.b2b.mailprovisioning.emailaccount;

import io.b2mash.b2b.mailprovisioning.emailaccount.dto.ChangePasswordRequest;
import io.b2mash.b2b.mailprovisioning.emailaccount.dto.CreateEmailAccountRequest;
import io.b2mash.b2b.mailprovisioning.emailaccount.dto.EmailAccountResponse;
import io.b2mash.b2b.mailprovisioning.emailaccount.dto.RevealPasswordRequest;
import io.b2mash.b2b.mailprovisioning.emailaccount.dto.RevealPasswordResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/email-accounts")
public class EmailAccountController {

  private final EmailAccountService emailAccountService;

  public EmailAccountController(EmailAccountService emailAccountService) {
    this.emailAccountService = emailAccountService;
  }

  /** Exactly one of the three filters must be given. */
  @GetMapping
  public ResponseEntity<List<EmailAccountResponse>> list(
      @RequestParam(required = false) UUID customerId,
      @RequestParam(required = false) UUID membershipId,
      @RequestParam(required = false) UUID siteId) {
    List<EmailAccount> accounts;
    if (customerId != null) {
      accounts = emailAccountService.listByCustomer(customerId);
    } else if (membershipId != null) {
      accounts = emailAccountService.listByMembership(membershipId);
    } else if (siteId != null) {
      accounts = emailAccountService.listBySite(siteId);
    } else {
      throw new IllegalArgumentException("One of customerId, membershipId or siteId is required");
    }
    return ResponseEntity.ok(accounts.stream().map(EmailAccountResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<EmailAccountResponse> create(
      @Valid @RequestBody CreateEmailAccountRequest request) {
    var account = emailAccountService.createAccount(request.toCommand());
    return ResponseEntity.created(URI.create("/api/email-accounts/" + account.getId()))
        .body(EmailAccountResponse.from(account));
  }

  @GetMapping("/{id}")
  public ResponseEntity<EmailAccountResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(EmailAccountResponse.from(emailAccountService.get(id)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable UUID id) {
    emailAccountService.deleteAccount(id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/suspend")
  public ResponseEntity<EmailAccountResponse> suspend(@PathVariable UUID id) {
    return ResponseEntity.ok(EmailAccountResponse.from(emailAccountService.suspend(id)));
  }

  @PostMapping("/{id}/reactivate")
  public ResponseEntity<EmailAccountResponse> reactivate(@PathVariable UUID id) {
    return ResponseEntity.ok(EmailAccountResponse.from(emailAccountService.reactivate(id)));
  }

  @PostMapping("/{id}/retry")
  public ResponseEntity<EmailAccountResponse> retry(@PathVariable UUID id) {
    return ResponseEntity.accepted()
        .body(EmailAccountResponse.from(emailAccountService.retryProvisioning(id)));
  }

  @PostMapping("/{id}/password")
  public ResponseEntity<Void> changePassword(
      @PathVariable UUID id, @Valid @RequestBody(required = false) ChangePasswordRequest request) {
    emailAccountService.changePassword(id, request == null ? null : request.password());
    return ResponseEntity.accepted().build();
  }

  @PostMapping("/{id}/password/reveal")
  public ResponseEntity<RevealPasswordResponse> revealPassword(
      @PathVariable UUID id, @Valid @RequestBody RevealPasswordRequest request) {
    var account = emailAccountService.get(id);
    var password = emailAccountService.revealPassword(id, request.token());
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noStore())
        .body(new RevealPasswordResponse(account.getEmailAddress(), password));
  }

  @GetMapping("/{id}/client-settings")
  public ResponseEntity<MailClientConfiguration> clientSettings(@PathVariable UUID id) {
    return ResponseEntity.ok(emailAccountService.clientSettings(id));
  }
}
