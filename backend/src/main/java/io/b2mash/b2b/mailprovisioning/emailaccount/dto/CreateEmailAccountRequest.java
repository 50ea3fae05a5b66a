package io.b2mash.b2b.mailprovisioning.emailaccount.dto;

import io.b2mash.b2b.mailprovisioning.emailaccount.CreateEmailAccountCommand;
import io.b2mash.b2b.mailprovisioning.emailaccount.PurchaseType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

public record CreateEmailAccountRequest(
    @NotNull(message = "customerId is required") UUID customerId,
    UUID membershipId,
    UUID siteId,
    @NotBlank(message = "emailAddress is required") @Size(max = 320) String emailAddress,
    String domain,
    @NotBlank(message = "provider is required") String provider,
    PurchaseType purchaseType,
    @Min(value = 0, message = "quotaMb must not be negative") Integer quotaMb,
    @Size(min = 8, max = 128, message = "password must be 8-128 characters") String password,
    @Size(max = 255) String displayName,
    UUID paymentId) {

  public CreateEmailAccountCommand toCommand() {
    return new CreateEmailAccountCommand(
        customerId,
        membershipId,
        siteId,
        emailAddress,
        domain,
        provider,
        purchaseType,
        quotaMb,
        password,
        displayName,
        paymentId);
  }

  @Override
  public String toString() {
    return "CreateEmailAccountRequest[customerId="
        + customerId
        + ", emailAddress="
        + emailAddress
        + ", provider="
        + provider
        + "]";
  }
}
