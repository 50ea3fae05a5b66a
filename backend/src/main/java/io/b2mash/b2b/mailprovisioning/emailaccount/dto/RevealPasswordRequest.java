package io.b2mash.b2b.mailprovisioning.emailaccount.dto;

import jakarta.validation.constraints.NotBlank;

public record RevealPasswordRequest(@NotBlank(message = "token is required") String token) {

  @Override
  public String toString() {
    return "RevealPasswordRequest[token=***]";
  }
}
