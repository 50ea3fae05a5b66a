package io.b2mash.b2b.mailprovisioning.emailaccount.dto;

import jakarta.validation.constraints.Size;

/** A missing password asks for a generated one. */
public record ChangePasswordRequest(
    @Size(min = 8, max = 128, message = "password must be 8-128 characters") String password) {

  @Override
  public String toString() {
    return "ChangePasswordRequest[password=" + (password == null ? "null" : "***") + "]";
  }
}
