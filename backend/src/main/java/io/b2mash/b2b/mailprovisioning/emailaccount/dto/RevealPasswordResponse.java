package io.b2mash.b2b.mailprovisioning.emailaccount.dto;

public record RevealPasswordResponse(String emailAddress, String password) {

  @Override
  public String toString() {
    return "RevealPasswordResponse[emailAddress=" + emailAddress + ", password=***]";
  }
}
