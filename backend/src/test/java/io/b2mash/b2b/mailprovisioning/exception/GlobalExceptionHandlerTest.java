package io.b2mash.b2b.mailprovisioning.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

  @Test
  void uniqueAddressViolation_isReportedAsEmailExists() {
    var ex =
        new DataIntegrityViolationException(
            "could not execute statement",
            new SQLException(
                "ERROR: duplicate key value violates unique constraint"
                    + " \"uq_email_accounts_email_address\""));

    var response = handler.handleDataIntegrity(ex);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().getTitle()).isEqualTo("Email address already exists");
    assertThat(response.getBody().getProperties()).containsEntry("code", "email_exists");
  }

  @Test
  void otherConstraintViolation_isAPlainConflict() {
    var ex =
        new DataIntegrityViolationException(
            "could not execute statement",
            new SQLException(
                "ERROR: new row for relation \"email_accounts\" violates check constraint"
                    + " \"chk_email_accounts_quota\""));

    var response = handler.handleDataIntegrity(ex);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().getTitle()).isEqualTo("Data conflict");
    assertThat(response.getBody().getProperties()).isNull();
  }
}
