package io.b2mash.b2b.mailprovisioning.integration.mailbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.mailprovisioning.integration.ProviderError;
import io.b2mash.b2b.mailprovisioning.integration.ProviderErrorKind;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps {@link RestClientException}s raised by provider HTTP calls onto {@link ProviderErrorKind}s,
 * pulling a human-readable message out of the common JSON error shapes (Graph/Google {@code
 * error.message}, OAuth {@code error_description}, Purelymail {@code message}, cPanel {@code
 * errors[]}).
 */
final class RemoteErrorTranslator {

  private static final int MAX_RAW_BODY = 200;

  private static final Set<String> CREDENTIAL_ERRORS =
      Set.of("invalid_client", "invalid_grant", "unauthorized_client", "invalid_request");

  private final String providerName;
  private final ObjectMapper objectMapper;

  RemoteErrorTranslator(String providerName, ObjectMapper objectMapper) {
    this.providerName = providerName;
    this.objectMapper = objectMapper;
  }

  ProviderError translate(RestClientException e) {
    if (e instanceof ResourceAccessException) {
      return new ProviderError(
          ProviderErrorKind.REMOTE_UNREACHABLE, providerName + " unreachable: " + e.getMessage());
    }
    if (e instanceof RestClientResponseException response) {
      var body = parse(response.getResponseBodyAsString());
      int status = response.getStatusCode().value();
      var message =
          providerName
              + " API error "
              + status
              + ": "
              + extractMessage(body, response.getResponseBodyAsString());
      return new ProviderError(kindFor(status, body), message);
    }
    return new ProviderError(
        ProviderErrorKind.REMOTE_REJECTED,
        providerName + " returned an unreadable response: " + e.getMessage());
  }

  private ProviderErrorKind kindFor(int status, JsonNode body) {
    if (status == 401 || status == 403) {
      return ProviderErrorKind.INVALID_CREDENTIALS;
    }
    if (status == 404) {
      return ProviderErrorKind.NOT_FOUND;
    }
    if (status == 409) {
      return ProviderErrorKind.ALREADY_EXISTS;
    }
    if (status == 429) {
      return ProviderErrorKind.RATE_LIMITED;
    }
    // OAuth token endpoints answer bad client credentials with a 400
    if (status == 400 && body != null && CREDENTIAL_ERRORS.contains(body.path("error").asText())) {
      return ProviderErrorKind.INVALID_CREDENTIALS;
    }
    return ProviderErrorKind.REMOTE_REJECTED;
  }

  private JsonNode parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readTree(raw);
    } catch (JsonProcessingException e) {
      // HTML error pages and plain-text bodies are reported raw
      return null;
    }
  }

  static String extractMessage(JsonNode body, String raw) {
    if (body != null && body.isObject()) {
      var error = body.path("error");
      if (error.isObject() && error.hasNonNull("message")) {
        return error.get("message").asText();
      }
      if (body.hasNonNull("error_description")) {
        return body.get("error_description").asText();
      }
      if (error.isTextual()) {
        return error.asText();
      }
      if (body.hasNonNull("message")) {
        return body.get("message").asText();
      }
      var errors = body.path("errors");
      if (errors.isArray() && !errors.isEmpty()) {
        return StreamSupport.stream(errors.spliterator(), false)
            .map(JsonNode::asText)
            .collect(Collectors.joining("; "));
      }
    }
    if (raw == null || raw.isBlank()) {
      return "no response body";
    }
    return raw.length() > MAX_RAW_BODY ? raw.substring(0, MAX_RAW_BODY) + "..." : raw;
  }
}
