package com.cgraph.auth.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.cgraph.auth.model.auth.LoginResponse;
import com.cgraph.auth.model.error.ErrorResponse;
import com.cgraph.auth.model.secondfactor.SecondFactorEnableRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class WireModelTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void errorResponse_omitsMissingCorrelationId() throws Exception {
    assertThat(mapper.writeValueAsString(new ErrorResponse("invalid_code")))
        .isEqualTo("{\"error\":\"invalid_code\"}");
    assertThat(mapper.writeValueAsString(new ErrorResponse("internal_error", "abc")))
        .isEqualTo("{\"error\":\"internal_error\",\"correlationId\":\"abc\"}");
  }

  @Test
  void loginResponse_secondFactorRequired_carriesOnlyPendingToken() throws Exception {
    JsonNode json = mapper.readTree(mapper.writeValueAsString(
        LoginResponse.secondFactorRequired("u1", "pending")));
    assertThat(json.get("status").asText()).isEqualTo("second_factor_required");
    assertThat(json.get("secondFactorToken").asText()).isEqualTo("pending");
    assertThat(json.has("accessToken")).isFalse();
    assertThat(json.has("expiresIn")).isFalse();
  }

  @Test
  void loginResponse_authenticated_carriesTokens() throws Exception {
    JsonNode json = mapper.readTree(mapper.writeValueAsString(
        LoginResponse.authenticated("u1", "a", "r", "s", 900)));
    assertThat(json.get("accessToken").asText()).isEqualTo("a");
    assertThat(json.get("expiresIn").asLong()).isEqualTo(900);
    assertThat(json.has("secondFactorToken")).isFalse();
  }

  @Test
  void enableRequest_readsBackupCodeList() throws Exception {
    SecondFactorEnableRequest request = mapper.readValue(
        "{\"code\":\"123456\",\"secret\":\"ABC\",\"backupCodes\":[\"AAAA-BBBB\",\"CCCC-DDDD\"]}",
        SecondFactorEnableRequest.class);
    assertThat(request.backupCodes()).containsExactly("AAAA-BBBB", "CCCC-DDDD");
  }
}
