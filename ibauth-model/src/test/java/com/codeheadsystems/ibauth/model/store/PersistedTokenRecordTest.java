package com.codeheadsystems.ibauth.model.store;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class PersistedTokenRecordTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private static PersistedTokenRecord full() {
    return new PersistedTokenRecord("tok", "c2VjcmV0", "bHN0", "TESTCONS", "limited_poa",
        "2026-10-18T00:00:00Z", null, null);
  }

  @Test
  void serializes_snakeCaseFieldsWithoutNulls() throws Exception {
    JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(full()));

    assertThat(node.get("access_token").asText()).isEqualTo("tok");
    assertThat(node.get("access_token_secret").asText()).isEqualTo("c2VjcmV0");
    assertThat(node.get("live_session_token").asText()).isEqualTo("bHN0");
    assertThat(node.get("consumer_key").asText()).isEqualTo("TESTCONS");
    assertThat(node.has("live_session_token_expiration")).isFalse();
    assertThat(node.has("live_session_token_verified")).isFalse();
    assertThat(node.has("complete")).isFalse();
  }

  @Test
  void isComplete_requiresAccessTokenSecretAndLst() {
    assertThat(full().isComplete()).isTrue();
    assertThat(new PersistedTokenRecord("tok", "s", null, "c", "r", "t", null, null).isComplete()).isFalse();
    assertThat(new PersistedTokenRecord(" ", "s", "bHN0", "c", "r", "t", null, null).isComplete()).isFalse();
    assertThat(new PersistedTokenRecord("tok", null, "bHN0", "c", "r", "t", null, null).isComplete()).isFalse();
    assertThat(new PersistedTokenRecord("tok", "", "bHN0", "c", "r", "t", null, null).isComplete()).isFalse();
  }

  @Test
  void toString_omitsSecrets() {
    assertThat(full().toString()).doesNotContain("c2VjcmV0").doesNotContain("bHN0");
  }
}
