package com.codeheadsystems.ibauth.rfc.oauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.ibauth.rfc.exceptions.SigningException;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Base64;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class RsaSignerTest {

  private static KeyPair keyPair;

  @BeforeAll
  static void generateKeys() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    keyPair = generator.generateKeyPair();
  }

  @Test
  void sign_verifiesWithPublicKey() throws Exception {
    String baseString = "POST&https%3A%2F%2Fapi.ibkr.com%2Fv1%2Fapi%2Foauth%2Frequest_token&oauth_callback%3Doob";

    String signature = new RsaSigner(keyPair.getPrivate()).sign(baseString);

    Signature verifier = Signature.getInstance("SHA256withRSA");
    verifier.initVerify(keyPair.getPublic());
    verifier.update(baseString.getBytes(StandardCharsets.UTF_8));
    assertThat(verifier.verify(Base64.getDecoder().decode(signature))).isTrue();
  }

  @Test
  void sign_pkcs1v15IsDeterministic() {
    RsaSigner signer = new RsaSigner(keyPair.getPrivate());
    assertThat(signer.sign("abc")).isEqualTo(signer.sign("abc"));
  }

  @Test
  void sign_returnsPlainBase64() {
    String signature = new RsaSigner(keyPair.getPrivate()).sign("abc");
    assertThat(signature).matches("[A-Za-z0-9+/]+=*").doesNotContain("%");
    assertThat(Base64.getDecoder().decode(signature)).hasSize(256);
  }

  @Test
  void sign_nonRsaKey_throwsSigningException() throws Exception {
    KeyPairGenerator ec = KeyPairGenerator.getInstance("EC");
    ec.initialize(256);
    PrivateKey ecKey = ec.generateKeyPair().getPrivate();

    assertThatThrownBy(() -> new RsaSigner(ecKey).sign("abc"))
        .isInstanceOf(SigningException.class)
        .hasMessageContaining("RSA-SHA256");
  }
}
