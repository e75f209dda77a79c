package com.codeheadsystems.ibauth.rfc.oauth;

import com.codeheadsystems.ibauth.rfc.exceptions.SigningException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Base64;

/**
 * RSA-SHA256 (PKCS#1 v1.5) signer for the bootstrap requests.
 * <p>
 * Returns plain base64. Whether the header carries it raw or percent-encoded is decided by
 * {@link AuthorizationHeaderBuilder}, not here.
 */
public class RsaSigner {

  private static final String ALGORITHM = "SHA256withRSA";

  private final PrivateKey signingKey;

  /**
   * Instantiates a new Rsa signer.
   *
   * @param signingKey the RSA private signing key
   */
  public RsaSigner(final PrivateKey signingKey) {
    this.signingKey = signingKey;
  }

  /**
   * Signs the UTF-8 bytes of the base string.
   *
   * @param baseString the canonical base string
   * @return base64 signature
   */
  public String sign(String baseString) {
    try {
      Signature signature = Signature.getInstance(ALGORITHM);
      signature.initSign(signingKey);
      signature.update(baseString.getBytes(StandardCharsets.UTF_8));
      return Base64.getEncoder().encodeToString(signature.sign());
    } catch (GeneralSecurityException e) {
      throw new SigningException("RSA-SHA256 signing failed", e);
    }
  }
}
