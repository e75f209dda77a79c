package com.codeheadsystems.ibauth.rfc.oauth;

import com.codeheadsystems.ibauth.rfc.exceptions.SigningException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signer for every call made after the live session token is known.
 * <p>
 * The key is the base64-<em>decoded</em> live session token. Keying the MAC with the base64
 * text produces well-formed signatures the server silently rejects.
 */
public class HmacSigner {

  private static final String ALGORITHM = "HmacSHA256";

  private HmacSigner() {
  }

  /**
   * Signs the base string.
   *
   * @param liveSessionTokenBase64 the LST as stored (base64)
   * @param baseString             the canonical base string
   * @return base64 signature
   */
  public static String sign(String liveSessionTokenBase64, String baseString) {
    byte[] key;
    try {
      key = Base64.getDecoder().decode(liveSessionTokenBase64);
    } catch (IllegalArgumentException e) {
      throw new SigningException("Live session token is not valid base64", e);
    }
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(key, ALGORITHM));
      return Base64.getEncoder().encodeToString(mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8)));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new SigningException("HMAC-SHA256 signing failed", e);
    }
  }
}
