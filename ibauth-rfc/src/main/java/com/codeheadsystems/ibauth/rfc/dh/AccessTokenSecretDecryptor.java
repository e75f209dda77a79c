package com.codeheadsystems.ibauth.rfc.dh;

import com.codeheadsystems.ibauth.rfc.exceptions.SigningException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.Base64;
import javax.crypto.Cipher;
import org.bouncycastle.util.encoders.Hex;

/**
 * Recovers the prepend for the live session token request by RSA/PKCS#1 v1.5 decryption of the
 * access token secret with the private encryption key.
 * <p>
 * The plaintext is only ever returned hex-encoded and is not retained.
 */
public class AccessTokenSecretDecryptor {

  private static final String TRANSFORMATION = "RSA/ECB/PKCS1Padding";

  private final PrivateKey encryptionKey;

  /**
   * Instantiates a new Access token secret decryptor.
   *
   * @param encryptionKey the RSA private encryption key
   */
  public AccessTokenSecretDecryptor(final PrivateKey encryptionKey) {
    this.encryptionKey = encryptionKey;
  }

  /**
   * Decrypts the base64 ciphertext and returns the plaintext as lower-case hex.
   *
   * @param accessTokenSecretBase64 the encrypted secret
   * @return the prepend
   */
  public String decryptToHex(String accessTokenSecretBase64) {
    if (accessTokenSecretBase64 == null || accessTokenSecretBase64.isBlank()) {
      throw new SigningException("Access token secret is missing");
    }
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, encryptionKey);
      byte[] plaintext = cipher.doFinal(Base64.getDecoder().decode(accessTokenSecretBase64));
      return Hex.toHexString(plaintext);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new SigningException("Unable to decrypt access token secret", e);
    }
  }
}
