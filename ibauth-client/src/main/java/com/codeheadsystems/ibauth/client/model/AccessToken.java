package com.codeheadsystems.ibauth.client.model;

/**
 * Access token and its secret as issued by the broker.
 * <p>
 * The secret stays in its encrypted base64 form; it is only decrypted transiently while
 * deriving a live session token.
 *
 * @param token           the access token
 * @param encryptedSecret base64 RSA ciphertext of the secret
 */
public record AccessToken(String token, String encryptedSecret) {

  @Override
  public String toString() {
    return "AccessToken[token=" + token + ", encryptedSecret=***]";
  }
}
