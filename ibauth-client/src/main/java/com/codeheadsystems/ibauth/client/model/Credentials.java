package com.codeheadsystems.ibauth.client.model;

import com.codeheadsystems.ibauth.rfc.dh.DhParameters;
import java.security.PrivateKey;

/**
 * Consumer credentials, fixed for the process lifetime.
 *
 * @param consumerKey   the consumer key
 * @param realm         the realm
 * @param signingKey    RSA key for RSA-SHA256 signatures
 * @param encryptionKey RSA key that decrypts the access token secret
 * @param dhParameters  the DH domain parameters
 */
public record Credentials(String consumerKey,
                          String realm,
                          PrivateKey signingKey,
                          PrivateKey encryptionKey,
                          DhParameters dhParameters) {

  @Override
  public String toString() {
    return "Credentials[consumerKey=" + consumerKey + ", realm=" + realm
        + ", dhPrimeBits=" + dhParameters.prime().bitLength() + "]";
  }
}
