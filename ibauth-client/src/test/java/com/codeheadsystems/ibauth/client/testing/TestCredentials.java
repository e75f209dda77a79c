package com.codeheadsystems.ibauth.client.testing;

import com.codeheadsystems.ibauth.client.config.IbAuthConfig;
import com.codeheadsystems.ibauth.client.model.Credentials;
import com.codeheadsystems.ibauth.rfc.dh.DhParameters;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import javax.crypto.Cipher;
import org.bouncycastle.asn1.pkcs.DHParameter;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;

/**
 * Consumer key material generated for tests, plus the access token secret the broker would
 * have issued for it.
 */
public final class TestCredentials {

  public static final String CONSUMER_KEY = "TESTCONS";
  public static final String REALM = "limited_poa";
  public static final String ACCESS_TOKEN = "b2c4e6f8a0";

  /**
   * RFC 3526 group 14.
   */
  public static final String MODP_2048 = "FFFFFFFFFFFFFFFFC90FDAA22168C234C4C6628B80DC1CD129024E088A67CC74020BBEA63B139B22"
      + "514A08798E3404DDEF9519B3CD3A431B302B0A6DF25F14374FE1356D6D51C245E485B576625E7EC6F44C42E9A637ED6B0BFF5CB6F406B7"
      + "EDEE386BFB5A899FA5AE9F24117C4B1FE649286651ECE45B3DC2007CB8A163BF0598DA48361C55D39A69163FA8FD24CF5F83655D23DCA3"
      + "AD961C62F356208552BB9ED529077096966D670C354E4ABC9804F1746C08CA18217C32905E462E36CE3BE39E772C180E86039B2783A2EC"
      + "07A28FB5C55DF06F4C52C9DE2BCBF6955817183995497CEA956AE515D2261898FA051015728E5A8AACAA68FFFFFFFFFFFFFFFF";

  private final KeyPair signingKeyPair;
  private final KeyPair encryptionKeyPair;
  private final DhParameters dhParameters;
  private final byte[] accessTokenSecret;
  private final String encryptedAccessTokenSecret;

  private TestCredentials(KeyPair signingKeyPair, KeyPair encryptionKeyPair, byte[] accessTokenSecret,
                          String encryptedAccessTokenSecret) {
    this.signingKeyPair = signingKeyPair;
    this.encryptionKeyPair = encryptionKeyPair;
    this.dhParameters = DhParameters.fromHex(MODP_2048);
    this.accessTokenSecret = accessTokenSecret;
    this.encryptedAccessTokenSecret = encryptedAccessTokenSecret;
  }

  /**
   * Generates two RSA key pairs and an access token secret encrypted to the second one.
   *
   * @return the credentials
   * @throws GeneralSecurityException on key generation failure
   */
  public static TestCredentials generate() throws GeneralSecurityException {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    KeyPair signing = generator.generateKeyPair();
    KeyPair encryption = generator.generateKeyPair();
    byte[] secret = new byte[32];
    new SecureRandom().nextBytes(secret);
    Cipher cipher = Cipher.getInstance("RSA/ECB/PKCS1Padding");
    cipher.init(Cipher.ENCRYPT_MODE, encryption.getPublic());
    String encrypted = Base64.getEncoder().encodeToString(cipher.doFinal(secret));
    return new TestCredentials(signing, encryption, secret, encrypted);
  }

  public KeyPair signingKeyPair() {
    return signingKeyPair;
  }

  public DhParameters dhParameters() {
    return dhParameters;
  }

  public byte[] accessTokenSecret() {
    return accessTokenSecret.clone();
  }

  public String encryptedAccessTokenSecret() {
    return encryptedAccessTokenSecret;
  }

  public Credentials credentials() {
    return new Credentials(CONSUMER_KEY, REALM, signingKeyPair.getPrivate(), encryptionKeyPair.getPrivate(),
        dhParameters);
  }

  /**
   * Writes the keys as PEM files (signing key as PKCS#8, encryption key as PKCS#1) and returns a
   * matching environment. The gateway is disabled; tests that need it set it explicitly.
   *
   * @param dir     target directory
   * @param apiBase the API base url
   * @return a mutable environment map
   * @throws IOException on write failure
   */
  public Map<String, String> writeEnvironment(Path dir, String apiBase) throws IOException {
    Path signing = write(dir.resolve("signing.pem"), "PRIVATE KEY", signingKeyPair.getPrivate().getEncoded());
    byte[] pkcs1 = PrivateKeyInfo.getInstance(encryptionKeyPair.getPrivate().getEncoded())
        .parsePrivateKey().toASN1Primitive().getEncoded();
    Path encryption = write(dir.resolve("encryption.pem"), "RSA PRIVATE KEY", pkcs1);
    Path dh = write(dir.resolve("dhparam.pem"), "DH PARAMETERS",
        new DHParameter(dhParameters.prime(), dhParameters.generator(), 0).getEncoded());

    Map<String, String> env = new HashMap<>();
    env.put(IbAuthConfig.CONSUMER_KEY, CONSUMER_KEY);
    env.put(IbAuthConfig.SIGNATURE_KEY_PATH, signing.toString());
    env.put(IbAuthConfig.ENCRYPTION_KEY_PATH, encryption.toString());
    env.put(IbAuthConfig.DH_PARAM_PATH, dh.toString());
    env.put(IbAuthConfig.TOKEN_FILE, dir.resolve("tokens.json").toString());
    env.put(IbAuthConfig.API_BASE_URL, apiBase);
    env.put(IbAuthConfig.GATEWAY_BASE_URL, "");
    env.put(IbAuthConfig.HTTP_TIMEOUT_SECONDS, "5");
    return env;
  }

  /**
   * Adds the pre-authorized access token to an environment.
   *
   * @param env the environment
   * @return the same map
   */
  public Map<String, String> withPreAuthorizedToken(Map<String, String> env) {
    env.put(IbAuthConfig.ACCESS_TOKEN, ACCESS_TOKEN);
    env.put(IbAuthConfig.ACCESS_TOKEN_SECRET, encryptedAccessTokenSecret);
    return env;
  }

  private static Path write(Path path, String type, byte[] content) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.US_ASCII);
         PemWriter pemWriter = new PemWriter(writer)) {
      pemWriter.writeObject(new PemObject(type, content));
    }
    return path;
  }
}
