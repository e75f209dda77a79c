package com.codeheadsystems.ibauth.rfc.pem;

import com.codeheadsystems.ibauth.rfc.dh.DhParameters;
import com.codeheadsystems.ibauth.rfc.exceptions.ConfigurationException;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPrivateCrtKeySpec;
import org.bouncycastle.asn1.pkcs.DHParameter;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the consumer's RSA private keys and Diffie-Hellman parameters from PEM files.
 * <p>
 * Supported PEM types:
 * <ul>
 *   <li>{@code RSA PRIVATE KEY} (PKCS#1) and {@code PRIVATE KEY} (PKCS#8);</li>
 *   <li>{@code DH PARAMETERS} (PKCS#3, as written by {@code openssl dhparam}).</li>
 * </ul>
 * Every failure is reported as a {@link ConfigurationException} naming the file.
 */
public class PemKeyLoader {

  private static final Logger log = LoggerFactory.getLogger(PemKeyLoader.class);

  static final String PKCS1_RSA = "RSA PRIVATE KEY";
  static final String PKCS8 = "PRIVATE KEY";
  static final String DH_PARAMETERS = "DH PARAMETERS";

  private PemKeyLoader() {
  }

  /**
   * Loads an RSA private key.
   *
   * @param path the PEM file
   * @return the private key
   */
  public static PrivateKey loadPrivateKey(Path path) {
    log.debug("loadPrivateKey(path={})", path);
    PemObject pem = read(path);
    try {
      KeyFactory keyFactory = KeyFactory.getInstance("RSA");
      switch (pem.getType()) {
        case PKCS1_RSA: {
          RSAPrivateKey rsa = RSAPrivateKey.getInstance(pem.getContent());
          return keyFactory.generatePrivate(new RSAPrivateCrtKeySpec(
              rsa.getModulus(), rsa.getPublicExponent(), rsa.getPrivateExponent(),
              rsa.getPrime1(), rsa.getPrime2(), rsa.getExponent1(), rsa.getExponent2(),
              rsa.getCoefficient()));
        }
        case PKCS8:
          return keyFactory.generatePrivate(new PKCS8EncodedKeySpec(pem.getContent()));
        default:
          throw new ConfigurationException("Unsupported PEM type '" + pem.getType() + "' in " + path);
      }
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new ConfigurationException("Invalid RSA private key in " + path, e);
    }
  }

  /**
   * Loads Diffie-Hellman domain parameters.
   *
   * @param path the PEM file
   * @return the dh parameters
   */
  public static DhParameters loadDhParameters(Path path) {
    log.debug("loadDhParameters(path={})", path);
    PemObject pem = read(path);
    if (!DH_PARAMETERS.equals(pem.getType())) {
      throw new ConfigurationException("Expected DH PARAMETERS in " + path + " but found " + pem.getType());
    }
    try {
      DHParameter parameter = DHParameter.getInstance(pem.getContent());
      BigInteger generator = parameter.getG();
      DhParameters parameters = new DhParameters(parameter.getP(),
          generator == null ? DhParameters.DEFAULT_GENERATOR : generator);
      log.info("Loaded {}-bit DH parameters from {}", parameters.prime().bitLength(), path);
      return parameters;
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid DH parameters in " + path, e);
    }
  }

  private static PemObject read(Path path) {
    if (path == null) {
      throw new ConfigurationException("No PEM file configured");
    }
    if (!Files.isReadable(path)) {
      throw new ConfigurationException("PEM file is missing or unreadable: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.US_ASCII);
         PemReader pemReader = new PemReader(reader)) {
      PemObject pem = pemReader.readPemObject();
      if (pem == null) {
        throw new ConfigurationException("No PEM object found in " + path);
      }
      return pem;
    } catch (IOException | IllegalStateException e) {
      // BouncyCastle reports bad base64 bodies as DecoderException, an IllegalStateException
      throw new ConfigurationException("Unable to read PEM file " + path, e);
    }
  }
}
