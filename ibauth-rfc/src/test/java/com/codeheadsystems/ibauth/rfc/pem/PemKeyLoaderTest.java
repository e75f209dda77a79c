package com.codeheadsystems.ibauth.rfc.pem;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.ibauth.rfc.dh.DhParameters;
import com.codeheadsystems.ibauth.rfc.exceptions.ConfigurationException;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import org.bouncycastle.asn1.pkcs.DHParameter;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PemKeyLoaderTest {

  private static KeyPair keyPair;

  @TempDir
  Path dir;

  @BeforeAll
  static void generateKeys() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    keyPair = generator.generateKeyPair();
  }

  private Path write(String name, String type, byte[] content) throws Exception {
    Path path = dir.resolve(name);
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.US_ASCII);
         PemWriter pemWriter = new PemWriter(writer)) {
      pemWriter.writeObject(new PemObject(type, content));
    }
    return path;
  }

  @Test
  void loadPrivateKey_pkcs8() throws Exception {
    Path path = write("pkcs8.pem", "PRIVATE KEY", keyPair.getPrivate().getEncoded());

    PrivateKey key = PemKeyLoader.loadPrivateKey(path);

    assertThat(key.getAlgorithm()).isEqualTo("RSA");
    assertThat(key.getEncoded()).isEqualTo(keyPair.getPrivate().getEncoded());
  }

  @Test
  void loadPrivateKey_pkcs1() throws Exception {
    byte[] pkcs1 = PrivateKeyInfo.getInstance(keyPair.getPrivate().getEncoded())
        .parsePrivateKey().toASN1Primitive().getEncoded();
    Path path = write("pkcs1.pem", "RSA PRIVATE KEY", pkcs1);

    PrivateKey key = PemKeyLoader.loadPrivateKey(path);

    assertThat(key.getEncoded()).isEqualTo(keyPair.getPrivate().getEncoded());
  }

  @Test
  void loadPrivateKey_missingFile_throwsConfigurationException() {
    assertThatThrownBy(() -> PemKeyLoader.loadPrivateKey(dir.resolve("nope.pem")))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("nope.pem");
  }

  @Test
  void loadPrivateKey_nullPath_throwsConfigurationException() {
    assertThatThrownBy(() -> PemKeyLoader.loadPrivateKey(null))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void loadPrivateKey_unsupportedType_throwsConfigurationException() throws Exception {
    Path path = write("cert.pem", "CERTIFICATE", new byte[]{1, 2, 3});

    assertThatThrownBy(() -> PemKeyLoader.loadPrivateKey(path))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("CERTIFICATE");
  }

  @Test
  void loadPrivateKey_garbageContent_throwsConfigurationException() throws Exception {
    Path path = write("bad.pem", "PRIVATE KEY", new byte[]{1, 2, 3});

    assertThatThrownBy(() -> PemKeyLoader.loadPrivateKey(path))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void loadPrivateKey_notPem_throwsConfigurationException() throws Exception {
    Path path = dir.resolve("plain.txt");
    Files.writeString(path, "just text");

    assertThatThrownBy(() -> PemKeyLoader.loadPrivateKey(path))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("No PEM object");
  }

  @Test
  void loadDhParameters_readsPrimeAndGenerator() throws Exception {
    BigInteger prime = new BigInteger("FFFFFFFFFFFFFFFFC90FDAA22168C234C4C6628B80DC1CD1", 16);
    Path path = write("dhparam.pem", "DH PARAMETERS",
        new DHParameter(prime, BigInteger.valueOf(5), 0).getEncoded());

    DhParameters parameters = PemKeyLoader.loadDhParameters(path);

    assertThat(parameters.prime()).isEqualTo(prime);
    assertThat(parameters.generator()).isEqualTo(BigInteger.valueOf(5));
  }

  @Test
  void loadDhParameters_wrongType_throwsConfigurationException() throws Exception {
    Path path = write("pkcs8.pem", "PRIVATE KEY", keyPair.getPrivate().getEncoded());

    assertThatThrownBy(() -> PemKeyLoader.loadDhParameters(path))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("DH PARAMETERS");
  }
}
