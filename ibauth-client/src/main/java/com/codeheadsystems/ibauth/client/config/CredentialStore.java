package com.codeheadsystems.ibauth.client.config;

import com.codeheadsystems.ibauth.client.model.Credentials;
import com.codeheadsystems.ibauth.rfc.dh.DhParameters;
import com.codeheadsystems.ibauth.rfc.pem.PemKeyLoader;
import java.security.PrivateKey;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the consumer's long-lived credentials: consumer key, realm, both RSA keys and the
 * DH domain parameters.
 */
@Singleton
public class CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

  private final IbAuthConfig config;

  @Inject
  public CredentialStore(final IbAuthConfig config) {
    log.info("CredentialStore()");
    this.config = config;
  }

  /**
   * Reads the key files named by the configuration.
   *
   * @return the credentials
   * @throws com.codeheadsystems.ibauth.rfc.exceptions.ConfigurationException on any unreadable
   *                                                                         or malformed file
   */
  public Credentials load() {
    log.debug("load(consumerKey={})", config.consumerKey());
    PrivateKey signingKey = PemKeyLoader.loadPrivateKey(config.signatureKeyPath());
    PrivateKey encryptionKey = PemKeyLoader.loadPrivateKey(config.encryptionKeyPath());
    DhParameters dhParameters = PemKeyLoader.loadDhParameters(config.dhParamPath());
    return new Credentials(config.consumerKey(), config.realm(), signingKey, encryptionKey, dhParameters);
  }
}
