package com.codeheadsystems.ibauth.client.manager;

import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.CONSUMER_KEY;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.NONCE;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.SIGNATURE_METHOD;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.TIMESTAMP;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.TOKEN;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.VERSION;
import static com.codeheadsystems.ibauth.rfc.oauth.OAuthParameters.VERSION_1_0;

import com.codeheadsystems.ibauth.client.model.Credentials;
import com.codeheadsystems.ibauth.client.model.SignedRequest;
import com.codeheadsystems.ibauth.rfc.common.RandomProvider;
import com.codeheadsystems.ibauth.rfc.oauth.AuthorizationHeaderBuilder;
import com.codeheadsystems.ibauth.rfc.oauth.CanonicalRequestBuilder;
import com.codeheadsystems.ibauth.rfc.oauth.HmacSigner;
import com.codeheadsystems.ibauth.rfc.oauth.PercentEncoder;
import com.codeheadsystems.ibauth.rfc.oauth.RsaSigner;
import com.codeheadsystems.ibauth.rfc.oauth.SignatureMethod;
import java.net.URI;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds signed requests in the two flavors the broker accepts.
 * <p>
 * RSA-SHA256 requests carry all of their parameters in the {@code Authorization} header and the
 * raw base64 signature. HMAC-SHA256 requests sign the OAuth parameters together with any query
 * or form parameters, put only the OAuth parameters in the header, and percent-encode the
 * signature.
 */
@Singleton
public class OAuthRequestFactory {

  private static final Logger log = LoggerFactory.getLogger(OAuthRequestFactory.class);

  private final Credentials credentials;
  private final RsaSigner rsaSigner;
  private final RandomProvider randomProvider;
  private final Clock clock;

  /**
   * Instantiates a new OAuth request factory.
   *
   * @param credentials    the credentials
   * @param randomProvider nonce source
   * @param clock          timestamp source
   */
  @Inject
  public OAuthRequestFactory(final Credentials credentials,
                             final RandomProvider randomProvider,
                             final Clock clock) {
    log.info("OAuthRequestFactory({})", credentials);
    this.credentials = credentials;
    this.rsaSigner = new RsaSigner(credentials.signingKey());
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  /**
   * Builds an RSA-SHA256 signed bootstrap request.
   *
   * @param method      HTTP method
   * @param uri         target without query
   * @param extraParams step specific parameters, such as the callback, token or DH challenge
   * @param prepend     verbatim base string prefix, or null
   * @return the signed request
   */
  public SignedRequest rsaSigned(final String method,
                                 final URI uri,
                                 final Map<String, String> extraParams,
                                 final String prepend) {
    log.debug("rsaSigned(method={}, uri={}, prepend={})", method, uri, prepend != null);
    Map<String, String> params = oauthParameters(SignatureMethod.RSA_SHA256);
    params.putAll(extraParams);
    String baseString = CanonicalRequestBuilder.build(method, uri.toString(), params, prepend);
    log.trace("rsaSigned: baseString={}", baseString);
    String signature = rsaSigner.sign(baseString);
    String header = AuthorizationHeaderBuilder.withRawSignature(credentials.realm(), params, signature);
    return new SignedRequest(method, uri, header, null);
  }

  /**
   * Builds an HMAC-SHA256 signed call keyed with the live session token.
   *
   * @param method                 HTTP method
   * @param uri                    target without query
   * @param queryParams            parameters appended to the URL
   * @param formParams             parameters sent as a form body
   * @param accessToken            the access token
   * @param liveSessionTokenBase64 the LST
   * @return the signed request
   */
  public SignedRequest hmacSigned(final String method,
                                  final URI uri,
                                  final Map<String, String> queryParams,
                                  final Map<String, String> formParams,
                                  final String accessToken,
                                  final String liveSessionTokenBase64) {
    log.debug("hmacSigned(method={}, uri={})", method, uri);
    Map<String, String> oauthParams = oauthParameters(SignatureMethod.HMAC_SHA256);
    oauthParams.put(TOKEN, accessToken);
    oauthParams.put(VERSION, VERSION_1_0);

    Map<String, String> signedParams = new HashMap<>(oauthParams);
    signedParams.putAll(queryParams);
    signedParams.putAll(formParams);
    String baseString = CanonicalRequestBuilder.build(method, uri.toString(), signedParams);
    log.trace("hmacSigned: baseString={}", baseString);
    String signature = HmacSigner.sign(liveSessionTokenBase64, baseString);
    String header = AuthorizationHeaderBuilder.withPercentEncodedSignature(
        credentials.realm(), oauthParams, signature);

    URI target = queryParams.isEmpty() ? uri : URI.create(uri + "?" + encode(queryParams));
    String body = formParams.isEmpty() ? null : encode(formParams);
    return new SignedRequest(method, target, header, body);
  }

  private Map<String, String> oauthParameters(SignatureMethod signatureMethod) {
    Map<String, String> params = new HashMap<>();
    params.put(CONSUMER_KEY, credentials.consumerKey());
    params.put(NONCE, randomProvider.nonce());
    params.put(SIGNATURE_METHOD, signatureMethod.wireName());
    params.put(TIMESTAMP, Long.toString(clock.instant().getEpochSecond()));
    return params;
  }

  static String encode(Map<String, String> params) {
    StringJoiner joiner = new StringJoiner("&");
    new TreeMap<>(params).forEach((key, value) ->
        joiner.add(PercentEncoder.encode(key) + "=" + PercentEncoder.encode(value)));
    return joiner.toString();
  }
}
