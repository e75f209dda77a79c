package com.codeheadsystems.ibauth.client.cli;

import com.codeheadsystems.ibauth.client.AuthenticatedClient;
import com.codeheadsystems.ibauth.client.IbAuthClientFactory;
import com.codeheadsystems.ibauth.client.config.IbAuthConfig;
import com.codeheadsystems.ibauth.client.exceptions.TokenExchangeException;
import com.codeheadsystems.ibauth.model.session.Account;
import com.codeheadsystems.ibauth.model.session.AuthStatusResponse;
import com.codeheadsystems.ibauth.rfc.exceptions.IbAuthException;
import java.util.Map;

/**
 * Command-line check of a headless OAuth setup.
 *
 * <pre>
 * Usage:
 *   IB_CONSUMER_KEY=... IB_SIGNATURE_KEY_PATH=... IB_ENCRYPTION_KEY_PATH=... IB_DH_PARAM_PATH=... \
 *     java -cp ibauth-client.jar com.codeheadsystems.ibauth.client.cli.IbAuthCli [--logout]
 * </pre>
 *
 * <p>Authenticates with the configuration from the environment, then prints the brokerage
 * session status and the visible accounts. {@code --logout} ends the session afterwards and
 * deletes the token file.
 */
public class IbAuthCli {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    boolean logout = false;
    for (String arg : args) {
      if ("--logout".equals(arg)) {
        logout = true;
      } else {
        System.err.println("Usage: IbAuthCli [--logout]");
        System.err.println();
        System.err.println("  Configuration is read from IB_* environment variables.");
        System.exit(1);
      }
    }
    System.exit(run(System.getenv(), logout));
  }

  static int run(Map<String, String> env, boolean logout) {
    try {
      IbAuthConfig config = IbAuthConfig.fromEnvironment(env);
      System.out.println("Config : " + config);
      System.out.println();
      AuthenticatedClient client = IbAuthClientFactory.create(config);
      client.authenticate();
      System.out.println("State  : " + client.session().state());
      System.out.println("LST    : " + client.session().liveSessionToken());

      AuthStatusResponse status = client.authStatus();
      System.out.println("Status : authenticated=" + status.authenticated()
          + " connected=" + status.connected()
          + " competing=" + status.competing()
          + (status.message() == null ? "" : " message=" + status.message()));

      System.out.println("Accounts:");
      for (Account account : client.accounts()) {
        System.out.println("  " + account.accountId() + "  " + account.accountTitle());
      }
      if (logout) {
        System.out.println();
        System.out.println("Logout : " + (client.logout() ? "acknowledged" : "not acknowledged"));
      }
      return 0;
    } catch (TokenExchangeException e) {
      System.err.println("Error: " + e.step() + " failed (HTTP " + e.statusCode() + "): " + e.getMessage());
      return 2;
    } catch (IbAuthException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
