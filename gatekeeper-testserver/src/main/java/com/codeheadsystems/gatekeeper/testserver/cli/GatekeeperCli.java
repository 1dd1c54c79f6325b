package com.codeheadsystems.gatekeeper.testserver.cli;

import com.codeheadsystems.gatekeeper.client.accessor.GatekeeperAccessor;
import com.codeheadsystems.gatekeeper.client.exceptions.GatekeeperAccessorException;
import com.codeheadsystems.gatekeeper.client.model.ServerConnectionInfo;
import com.codeheadsystems.gatekeeper.model.BasicLoginResponse;
import com.codeheadsystems.gatekeeper.model.BearerLoginResponse;
import com.codeheadsystems.gatekeeper.model.LoginRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationRequest;
import com.codeheadsystems.gatekeeper.model.RegistrationResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line client for exercising the testserver's registration, login and protected
 * endpoints.
 *
 * <pre>
 * Usage:
 *   GatekeeperCli register|login|whoami &lt;username&gt; &lt;password&gt; [options]
 *
 * Commands:
 *   register   Register an account.
 *   login      Log in and print the token (bearer) or the account details (basic).
 *   whoami     Call GET /api/whoami with the account's credentials.
 *
 * Options:
 *   --server &lt;url&gt;      Server base URL  (default: http://localhost:8080)
 *   --scheme &lt;name&gt;     bearer or basic  (default: bearer)
 *   --role &lt;name&gt;       Role requested at registration
 *   --email &lt;address&gt;   Email stored at registration
 * </pre>
 */
public class GatekeeperCli {

  private static final String DEFAULT_SERVER = "http://localhost:8080";
  private static final String DEFAULT_SCHEME = "bearer";

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    String server = DEFAULT_SERVER;
    String scheme = DEFAULT_SCHEME;
    String role = null;
    String email = null;
    List<String> positional = new ArrayList<>();

    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--server" -> server = args[++i];
        case "--scheme" -> scheme = args[++i];
        case "--role"   -> role   = args[++i];
        case "--email"  -> email  = args[++i];
        default         -> positional.add(args[i]);
      }
    }

    if (positional.size() < 3) {
      printUsage();
      System.exit(1);
    }

    String command = positional.get(0);
    String username = positional.get(1);
    String password = positional.get(2);
    boolean bearer = DEFAULT_SCHEME.equalsIgnoreCase(scheme);

    GatekeeperAccessor accessor = new GatekeeperAccessor(
        HttpClient.newHttpClient(), new ObjectMapper(), new ServerConnectionInfo(URI.create(server)));

    System.out.println("Server : " + server);
    System.out.println("Scheme : " + (bearer ? "bearer" : "basic"));
    System.out.println();

    try {
      switch (command) {
        case "register" -> runRegister(accessor, new RegistrationRequest(username, password, role,
            email, null));
        case "login"    -> runLogin(accessor, bearer, username, password);
        case "whoami"   -> runWhoami(accessor, bearer, username, password);
        default -> {
          System.err.println("Unknown command: " + command);
          printUsage();
          System.exit(1);
        }
      }
    } catch (SecurityException e) {
      System.err.println("Rejected: " + e.getMessage());
      System.exit(2);
    } catch (GatekeeperAccessorException e) {
      System.err.println("Error (HTTP " + e.statusCode() + "): " + e.getMessage());
      System.exit(1);
    }
  }

  private static void runRegister(GatekeeperAccessor accessor, RegistrationRequest request) {
    System.out.println("Registering " + request.username() + "...");
    RegistrationResponse response = accessor.register(request);
    System.out.println(response.message() + ": " + response.username());
  }

  private static void runLogin(GatekeeperAccessor accessor, boolean bearer,
                               String username, String password) {
    System.out.println("Logging in...");
    LoginRequest request = new LoginRequest(username, password);
    if (bearer) {
      BearerLoginResponse response = accessor.loginBearer(request);
      System.out.println("  token      : " + response.token());
      System.out.println("  expires in : " + response.expiresInSeconds() + "s");
    } else {
      BasicLoginResponse response = accessor.loginBasic(request);
      System.out.println("  " + response.message());
      System.out.println("  role    : " + response.role());
      System.out.println("  profile : " + response.profile());
    }
  }

  private static void runWhoami(GatekeeperAccessor accessor, boolean bearer,
                                String username, String password) {
    String authorization;
    if (bearer) {
      authorization = GatekeeperAccessor.bearer(
          accessor.loginBearer(new LoginRequest(username, password)).token());
    } else {
      authorization = GatekeeperAccessor.basic(username, password);
    }
    System.out.println("Calling GET /api/whoami...");
    Map<?, ?> body = accessor.get("/api/whoami", authorization, Map.class);
    System.out.println("  Body : " + body);
  }

  private static void printUsage() {
    System.err.println("Usage: GatekeeperCli <command> <username> <password> [options]");
    System.err.println();
    System.err.println("Commands:");
    System.err.println("  register   Register an account");
    System.err.println("  login      Log in and print the token or account details");
    System.err.println("  whoami     Call GET /api/whoami with the account's credentials");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --server <url>      Server base URL  (default: " + DEFAULT_SERVER + ")");
    System.err.println("  --scheme <name>     bearer or basic  (default: " + DEFAULT_SCHEME + ")");
    System.err.println("  --role <name>       Role requested at registration");
    System.err.println("  --email <address>   Email stored at registration");
  }
}
