package cli;

import app.SqlFingerprintCliApp;


/**
 * CLI entrypoint facade.
 *
 * <p>Orchestration lives in {@link SqlFingerprintCliApp} so it can be tested without
 * {@code System.exit}.</p>
 */
public class SqlFingerprintCli {

    public static void main(String[] args) {
        SqlFingerprintCliApp.main(args);
    }
}
