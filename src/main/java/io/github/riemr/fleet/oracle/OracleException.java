package io.github.riemr.fleet.oracle;

public class OracleException extends RuntimeException {
    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
