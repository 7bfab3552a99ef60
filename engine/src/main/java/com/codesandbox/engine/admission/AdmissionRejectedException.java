package com.codesandbox.engine.admission;

/**
 * Thrown when a request arrives while the in-flight ceiling is reached.
 * Nothing was reserved for the request; it is safe to retry later.
 */
public class AdmissionRejectedException extends RuntimeException {

    private final int ceiling;

    public AdmissionRejectedException(int ceiling) {
        super("Too many requests: in-flight ceiling of " + ceiling + " reached");
        this.ceiling = ceiling;
    }

    public int getCeiling() { return ceiling; }
}
