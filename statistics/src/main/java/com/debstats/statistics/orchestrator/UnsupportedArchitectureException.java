package com.debstats.statistics.orchestrator;

/**
 * Thrown for an architecture the mirror does not publish a Contents index for.
 */
public class UnsupportedArchitectureException extends IllegalArgumentException {

    private final String architecture;

    public UnsupportedArchitectureException(String architecture) {
        super("Invalid or unsupported architecture: " + architecture);
        this.architecture = architecture;
    }

    public String getArchitecture() {
        return architecture;
    }
}
