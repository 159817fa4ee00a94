package com.updownbot.hft.controller.cost;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Thrown at startup when the configured fee curve does not reproduce the reference points.
 * The process exits with {@value #EXIT_CODE}.
 */
public class FeeCurveMismatchException extends RuntimeException implements ExitCodeGenerator {

    public static final int EXIT_CODE = 2;

    public FeeCurveMismatchException(String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
