package com.williamcallahan.webingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.NestedExceptionUtils;

@SpringBootApplication
@ConfigurationPropertiesScan
public class WebIngestApplication {
    private static final Logger log = LoggerFactory.getLogger(WebIngestApplication.class);

    static final int EXIT_FATAL = 1;

    public static void main(String[] args) {
        int exitCode;
        try {
            ConfigurableApplicationContext context = SpringApplication.run(WebIngestApplication.class, args);
            exitCode = SpringApplication.exit(context);
        } catch (RuntimeException e) {
            exitCode = abort(e);
        }
        System.exit(exitCode);
    }

    /**
     * Logs a failed run with the failure that caused it and returns the process exit code.
     *
     * <p>Spring Boot wraps runner failures, so the logged reason is taken from the most
     * specific cause rather than the wrapper.</p>
     *
     * @param failure exception that escaped startup or the ingestion run
     * @return {@link #EXIT_FATAL}
     */
    static int abort(RuntimeException failure) {
        log.error("Ingestion aborted: {}", abortReason(failure), failure);
        return EXIT_FATAL;
    }

    static String abortReason(Throwable failure) {
        Throwable rootCause = NestedExceptionUtils.getMostSpecificCause(failure);
        String message = rootCause.getMessage();
        return rootCause.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
