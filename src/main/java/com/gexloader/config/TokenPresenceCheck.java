package com.gexloader.config;

import com.gexloader.exception.MissingTokenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;

/**
 * Rejects a run without an ORATS token before the application context, and with it the
 * datasource, is started. A token counts when either {@code orats.token} (ORATS_TOKEN)
 * or the {@code --token} option is non-blank.
 *
 * <p>Registered on the SpringApplication in {@code main}, since environment events fire
 * before any bean exists. The thrown {@link MissingTokenException} carries exit code 2.
 */
public class TokenPresenceCheck implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    private static final Logger log = LoggerFactory.getLogger(TokenPresenceCheck.class);

    static final String TOKEN_PROPERTY = "orats.token";
    static final String TOKEN_OPTION = "token";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        Environment environment = event.getEnvironment();
        if (isBlank(environment.getProperty(TOKEN_OPTION)) && isBlank(environment.getProperty(TOKEN_PROPERTY))) {
            log.error("ORATS_TOKEN is not set and no --token was given, not starting");
            throw new MissingTokenException();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
