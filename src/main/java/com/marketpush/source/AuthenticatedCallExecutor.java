package com.marketpush.source;

import com.marketpush.exception.AuthExpiredException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs an upstream call with the recipient's credential. On
 * {@link AuthExpiredException} the credential is refreshed once and the call retried
 * once; a second rejection propagates to the caller.
 */
@Component
public class AuthenticatedCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(AuthenticatedCallExecutor.class);

    private final CredentialProvider credentialProvider;

    public AuthenticatedCallExecutor(CredentialProvider credentialProvider) {
        this.credentialProvider = credentialProvider;
    }

    public <T> T execute(String recipientId, Function<String, T> call) {
        String credential = credentialProvider.getToken(recipientId);
        try {
            return call.apply(credential);
        } catch (AuthExpiredException e) {
            log.warn("Credential expired for {}, refreshing and retrying once", recipientId);
            String refreshed = credentialProvider.refreshToken(recipientId);
            try {
                return call.apply(refreshed);
            } catch (AuthExpiredException retryFailure) {
                credentialProvider.invalidate(recipientId);
                log.error("Credential for {} rejected again after refresh", recipientId);
                throw retryFailure;
            }
        }
    }
}
