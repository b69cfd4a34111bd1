package com.scorpius.auth;

import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Holds the single live {@link TokenPair} of the process, in memory only.
 *
 * <p>Anyone may read; only {@link AuthCoordinator} writes (the mutators are package-private).
 */
@Component
public class TokenStore {

    private final AtomicReference<TokenPair> current = new AtomicReference<>();

    public TokenPair get() {
        return current.get();
    }

    public String getAccessToken() {
        TokenPair pair = current.get();
        return pair != null ? pair.getAccessToken() : null;
    }

    public String getRefreshToken() {
        TokenPair pair = current.get();
        return pair != null ? pair.getRefreshToken() : null;
    }

    public boolean hasTokens() {
        return current.get() != null;
    }

    void store(TokenPair pair) {
        current.set(pair);
    }

    void clear() {
        current.set(null);
    }
}
