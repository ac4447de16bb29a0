package io.possync.auth;

import io.possync.model.Identity;
import io.possync.model.Source;
import io.possync.sync.SyncOutcome;

import java.util.List;

public record LoginResult(
        Identity identity,
        String token,
        Source source,
        List<LoginState> path,
        SyncOutcome postLoginSync,
        String syncError
) {
    public LoginResult {
        path = List.copyOf(path);
    }

    public LoginState finalState() {
        return path.get(path.size() - 1);
    }
}
