package io.possync.remote;

import io.possync.model.Identity;
import io.possync.model.Source;

public record LoginResponse(Identity identity, String token, Source source) {
}
