package io.possync.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.model.Session;
import io.possync.model.Source;
import io.possync.observability.AuditLogger;
import io.possync.observability.AuditLogger.AuditEvent;
import io.possync.remote.WireCodec;
import io.possync.storage.KeyValueStore;
import io.possync.storage.LocalStore;
import io.possync.util.Timestamps;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the single session of the running application and its act-as stack.
 *
 * <p>Every mutation is written to the key/value file before the method returns, so a restart in the
 * middle of an act-as resumes in the same state. Acting is one level deep: a second switch while
 * acting is refused.
 */
public final class SessionManager {
    public static final String AUTH_TOKEN = "auth_token";
    public static final String AUTH_USER = "auth_user";
    public static final String SESSION_SOURCE = "session_source";
    public static final String SESSION_CREATED_AT = "session_created_at";
    public static final String ACTING_STACK = "acting_stack";
    private static final String OFFLINE_TOKEN_PREFIX = "offline_token_";

    private final KeyValueStore state;
    private final LocalStore store;
    private final AuditLogger audit;
    private final Clock clock;
    private Session session;

    public SessionManager(KeyValueStore state, LocalStore store, AuditLogger audit, Clock clock) {
        this.state = state;
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    public synchronized Session setSession(Identity identity, String token, Source source) {
        Session next = new Session(identity.withoutCredential(), token, source, clock.instant(), List.of());
        persist(next);
        session = next;
        audit.log(AuditEvent.of("session.created", identity.email(), "session", "success", AuditEvent.details(
                "identity_id", identity.id(),
                "role", identity.role().wireName(),
                "source", source.wireName()
        )));
        return next;
    }

    public synchronized Optional<Session> getSession() {
        return Optional.ofNullable(session);
    }

    public synchronized Optional<String> currentToken() {
        return session == null ? Optional.empty() : Optional.of(session.token());
    }

    public synchronized Session switchTo(Identity delegate, String proof) {
        if (session == null) {
            throw new IllegalStateException("No active session");
        }
        Identity current = session.identity();
        try {
            Identity resolved = checkSwitch(current, delegate, proof);
            Session next = new Session(resolved.withoutCredential(), session.token(), session.source(),
                    session.createdAt(), List.of(current));
            persist(next);
            session = next;
            audit.log(AuditEvent.of("session.switch_to", current.email(), "session", "success", AuditEvent.details(
                    "delegate_id", resolved.id(),
                    "delegate_email", resolved.email(),
                    "delegate_role", resolved.role().wireName()
            )));
            return next;
        } catch (ImpersonationDeniedException e) {
            audit.log(AuditEvent.of("session.switch_to", current.email(), "session", "denied", AuditEvent.details(
                    "delegate_email", delegate == null ? null : delegate.email(),
                    "reason", e.getMessage()
            )));
            throw e;
        }
    }

    private Identity checkSwitch(Identity current, Identity delegate, String proof) {
        if (session.isActing()) {
            throw new ImpersonationDeniedException("Already acting as " + current.email() + "; switch back first");
        }
        if (!current.role().canActAsOthers()) {
            throw new ImpersonationDeniedException("Role " + current.role().wireName() + " cannot switch users");
        }
        if (delegate == null) {
            throw new ImpersonationDeniedException("No identity to switch to");
        }
        Identity resolved = store.findIdentityById(delegate.id())
                .orElseThrow(() -> new ImpersonationDeniedException("Unknown identity " + delegate.email()));
        if (!resolved.active()) {
            throw new ImpersonationDeniedException("Identity " + resolved.email() + " is inactive");
        }
        if (resolved.id().equals(current.id())) {
            throw new ImpersonationDeniedException("Cannot switch to the current identity");
        }
        if (!mayActAs(current, resolved)) {
            throw new ImpersonationDeniedException(current.email() + " may not act as " + resolved.email());
        }
        if (!store.verifyPasscode(resolved.id(), proof)) {
            throw new ImpersonationDeniedException("Invalid passcode for " + resolved.email());
        }
        return resolved;
    }

    private static boolean mayActAs(Identity current, Identity delegate) {
        return switch (current.role()) {
            case SUPER_ADMIN -> true;
            case MANAGER -> current.companyId() != null
                    && current.companyId().equals(delegate.companyId())
                    && delegate.role() != Role.SUPER_ADMIN;
            case CASHIER, SUPERVISOR, STAFF -> false;
        };
    }

    public synchronized Session switchBack() {
        if (session == null || !session.isActing()) {
            throw new IllegalStateException("Not acting as another identity");
        }
        List<Identity> stack = new ArrayList<>(session.actingStack());
        Identity restored = stack.remove(stack.size() - 1);
        Identity delegate = session.identity();
        Session next = new Session(restored, session.token(), session.source(), session.createdAt(), stack);
        persist(next);
        session = next;
        audit.log(AuditEvent.of("session.switch_back", restored.email(), "session", "success", AuditEvent.details(
                "delegate_id", delegate.id(),
                "delegate_email", delegate.email()
        )));
        return next;
    }

    public synchronized Session updateIdentity(Identity refreshed) {
        if (session == null) {
            throw new IllegalStateException("No active session");
        }
        Identity clean = refreshed.withoutCredential();
        Session next;
        if (session.identity().id().equals(clean.id())) {
            next = new Session(clean, session.token(), session.source(), session.createdAt(), session.actingStack());
        } else {
            List<Identity> stack = new ArrayList<>(session.actingStack());
            int index = -1;
            for (int i = 0; i < stack.size(); i++) {
                if (stack.get(i).id().equals(clean.id())) {
                    index = i;
                }
            }
            if (index < 0) {
                throw new IllegalArgumentException("Identity " + clean.id() + " is not part of the session");
            }
            stack.set(index, clean);
            next = new Session(session.identity(), session.token(), session.source(), session.createdAt(), stack);
        }
        if (!next.equals(session)) {
            persist(next);
            session = next;
        }
        return session;
    }

    public synchronized void clear() {
        Session previous = session;
        session = null;
        state.remove(AUTH_TOKEN, AUTH_USER, SESSION_SOURCE, SESSION_CREATED_AT, ACTING_STACK);
        if (previous != null) {
            audit.log(AuditEvent.of("session.cleared", previous.originalIdentity().email(), "session", "success",
                    AuditEvent.details("source", previous.source().wireName())));
        }
    }

    /**
     * Loads the session persisted by a previous run. A partial or unreadable record is discarded.
     */
    public synchronized Optional<Session> restore() {
        Optional<String> token = state.getString(AUTH_TOKEN);
        Optional<JsonNode> user = state.get(AUTH_USER);
        if (token.isEmpty() || user.isEmpty()) {
            if (token.isPresent() || user.isPresent()) {
                discard("incomplete session record");
            }
            return Optional.empty();
        }
        try {
            Identity identity = WireCodec.identity(user.get());
            Source source = state.getString(SESSION_SOURCE)
                    .map(Source::fromWire)
                    .orElse(token.get().startsWith(OFFLINE_TOKEN_PREFIX) ? Source.LOCAL : Source.REMOTE);
            Instant createdAt = state.getString(SESSION_CREATED_AT)
                    .map(Timestamps::parseLenient)
                    .orElse(clock.instant());
            List<Identity> stack = new ArrayList<>();
            for (JsonNode node : state.get(ACTING_STACK).orElse(JsonNodeFactory.instance.arrayNode())) {
                stack.add(WireCodec.identity(node));
            }
            session = new Session(identity, token.get(), source, Objects.requireNonNullElse(createdAt, clock.instant()), stack);
            audit.log(AuditEvent.of("session.restored", session.originalIdentity().email(), "session", "success",
                    AuditEvent.details("source", source.wireName(), "acting", session.isActing())));
            return Optional.of(session);
        } catch (IllegalArgumentException e) {
            discard(e.getMessage());
            return Optional.empty();
        }
    }

    private void discard(String reason) {
        state.remove(AUTH_TOKEN, AUTH_USER, SESSION_SOURCE, SESSION_CREATED_AT, ACTING_STACK);
        audit.log(AuditEvent.system("session.restore_discarded", "session", "failure",
                AuditEvent.details("reason", reason)));
    }

    private void persist(Session s) {
        ArrayNode stack = JsonNodeFactory.instance.arrayNode();
        for (Identity identity : s.actingStack()) {
            stack.add(identityNode(identity));
        }
        Map<String, JsonNode> entries = new LinkedHashMap<>();
        entries.put(AUTH_TOKEN, JsonNodeFactory.instance.textNode(s.token()));
        entries.put(AUTH_USER, identityNode(s.identity()));
        entries.put(SESSION_SOURCE, JsonNodeFactory.instance.textNode(s.source().wireName()));
        entries.put(SESSION_CREATED_AT, JsonNodeFactory.instance.textNode(s.createdAt().toString()));
        entries.put(ACTING_STACK, stack);
        state.putAll(entries);
    }

    static ObjectNode identityNode(Identity identity) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", identity.id());
        node.put("name", identity.name());
        node.put("email", identity.email());
        node.put("role", identity.role().wireName());
        node.put("company_id", identity.companyId());
        node.put("store_id", identity.storeId());
        node.put("phone", identity.phone());
        node.put("is_active", identity.active());
        node.put("last_login_at", Timestamps.format(identity.lastLoginAt()));
        return node;
    }
}
