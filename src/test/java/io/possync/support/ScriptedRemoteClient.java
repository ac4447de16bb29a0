package io.possync.support;

import io.possync.model.Identity;
import io.possync.model.Source;
import io.possync.remote.AuthorityException;
import io.possync.remote.HealthResponse;
import io.possync.remote.LoginResponse;
import io.possync.remote.NetworkException;
import io.possync.remote.RegistrationRequest;
import io.possync.remote.RegistrationResult;
import io.possync.remote.RemoteClient;
import io.possync.remote.SyncPayload;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory authority. Each call takes the next queued step, falling back to the default step once
 * the queue is empty. Steps may throw {@link NetworkException} or {@link AuthorityException}; a
 * 401/403 from anything but logout fires the unauthorized listener like the HTTP client does.
 */
public final class ScriptedRemoteClient implements RemoteClient {
    public static final HealthResponse HEALTHY = new HealthResponse("healthy", "connected", "2026-10-19T08:00:00Z");

    private final Deque<Supplier<HealthResponse>> healthSteps = new ArrayDeque<>();
    private final Deque<Supplier<LoginResponse>> loginSteps = new ArrayDeque<>();
    private final Deque<Supplier<SyncPayload>> pullSteps = new ArrayDeque<>();
    private final Deque<Supplier<Identity>> profileSteps = new ArrayDeque<>();
    private Supplier<HealthResponse> healthDefault = () -> HEALTHY;
    private Supplier<LoginResponse> loginDefault = () -> {
        throw unreachable();
    };
    private Supplier<SyncPayload> pullDefault = SyncPayload::empty;
    private Supplier<Identity> profileDefault = () -> {
        throw unreachable();
    };
    private Supplier<RegistrationResult> registerDefault = () -> {
        throw unreachable();
    };
    private Runnable logoutStep = () -> {
    };
    private volatile Runnable unauthorizedListener = () -> {
    };

    private final AtomicInteger healthCalls = new AtomicInteger();
    private final AtomicInteger loginCalls = new AtomicInteger();
    private final AtomicInteger pullCalls = new AtomicInteger();
    private final AtomicInteger profileCalls = new AtomicInteger();
    private final AtomicInteger logoutCalls = new AtomicInteger();
    private final AtomicInteger registerCalls = new AtomicInteger();
    private final List<String> pullTokens = new ArrayList<>();

    public static NetworkException unreachable() {
        return new NetworkException("connection refused", null);
    }

    public static AuthorityException status(int code) {
        return new AuthorityException(code, "HTTP " + code, "");
    }

    public static Supplier<HealthResponse> healthy() {
        return () -> HEALTHY;
    }

    public static Supplier<HealthResponse> failing(int code) {
        return () -> {
            throw status(code);
        };
    }

    public static Supplier<HealthResponse> offline() {
        return () -> {
            throw unreachable();
        };
    }

    public static Supplier<LoginResponse> accepts(Identity identity, String token) {
        return () -> new LoginResponse(identity, token, Source.REMOTE);
    }

    @SafeVarargs
    public final synchronized ScriptedRemoteClient queueHealth(Supplier<HealthResponse>... steps) {
        healthSteps.addAll(List.of(steps));
        return this;
    }

    public synchronized ScriptedRemoteClient healthByDefault(Supplier<HealthResponse> step) {
        healthDefault = step;
        return this;
    }

    @SafeVarargs
    public final synchronized ScriptedRemoteClient queueLogin(Supplier<LoginResponse>... steps) {
        loginSteps.addAll(List.of(steps));
        return this;
    }

    public synchronized ScriptedRemoteClient loginByDefault(Supplier<LoginResponse> step) {
        loginDefault = step;
        return this;
    }

    @SafeVarargs
    public final synchronized ScriptedRemoteClient queuePull(Supplier<SyncPayload>... steps) {
        pullSteps.addAll(List.of(steps));
        return this;
    }

    public synchronized ScriptedRemoteClient pullByDefault(Supplier<SyncPayload> step) {
        pullDefault = step;
        return this;
    }

    @SafeVarargs
    public final synchronized ScriptedRemoteClient queueProfile(Supplier<Identity>... steps) {
        profileSteps.addAll(List.of(steps));
        return this;
    }

    public synchronized ScriptedRemoteClient registerByDefault(Supplier<RegistrationResult> step) {
        registerDefault = step;
        return this;
    }

    public synchronized ScriptedRemoteClient logoutBehaviour(Runnable step) {
        logoutStep = step;
        return this;
    }

    @Override
    public LoginResponse login(String email, String password) {
        loginCalls.incrementAndGet();
        return run(next(loginSteps, loginDefault));
    }

    @Override
    public RegistrationResult register(RegistrationRequest request) {
        registerCalls.incrementAndGet();
        Supplier<RegistrationResult> step;
        synchronized (this) {
            step = registerDefault;
        }
        return run(step);
    }

    @Override
    public void logout(String token) {
        logoutCalls.incrementAndGet();
        Runnable step;
        synchronized (this) {
            step = logoutStep;
        }
        step.run();
    }

    @Override
    public Identity getProfile(String token) {
        profileCalls.incrementAndGet();
        return run(next(profileSteps, profileDefault));
    }

    @Override
    public HealthResponse health() {
        healthCalls.incrementAndGet();
        // Health calls never notify.
        return next(healthSteps, healthDefault).get();
    }

    @Override
    public SyncPayload pullAll(String token) {
        pullCalls.incrementAndGet();
        synchronized (this) {
            pullTokens.add(token);
        }
        return run(next(pullSteps, pullDefault));
    }

    @Override
    public void setUnauthorizedListener(Runnable listener) {
        this.unauthorizedListener = listener == null ? () -> {
        } : listener;
    }

    private synchronized <T> Supplier<T> next(Deque<Supplier<T>> steps, Supplier<T> fallback) {
        Supplier<T> step = steps.pollFirst();
        return step == null ? fallback : step;
    }

    private <T> T run(Supplier<T> step) {
        try {
            return step.get();
        } catch (AuthorityException e) {
            if (e.isUnauthorized()) {
                unauthorizedListener.run();
            }
            throw e;
        }
    }

    public int healthCalls() {
        return healthCalls.get();
    }

    public int loginCalls() {
        return loginCalls.get();
    }

    public int pullCalls() {
        return pullCalls.get();
    }

    public int profileCalls() {
        return profileCalls.get();
    }

    public int logoutCalls() {
        return logoutCalls.get();
    }

    public int registerCalls() {
        return registerCalls.get();
    }

    /**
     * Tokens passed to each pull, in order; {@code null} where no token was sent.
     */
    public synchronized List<String> pullTokens() {
        return Collections.unmodifiableList(new ArrayList<>(pullTokens));
    }
}
