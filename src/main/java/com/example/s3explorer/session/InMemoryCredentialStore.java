package com.example.s3explorer.session;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public final class InMemoryCredentialStore implements CredentialStore {
    private final AtomicReference<CredentialPair> current = new AtomicReference<>();

    @Override
    public Optional<CredentialPair> read() {
        return Optional.ofNullable(current.get());
    }

    @Override
    public void write(CredentialPair pair) {
        current.set(Objects.requireNonNull(pair, "pair"));
    }

    @Override
    public void clear() {
        current.set(null);
    }
}
