package com.example.s3explorer.session;

import java.util.Optional;

/**
 * Holds the current credential pair. Implementations must make every call atomic: a reader sees
 * either the old pair, the new pair or nothing, never a mix.
 */
public interface CredentialStore {

    Optional<CredentialPair> read();

    void write(CredentialPair pair);

    void clear();
}
