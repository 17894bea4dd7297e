package com.example.s3explorer.session;

import com.example.s3explorer.internal.Json;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the credential pair in a single JSON file so a session survives restarts. Each write goes
 * to a sibling temp file that is then moved over the target.
 */
public final class FileCredentialStore implements CredentialStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileCredentialStore.class);

    private final ObjectMapper mapper;
    private final Path credentialPath;
    private CredentialPair cached;
    private boolean loaded;

    public FileCredentialStore(Path credentialPath) {
        this.mapper = Json.mapper();
        this.credentialPath = Objects.requireNonNull(credentialPath, "credentialPath");
    }

    /**
     * Returns the stored pair, reading the file on first use. An unreadable file counts as no session.
     */
    @Override
    public synchronized Optional<CredentialPair> read() {
        if (!loaded) {
            cached = load();
            loaded = true;
        }
        return Optional.ofNullable(cached);
    }

    @Override
    public synchronized void write(CredentialPair pair) {
        Objects.requireNonNull(pair, "pair");
        try {
            Path parent = credentialPath.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, credentialPath.getFileName().toString(), ".tmp");
            restrictToOwner(temp);
            mapper.writeValue(temp.toFile(), pair);
            move(temp);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to store credentials in " + credentialPath, ex);
        }
        cached = pair;
        loaded = true;
    }

    @Override
    public synchronized void clear() {
        cached = null;
        loaded = true;
        try {
            Files.deleteIfExists(credentialPath);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to remove " + credentialPath, ex);
        }
    }

    private CredentialPair load() {
        if (!Files.exists(credentialPath)) {
            return null;
        }
        try {
            return mapper.readValue(credentialPath.toFile(), CredentialPair.class);
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.warn("Ignoring unreadable credential file {}", credentialPath, ex);
            return null;
        }
    }

    private void move(Path temp) throws IOException {
        try {
            Files.move(temp, credentialPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, credentialPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void restrictToOwner(Path file) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
