package blog.platform.client;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Keeps the raw access token in a local file between client runs
 */
@Slf4j
public class FileTokenStore {

    public static final String DEFAULT_FILE_NAME = ".blog_token";

    private final Path path;

    public FileTokenStore() {
        this(Paths.get(DEFAULT_FILE_NAME));
    }

    public FileTokenStore(Path path) {
        this.path = path;
    }

    /**
     * @return the stored token trimmed, or empty when the file is missing or blank
     */
    public Optional<String> load() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read token file " + path, e);
        }
    }

    public void save(String token) {
        try {
            Files.writeString(path, token, StandardCharsets.UTF_8);
            log.debug("Token saved to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write token file " + path, e);
        }
    }

    public void clear() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete token file " + path, e);
        }
    }

    /**
     * Restore a saved token into the client, if there is one
     */
    public void restoreInto(BlogClient client) {
        load().ifPresent(client::setToken);
    }

    /**
     * Persist the client's current token, or remove the file when it has none
     */
    public void persistFrom(BlogClient client) {
        client.getToken().ifPresentOrElse(this::save, this::clear);
    }

    static Optional<String> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String token = raw.trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
