package docguard.adapter.out.audit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.UUID;

import org.jboss.logging.Logger;

/**
 * Anonymous, persistent identifier of one installation.
 *
 * <p>Created once in the audit directory and reused across restarts. It contains no host
 * name, address or user information.
 */
public final class MachineIdentity {

    private static final Logger LOG = Logger.getLogger(MachineIdentity.class);

    static final String FILE_NAME = ".machine-id";

    private final String id;

    private MachineIdentity(String id) {
        this.id = id;
    }

    /**
     * Read the identifier stored in {@code directory}, creating it on first use.
     *
     * @param directory the audit directory (must exist)
     * @return the identity
     * @throws UncheckedIOException if the file can be neither read nor created
     */
    public static MachineIdentity loadOrCreate(Path directory) {
        final var file = directory.resolve(FILE_NAME);
        try {
            if (Files.exists(file)) {
                final var existing = Files.readString(file, StandardCharsets.UTF_8).trim();
                if (!existing.isEmpty()) {
                    return new MachineIdentity(existing);
                }
            }
            final var created = UUID.randomUUID().toString();
            try {
                Files.writeString(file, created, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
                LOG.infov("Created machine id {0}", created);
            } catch (FileAlreadyExistsException e) {
                // another process won the race; use its id
                return new MachineIdentity(Files.readString(file, StandardCharsets.UTF_8).trim());
            }
            return new MachineIdentity(created);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load machine id", e);
        }
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
