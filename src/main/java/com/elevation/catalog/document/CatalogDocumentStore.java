package com.elevation.catalog.document;

import com.elevation.catalog.core.CatalogWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes catalog documents below a root directory.
 *
 * <p>A document is serialized completely in memory, written to a temporary file in the target
 * directory and moved over the target, so readers never observe a partially written document.
 * Without {@code overwrite} an existing document is left untouched.</p>
 */
public class CatalogDocumentStore {
    private static final Logger log = LoggerFactory.getLogger(CatalogDocumentStore.class);

    private final Path root;

    public CatalogDocumentStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    public Path resolve(String relativePath) {
        Path target = root.resolve(relativePath).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Document path escapes the catalog root: " + relativePath);
        }
        return target;
    }

    public boolean exists(String relativePath) {
        return Files.exists(resolve(relativePath));
    }

    /**
     * @return true if the document was written, false if an existing file was kept
     * @throws CatalogWriteException if serialization or any file operation fails
     */
    public boolean write(String relativePath, Object document, boolean overwrite) {
        Path target = resolve(relativePath);
        if (!overwrite && Files.exists(target)) {
            log.debug("document.kept path={}", target);
            return false;
        }
        byte[] content;
        try {
            content = CatalogJson.documentWriter().writeValueAsBytes(document);
        } catch (IOException e) {
            throw new CatalogWriteException("Failed to serialize document", target, e);
        }
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.write(temp, content);
            moveIntoPlace(temp, target);
            log.debug("document.written path={} bytes={}", target, content.length);
            return true;
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CatalogWriteException("Failed to write document", target, e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("document.move.nonAtomic path={}", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("document.tempCleanupFailed path={}: {}", temp, e.getMessage());
        }
    }
}
