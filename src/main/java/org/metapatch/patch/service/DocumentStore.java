package org.metapatch.patch.service;

import org.metapatch.patch.config.PatchConfig;
import org.metapatch.xml.XmlDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;

/**
 * Reads documents fully before any edit and writes them back in one step.
 */
@Component
public class DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

    private final PatchConfig config;

    public DocumentStore(PatchConfig config) {
        this.config = config;
    }

    public XmlDocument load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) throw new IOException("Document not found: " + file);
        XmlDocument document;
        try {
            document = XmlDocument.load(Files.readAllBytes(file), config.getEncoding());
        } catch (UncheckedIOException e) {
            throw new IOException("Cannot read " + file + ": " + e.getMessage(), e.getCause());
        }
        logger.info("Loaded {} ({}{}, root <{}>)", file, document.charset(),
                document.hasByteOrderMark() ? " with BOM" : "", document.root().name());
        return document;
    }

    /**
     * Writes to a sibling temporary file first and moves it over the original, so a failed write leaves the
     * original in place. The original's POSIX permissions carry over to the new file where the file system has them.
     */
    public void save(XmlDocument document, Path file) throws IOException {
        Path absolute = file.toAbsolutePath();
        byte[] bytes;
        try {
            bytes = document.toBytes();
        } catch (UncheckedIOException e) {
            throw new IOException("Cannot write " + file + ": " + e.getMessage(), e.getCause());
        }
        Path temp = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            copyPermissions(absolute, temp);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.info("Wrote {}", file);
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from)) return;
        PosixFileAttributeView source = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        PosixFileAttributeView target = Files.getFileAttributeView(to, PosixFileAttributeView.class);
        if (source == null || target == null) {
            logger.debug("No POSIX permissions to copy for {}", from);
            return;
        }
        target.setPermissions(source.readAttributes().permissions());
    }
}
