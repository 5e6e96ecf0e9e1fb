package io.workgate.source;

import io.workgate.spi.ItemSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ItemSource} over the local file system. A file's provider identity is the
 * SHA-256 of its content; entries are listed in name order.
 */
public final class LocalFileSystemSource implements ItemSource {
    private static final Logger logger = Logger.getLogger(LocalFileSystemSource.class.getName());

    @Override
    public List<SourceEntry> listDirectory(String path) throws IOException {
        Path dir = Path.of(path);
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(children::add);
        }
        children.sort(Comparator.comparing(p -> p.getFileName().toString()));
        List<SourceEntry> entries = new ArrayList<>(children.size());
        for (Path child : children) {
            String childPath = child.toString().replace('\\', '/');
            if (Files.isDirectory(child)) {
                entries.add(SourceEntry.directory(childPath));
                continue;
            }
            try {
                entries.add(new SourceEntry(childPath, false, Files.size(child), contentHash(child),
                        Files.probeContentType(child)));
            } catch (IOException e) {
                logger.log(Level.WARNING, "Skipping unreadable file " + childPath, e);
            }
        }
        return entries;
    }

    static String contentHash(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] buffer = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
