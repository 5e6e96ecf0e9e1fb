package io.workgate.spi;

import java.io.IOException;
import java.util.List;

/**
 * Hierarchical source of candidate work items.
 */
public interface ItemSource {

    /**
     * Lists the direct children of a directory.
     *
     * @param path directory path
     * @return children in a stable order
     * @throws IOException if the directory cannot be read
     */
    List<SourceEntry> listDirectory(String path) throws IOException;

    /**
     * One child of a listed directory.
     *
     * @param path             full path of the entry
     * @param directory        whether the entry is a directory
     * @param size             size in bytes, {@code -1} if unknown
     * @param providerIdentity content hash or provider id, {@code null} for directories
     * @param mimeType         MIME type, may be {@code null}
     */
    record SourceEntry(String path, boolean directory, long size, String providerIdentity,
            String mimeType) {

        public static SourceEntry directory(String path) {
            return new SourceEntry(path, true, -1L, null, null);
        }

        public static SourceEntry file(String path, long size, String providerIdentity) {
            return new SourceEntry(path, false, size, providerIdentity, null);
        }

        public String name() {
            String trimmed = path.endsWith("/") && path.length() > 1
                    ? path.substring(0, path.length() - 1) : path;
            int idx = trimmed.lastIndexOf('/');
            return idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
        }
    }
}
