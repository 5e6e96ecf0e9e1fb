package io.workgate.source;

import io.workgate.spi.ItemSource.SourceEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalFileSystemSourceTest {

    @TempDir
    Path dir;

    @Test
    void listsChildrenInNameOrder() throws IOException {
        Files.writeString(dir.resolve("b.txt"), "bee");
        Files.writeString(dir.resolve("a.txt"), "a");
        Files.createDirectory(dir.resolve("sub"));

        List<SourceEntry> entries = new LocalFileSystemSource().listDirectory(dir.toString());

        assertEquals(List.of("a.txt", "b.txt", "sub"), entries.stream().map(SourceEntry::name).toList());
        assertFalse(entries.get(0).directory());
        assertEquals(3, entries.get(1).size());
        assertTrue(entries.get(2).directory());
        assertNull(entries.get(2).providerIdentity());
    }

    @Test
    void identicalContentSharesIdentity() throws IOException {
        Files.writeString(dir.resolve("one.pdf"), "same bytes", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("two.pdf"), "same bytes", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("three.pdf"), "other bytes", StandardCharsets.UTF_8);

        List<SourceEntry> entries = new LocalFileSystemSource().listDirectory(dir.toString());

        assertEquals(entries.get(0).providerIdentity(), entries.get(2).providerIdentity());
        assertNotEquals(entries.get(0).providerIdentity(), entries.get(1).providerIdentity());
        assertEquals(64, entries.get(0).providerIdentity().length());
    }

    @Test
    void knownDigest() throws IOException {
        Path file = Files.writeString(dir.resolve("abc"), "abc", StandardCharsets.UTF_8);

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                LocalFileSystemSource.contentHash(file));
    }

    @Test
    void missingDirectoryThrows() {
        assertThrows(IOException.class,
                () -> new LocalFileSystemSource().listDirectory(dir.resolve("missing").toString()));
    }
}
