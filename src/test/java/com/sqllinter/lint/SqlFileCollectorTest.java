package com.sqllinter.lint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqlFileCollectorTest {

    @TempDir
    Path tempDir;

    @Test
    void testCollectDirectoryRecursively() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("models/staging"));
        Files.writeString(tempDir.resolve("b.sql"), "select 1");
        Files.writeString(tempDir.resolve("A.SQL"), "select 1");
        Files.writeString(nested.resolve("c.sql"), "select 1");
        Files.writeString(tempDir.resolve("notes.txt"), "not sql");

        List<Path> files = SqlFileCollector.collect(List.of(tempDir));

        assertEquals(3, files.size());
        assertTrue(files.contains(tempDir.resolve("A.SQL").normalize()));
        assertTrue(files.contains(nested.resolve("c.sql").normalize()));
        assertFalse(files.contains(tempDir.resolve("notes.txt").normalize()));
    }

    @Test
    void testExplicitFileIsKeptWhateverItsExtension() throws IOException {
        Path script = Files.writeString(tempDir.resolve("query.txt"), "select 1");

        assertEquals(List.of(script.normalize()), SqlFileCollector.collect(List.of(script)));
    }

    @Test
    void testDuplicatesAreRemoved() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.sql"), "select 1");

        assertEquals(1, SqlFileCollector.collect(List.of(file, tempDir)).size());
    }

    @Test
    void testMissingPathThrows() {
        IOException exception = assertThrows(IOException.class,
                () -> SqlFileCollector.collect(List.of(tempDir.resolve("missing"))));
        assertTrue(exception.getMessage().contains("missing"));
    }

    @Test
    void testIsSqlFile() {
        assertTrue(SqlFileCollector.isSqlFile(Path.of("x.sql")));
        assertTrue(SqlFileCollector.isSqlFile(Path.of("dir/Y.Sql")));
        assertFalse(SqlFileCollector.isSqlFile(Path.of("x.sql.bak")));
    }
}
