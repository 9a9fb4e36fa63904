package com.onthegomap.palmprep.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileUtilsTest {

  @TempDir
  Path tmpDir;

  @Test
  void testNonEmptyFile() throws Exception {
    Path empty = Files.createFile(tmpDir.resolve("empty"));
    Path full = Files.writeString(tmpDir.resolve("full"), "x");
    assertFalse(FileUtils.isNonEmptyFile(empty));
    assertTrue(FileUtils.isNonEmptyFile(full));
    assertFalse(FileUtils.isNonEmptyFile(tmpDir.resolve("missing")));
    assertFalse(FileUtils.isNonEmptyFile(tmpDir));
    assertEquals(1, FileUtils.size(full));
  }

  @Test
  void testListFilesSortedSkipsDirectories() throws Exception {
    Files.writeString(tmpDir.resolve("b.tif"), "x");
    Files.writeString(tmpDir.resolve("a.tif"), "x");
    Files.createDirectory(tmpDir.resolve("c"));
    assertEquals(List.of(tmpDir.resolve("a.tif"), tmpDir.resolve("b.tif")), FileUtils.listFilesSorted(tmpDir));
    assertThrows(UncheckedIOException.class, () -> FileUtils.listFilesSorted(tmpDir.resolve("missing")));
  }

  @Test
  void testCreateParentsAndDelete() throws Exception {
    Path nested = tmpDir.resolve("a").resolve("b").resolve("file.csv");
    FileUtils.createParentDirectories(nested);
    assertTrue(Files.isDirectory(nested.getParent()));
    Files.writeString(nested, "x");
    FileUtils.deleteFile(nested);
    assertFalse(Files.exists(nested));
    FileUtils.deleteFile(nested);
  }
}
