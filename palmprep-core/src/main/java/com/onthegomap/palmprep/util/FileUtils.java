package com.onthegomap.palmprep.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Convenience methods for working with files on disk.
 */
public class FileUtils {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileUtils.class);

  private FileUtils() {}

  /** Returns the size of a file at {@code path} or 0 if missing/inaccessible. */
  public static long size(Path path) {
    try {
      return Files.isRegularFile(path) ? Files.size(path) : 0;
    } catch (IOException e) {
      return 0;
    }
  }

  /** Returns true if {@code path} is a regular file with at least one byte in it. */
  public static boolean isNonEmptyFile(Path path) {
    return size(path) > 0;
  }

  /** Deletes a file if it exists or logs an error if it can't be deleted. */
  public static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.error("Unable to delete " + path, e);
    }
  }

  /**
   * Ensures a directory and all parent directories exists.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createDirectory(Path path) {
    try {
      Files.createDirectories(path);
    } catch (IOException e) {
      throw new IllegalStateException("Unable to create directories " + path, e);
    }
  }

  /**
   * Ensures all parent directories of each path in {@code paths} exist.
   *
   * @throws IllegalStateException if an error occurs
   */
  public static void createParentDirectories(Path... paths) {
    for (var path : paths) {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null && !Files.exists(parent)) {
        createDirectory(parent);
      }
    }
  }

  /**
   * Returns the regular files directly inside {@code dir}, sorted by file name.
   *
   * @throws UncheckedIOException if the directory cannot be listed
   */
  public static List<Path> listFilesSorted(Path dir) {
    try (Stream<Path> files = Files.list(dir)) {
      return files
        .filter(Files::isRegularFile)
        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
        .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to list " + dir, e);
    }
  }

  /**
   * Moves {@code from} to {@code to}, replacing the target if it exists.
   *
   * @throws UncheckedIOException if an error occurs
   */
  public static void move(Path from, Path to) {
    try {
      Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
