package fsmgen.util;

import fsmgen.frontend.ResourceException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing files.
 */
public class FileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** key: output path, value: complete file content. Insertion order is the write order. */
  private final LinkedHashMap<Path, String> contents = new LinkedHashMap<>();

  /**
   * Registers the full content of an output file. Nothing is written before {@link #WriteFiles()}.
   * Registering the same path twice keeps the later content.
   */
  public void UpdateContent(Path file, String text) {
    if (contents.put(file, text) != null)
      logger.warn("Output {} requested twice, keeping the last content", file);
  }

  public Map<Path, String> GetContents() { return contents; }

  /**
   * Writes all registered files, creating parent directories as needed.
   * If one file fails, it and the files already written by this call are deleted again and nothing is left behind.
   */
  public void WriteFiles() throws ResourceException {
    List<Path> written = new ArrayList<>();
    for (Entry<Path, String> entry : contents.entrySet()) {
      Path file = entry.getKey();
      try {
        WriteFile(file, entry.getValue());
        written.add(file);
      } catch (IOException e) {
        for (Path done : written)
          deleteQuietly(done);
        throw new ResourceException("Cannot write " + file + ": " + e.getMessage(), e);
      }
    }
  }

  private void WriteFile(Path file, String text) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null)
      Files.createDirectories(parent);
    logger.info("Writing " + file);
    PrintWriter out = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
    // from here on the file exists, a failure must not leave it truncated
    try (out) {
      out.print(text);
      if (out.checkError())
        throw new IOException("write error");
    } catch (IOException e) {
      deleteQuietly(file);
      throw e;
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      logger.error("Could not remove partial output " + file + ": " + e.getMessage());
    }
  }
}
