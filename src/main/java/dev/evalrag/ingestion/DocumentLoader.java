package dev.evalrag.ingestion;

import dev.evalrag.document.Document;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Loads plain-text documents ({@code .txt}, {@code .md}) from a directory tree.
 *
 * <p>The document id is the file path relative to the root with forward slashes, so the same
 * corpus yields the same ids on every machine. Files are returned in id order. Undecodable bytes
 * become U+FFFD and are later dropped by {@link TextCleaner}.
 */
@Component
public class DocumentLoader {

  private static final Set<String> EXTENSIONS = Set.of("txt", "md");

  public List<Document> loadDirectory(Path root) {
    if (!Files.isDirectory(root)) {
      throw new IllegalArgumentException("Not a directory: " + root);
    }
    try (Stream<Path> files = Files.walk(root)) {
      return files
          .filter(Files::isRegularFile)
          .filter(DocumentLoader::isSupported)
          .sorted()
          .map(file -> load(root, file))
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list documents under " + root, e);
    }
  }

  private static boolean isSupported(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  private static Document load(Path root, Path file) {
    String id = root.relativize(file).toString().replace('\\', '/');
    try {
      String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
      return new Document(
          id, file.toUri().toString(), text, Map.of("file_name", file.getFileName().toString()));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
  }
}
