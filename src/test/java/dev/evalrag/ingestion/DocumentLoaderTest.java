package dev.evalrag.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.evalrag.document.Document;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentLoaderTest {

  private final DocumentLoader loader = new DocumentLoader();

  @TempDir Path root;

  @Test
  void loadsTextAndMarkdownFilesWithRelativeIds() throws IOException {
    Files.writeString(root.resolve("b.txt"), "Beta");
    Files.createDirectories(root.resolve("guides"));
    Files.writeString(root.resolve("guides/a.md"), "# Alpha");
    Files.writeString(root.resolve("image.png"), "not text");

    List<Document> documents = loader.loadDirectory(root);

    assertThat(documents).extracting(Document::id).containsExactly("b.txt", "guides/a.md");
    assertThat(documents.get(1).rawText()).isEqualTo("# Alpha");
    assertThat(documents.get(1).metadata()).containsEntry("file_name", "a.md");
    assertThat(documents.get(1).sourceUri()).startsWith("file:");
  }

  @Test
  void emptyDirectoryYieldsNoDocuments() {
    assertThat(loader.loadDirectory(root)).isEmpty();
  }

  @Test
  void rejectsPathThatIsNotADirectory() throws IOException {
    Path file = Files.writeString(root.resolve("single.txt"), "text");

    assertThatThrownBy(() -> loader.loadDirectory(file))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Not a directory");
  }
}
