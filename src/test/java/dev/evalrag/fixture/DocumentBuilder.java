package dev.evalrag.fixture;

import dev.evalrag.document.Document;
import java.util.Map;

/**
 * Lightweight test builder for {@link Document}.
 * Provides sensible defaults so tests only override what they care about.
 *
 * <pre>{@code
 * Document document = new DocumentBuilder().id("guide.md").text("Some content").build();
 * }</pre>
 */
public final class DocumentBuilder {

    private String id = "doc.txt";
    private String sourceUri;
    private String text = "Sample document text for testing.";
    private Map<String, Object> metadata = Map.of();

    public DocumentBuilder id(String id) {
        this.id = id;
        return this;
    }

    public DocumentBuilder sourceUri(String sourceUri) {
        this.sourceUri = sourceUri;
        return this;
    }

    public DocumentBuilder text(String text) {
        this.text = text;
        return this;
    }

    public DocumentBuilder metadata(Map<String, Object> metadata) {
        this.metadata = metadata;
        return this;
    }

    public Document build() {
        return new Document(id, sourceUri != null ? sourceUri : "file:///corpus/" + id, text, metadata);
    }
}
