package dev.evalrag.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashOfKnownInputMatchesExpected() {
    assertThat(ContentHasher.sha256("hello"))
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
  }

  @Test
  void emptyStringProducesValidHash() {
    assertThat(ContentHasher.sha256(""))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }

  @Test
  void differentContentProducesDifferentHash() {
    assertThat(ContentHasher.sha256("content A")).isNotEqualTo(ContentHasher.sha256("content B"));
  }
}
