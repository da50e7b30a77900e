package dev.evalrag.document;

import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link DocumentRecord} entities. */
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, String> {}
