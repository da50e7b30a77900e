package dev.evalrag.eval.store;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EvalItemRepository extends JpaRepository<EvalItem, EvalItem.Key> {

  List<EvalItem> findByRunIdOrderByPositionAsc(String runId);
}
