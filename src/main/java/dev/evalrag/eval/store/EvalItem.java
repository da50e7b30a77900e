package dev.evalrag.eval.store;

import dev.evalrag.eval.ItemStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.util.Objects;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Row of the {@code eval_item_results} table, keyed by run and item id.
 *
 * <p>The full item result is stored as JSONB; status and position are columns for querying and
 * ordering.
 */
@Entity
@Table(name = "eval_item_results")
@IdClass(EvalItem.Key.class)
public class EvalItem {

  @Id
  @Column(name = "run_id")
  private String runId;

  @Id
  @Column(name = "item_id")
  private String itemId;

  @Column(nullable = false)
  private int position;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private ItemStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(nullable = false, columnDefinition = "JSONB")
  private String result;

  protected EvalItem() {
    // JPA requires no-arg constructor
  }

  public EvalItem(String runId, String itemId, int position, ItemStatus status, String result) {
    this.runId = runId;
    this.itemId = itemId;
    this.position = position;
    this.status = status;
    this.result = result;
  }

  public String getRunId() {
    return runId;
  }

  public String getItemId() {
    return itemId;
  }

  public int getPosition() {
    return position;
  }

  public ItemStatus getStatus() {
    return status;
  }

  public String getResult() {
    return result;
  }

  /** Composite primary key. */
  public static class Key implements Serializable {

    private String runId;
    private String itemId;

    protected Key() {}

    public Key(String runId, String itemId) {
      this.runId = runId;
      this.itemId = itemId;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Key other
          && Objects.equals(runId, other.runId)
          && Objects.equals(itemId, other.itemId);
    }

    @Override
    public int hashCode() {
      return Objects.hash(runId, itemId);
    }
  }
}
