package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Pagination object. */
public class Pagination extends AbstractModel {
  @Json(name = "total_count")
  private Long totalCount;

  @Json(name = "total_filtered_count")
  private Long totalFilteredCount;

  public Pagination() {}

  public Pagination totalCount(Long totalCount) {
    this.totalCount = totalCount;
    return this;
  }

  /** Total count. */
  @Nullable
  public Long getTotalCount() {
    return totalCount;
  }

  public boolean hasTotalCount() {
    return totalCount != null;
  }

  public void setTotalCount(Long totalCount) {
    this.totalCount = totalCount;
  }

  public Pagination totalFilteredCount(Long totalFilteredCount) {
    this.totalFilteredCount = totalFilteredCount;
    return this;
  }

  /** Total count of elements matched by the filter. */
  @Nullable
  public Long getTotalFilteredCount() {
    return totalFilteredCount;
  }

  public boolean hasTotalFilteredCount() {
    return totalFilteredCount != null;
  }

  public void setTotalFilteredCount(Long totalFilteredCount) {
    this.totalFilteredCount = totalFilteredCount;
  }
}
