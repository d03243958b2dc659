package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Pagination properties. */
public class IncidentResponseMetaPagination extends AbstractModel {
  @Json(name = "next_offset")
  private Long nextOffset;

  @Json(name = "offset")
  private Long offset;

  @Json(name = "size")
  private Long size;

  public IncidentResponseMetaPagination() {}

  public IncidentResponseMetaPagination nextOffset(Long nextOffset) {
    this.nextOffset = nextOffset;
    return this;
  }

  /**
   * The index of the first element in the next page of results. Equal to page size added to the
   * current offset.
   */
  @Nullable
  public Long getNextOffset() {
    return nextOffset;
  }

  public boolean hasNextOffset() {
    return nextOffset != null;
  }

  public void setNextOffset(Long nextOffset) {
    this.nextOffset = nextOffset;
  }

  public IncidentResponseMetaPagination offset(Long offset) {
    this.offset = offset;
    return this;
  }

  /** The index of the first element in the results. */
  @Nullable
  public Long getOffset() {
    return offset;
  }

  public boolean hasOffset() {
    return offset != null;
  }

  public void setOffset(Long offset) {
    this.offset = offset;
  }

  public IncidentResponseMetaPagination size(Long size) {
    this.size = size;
    return this;
  }

  /** Maximum size of pages to return. */
  @Nullable
  public Long getSize() {
    return size;
  }

  public boolean hasSize() {
    return size != null;
  }

  public void setSize(Long size) {
    this.size = size;
  }
}
