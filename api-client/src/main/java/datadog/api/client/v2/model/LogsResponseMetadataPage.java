package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Paging attributes. */
public class LogsResponseMetadataPage extends AbstractModel {
  @Json(name = "after")
  private String after;

  public LogsResponseMetadataPage() {}

  public LogsResponseMetadataPage after(String after) {
    this.after = after;
    return this;
  }

  /**
   * The cursor to use to get the next results, if any. To make the next request, use the same
   * parameters with the addition of the `page[cursor]`.
   */
  @Nullable
  public String getAfter() {
    return after;
  }

  public boolean hasAfter() {
    return after != null;
  }

  public void setAfter(String after) {
    this.after = after;
  }
}
