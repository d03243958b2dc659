package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** The search and filter query settings */
public class LogsQueryFilter extends AbstractModel {
  @Json(name = "from")
  private String from = "now-15m";

  @Json(name = "indexes")
  private List<String> indexes;

  @Json(name = "query")
  private String query = "*";

  @Json(name = "storage_tier")
  private LogsStorageTier storageTier;

  @Json(name = "to")
  private String to = "now";

  public LogsQueryFilter() {}

  public LogsQueryFilter from(String from) {
    this.from = from;
    return this;
  }

  /**
   * The minimum time for the requested logs, supports date math and regular timestamps
   * (milliseconds).
   */
  @Nullable
  public String getFrom() {
    return from;
  }

  public boolean hasFrom() {
    return from != null;
  }

  public void setFrom(String from) {
    this.from = from;
  }

  public LogsQueryFilter indexes(List<String> indexes) {
    this.indexes = indexes;
    return this;
  }

  public LogsQueryFilter addIndexItem(String indexItem) {
    if (this.indexes == null) {
      this.indexes = new ArrayList<>();
    }
    this.indexes.add(indexItem);
    return this;
  }

  /**
   * For customers with multiple indexes, the indexes to search. Defaults to ['*'] which means all
   * indexes.
   */
  @Nullable
  public List<String> getIndexes() {
    return indexes;
  }

  public boolean hasIndexes() {
    return indexes != null;
  }

  public void setIndexes(List<String> indexes) {
    this.indexes = indexes;
  }

  public LogsQueryFilter query(String query) {
    this.query = query;
    return this;
  }

  /** The search query - following the log search syntax. */
  @Nullable
  public String getQuery() {
    return query;
  }

  public boolean hasQuery() {
    return query != null;
  }

  public void setQuery(String query) {
    this.query = query;
  }

  public LogsQueryFilter storageTier(LogsStorageTier storageTier) {
    this.storageTier = storageTier;
    return this;
  }

  @Nullable
  public LogsStorageTier getStorageTier() {
    return storageTier;
  }

  public boolean hasStorageTier() {
    return storageTier != null;
  }

  public void setStorageTier(LogsStorageTier storageTier) {
    this.storageTier = storageTier;
  }

  public LogsQueryFilter to(String to) {
    this.to = to;
    return this;
  }

  /**
   * The maximum time for the requested logs, supports date math and regular timestamps
   * (milliseconds).
   */
  @Nullable
  public String getTo() {
    return to;
  }

  public boolean hasTo() {
    return to != null;
  }

  public void setTo(String to) {
    this.to = to;
  }
}
