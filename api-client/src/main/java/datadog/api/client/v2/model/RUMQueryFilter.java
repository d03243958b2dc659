package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** The search and filter query settings. */
public class RUMQueryFilter extends AbstractModel {
  @Json(name = "from")
  private String from = "now-15m";

  @Json(name = "query")
  private String query = "*";

  @Json(name = "to")
  private String to = "now";

  public RUMQueryFilter() {}

  public RUMQueryFilter from(String from) {
    this.from = from;
    return this;
  }

  /**
   * The minimum time for the requested events; supports date, math, and regular timestamps (in
   * milliseconds).
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

  public RUMQueryFilter query(String query) {
    this.query = query;
    return this;
  }

  /** The search query following the RUM search syntax. */
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

  public RUMQueryFilter to(String to) {
    this.to = to;
    return this;
  }

  /**
   * The maximum time for the requested events; supports date, math, and regular timestamps (in
   * milliseconds).
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
