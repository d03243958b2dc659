package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.time.OffsetDateTime;
import javax.annotation.Nullable;

/** Search filters for listing security signals. */
public class SecurityMonitoringSignalListRequestFilter extends AbstractModel {
  @Json(name = "from")
  private OffsetDateTime from;

  @Json(name = "query")
  private String query;

  @Json(name = "to")
  private OffsetDateTime to;

  public SecurityMonitoringSignalListRequestFilter() {}

  public SecurityMonitoringSignalListRequestFilter from(OffsetDateTime from) {
    this.from = from;
    return this;
  }

  /** The minimum timestamp for requested security signals. */
  @Nullable
  public OffsetDateTime getFrom() {
    return from;
  }

  public boolean hasFrom() {
    return from != null;
  }

  public void setFrom(OffsetDateTime from) {
    this.from = from;
  }

  public SecurityMonitoringSignalListRequestFilter query(String query) {
    this.query = query;
    return this;
  }

  /** Search query for listing security signals. */
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

  public SecurityMonitoringSignalListRequestFilter to(OffsetDateTime to) {
    this.to = to;
    return this;
  }

  /** The maximum timestamp for requested security signals. */
  @Nullable
  public OffsetDateTime getTo() {
    return to;
  }

  public boolean hasTo() {
    return to != null;
  }

  public void setTo(OffsetDateTime to) {
    this.to = to;
  }
}
