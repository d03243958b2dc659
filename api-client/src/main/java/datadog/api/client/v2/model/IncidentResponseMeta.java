package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** The metadata object containing pagination metadata. */
public class IncidentResponseMeta extends AbstractModel {
  @Json(name = "pagination")
  private IncidentResponseMetaPagination pagination;

  public IncidentResponseMeta() {}

  public IncidentResponseMeta pagination(IncidentResponseMetaPagination pagination) {
    this.pagination = pagination;
    return this;
  }

  @Nullable
  public IncidentResponseMetaPagination getPagination() {
    return pagination;
  }

  public boolean hasPagination() {
    return pagination != null;
  }

  public void setPagination(IncidentResponseMetaPagination pagination) {
    this.pagination = pagination;
  }
}
