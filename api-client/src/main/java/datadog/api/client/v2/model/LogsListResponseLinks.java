package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Links attributes. */
public class LogsListResponseLinks extends AbstractModel {
  @Json(name = "next")
  private String next;

  public LogsListResponseLinks() {}

  public LogsListResponseLinks next(String next) {
    this.next = next;
    return this;
  }

  /**
   * Link for the next set of results. Note that the request can also be made using the POST
   * endpoint.
   */
  @Nullable
  public String getNext() {
    return next;
  }

  public boolean hasNext() {
    return next != null;
  }

  public void setNext(String next) {
    this.next = next;
  }
}
