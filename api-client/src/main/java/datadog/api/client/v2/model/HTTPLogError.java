package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** List of errors. */
public class HTTPLogError extends AbstractModel {
  @Json(name = "detail")
  private String detail;

  @Json(name = "status")
  private String status;

  @Json(name = "title")
  private String title;

  public HTTPLogError() {}

  public HTTPLogError detail(String detail) {
    this.detail = detail;
    return this;
  }

  /** Error message. */
  @Nullable
  public String getDetail() {
    return detail;
  }

  public boolean hasDetail() {
    return detail != null;
  }

  public void setDetail(String detail) {
    this.detail = detail;
  }

  public HTTPLogError status(String status) {
    this.status = status;
    return this;
  }

  /** Error code. */
  @Nullable
  public String getStatus() {
    return status;
  }

  public boolean hasStatus() {
    return status != null;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public HTTPLogError title(String title) {
    this.title = title;
    return this;
  }

  /** Error title. */
  @Nullable
  public String getTitle() {
    return title;
  }

  public boolean hasTitle() {
    return title != null;
  }

  public void setTitle(String title) {
    this.title = title;
  }
}
