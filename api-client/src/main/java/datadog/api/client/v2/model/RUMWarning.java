package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** A warning message indicating something that went wrong with the query. */
public class RUMWarning extends AbstractModel {
  @Json(name = "code")
  private String code;

  @Json(name = "detail")
  private String detail;

  @Json(name = "title")
  private String title;

  public RUMWarning() {}

  public RUMWarning code(String code) {
    this.code = code;
    return this;
  }

  /** A unique code for this type of warning. */
  @Nullable
  public String getCode() {
    return code;
  }

  public boolean hasCode() {
    return code != null;
  }

  public void setCode(String code) {
    this.code = code;
  }

  public RUMWarning detail(String detail) {
    this.detail = detail;
    return this;
  }

  /** A detailed explanation of this specific warning. */
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

  public RUMWarning title(String title) {
    this.title = title;
    return this;
  }

  /** A short human-readable summary of the warning. */
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
