package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.util.ArrayList;
import java.util.List;

/** API error response. */
public class APIErrorResponse extends AbstractModel {
  @RequiredProperty
  @Json(name = "errors")
  private List<String> errors;

  public APIErrorResponse() {}

  public APIErrorResponse(List<String> errors) {
    this.errors = errors;
  }

  public APIErrorResponse errors(List<String> errors) {
    this.errors = errors;
    return this;
  }

  public APIErrorResponse addErrorItem(String errorItem) {
    if (this.errors == null) {
      this.errors = new ArrayList<>();
    }
    this.errors.add(errorItem);
    return this;
  }

  /** A list of errors. */
  public List<String> getErrors() {
    return errors;
  }

  public void setErrors(List<String> errors) {
    this.errors = errors;
  }
}
