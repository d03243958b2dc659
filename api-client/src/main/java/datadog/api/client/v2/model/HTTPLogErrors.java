package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Invalid query performed. */
public class HTTPLogErrors extends AbstractModel {
  @Json(name = "errors")
  private List<HTTPLogError> errors;

  public HTTPLogErrors() {}

  public HTTPLogErrors errors(List<HTTPLogError> errors) {
    this.errors = errors;
    return this;
  }

  public HTTPLogErrors addErrorItem(HTTPLogError errorItem) {
    if (this.errors == null) {
      this.errors = new ArrayList<>();
    }
    this.errors.add(errorItem);
    return this;
  }

  /** Structured errors. */
  @Nullable
  public List<HTTPLogError> getErrors() {
    return errors;
  }

  public boolean hasErrors() {
    return errors != null;
  }

  public void setErrors(List<HTTPLogError> errors) {
    this.errors = errors;
  }
}
