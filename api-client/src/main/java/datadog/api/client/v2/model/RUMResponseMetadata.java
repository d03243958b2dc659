package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** The metadata associated with a request. */
public class RUMResponseMetadata extends AbstractModel {
  @Json(name = "elapsed")
  private Long elapsed;

  @Json(name = "page")
  private RUMResponsePage page;

  @Json(name = "request_id")
  private String requestId;

  @Json(name = "status")
  private RUMResponseStatus status;

  @Json(name = "warnings")
  private List<RUMWarning> warnings;

  public RUMResponseMetadata() {}

  public RUMResponseMetadata elapsed(Long elapsed) {
    this.elapsed = elapsed;
    return this;
  }

  /** The time elapsed in milliseconds. */
  @Nullable
  public Long getElapsed() {
    return elapsed;
  }

  public boolean hasElapsed() {
    return elapsed != null;
  }

  public void setElapsed(Long elapsed) {
    this.elapsed = elapsed;
  }

  public RUMResponseMetadata page(RUMResponsePage page) {
    this.page = page;
    return this;
  }

  @Nullable
  public RUMResponsePage getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(RUMResponsePage page) {
    this.page = page;
  }

  public RUMResponseMetadata requestId(String requestId) {
    this.requestId = requestId;
    return this;
  }

  /** The identifier of the request. */
  @Nullable
  public String getRequestId() {
    return requestId;
  }

  public boolean hasRequestId() {
    return requestId != null;
  }

  public void setRequestId(String requestId) {
    this.requestId = requestId;
  }

  public RUMResponseMetadata status(RUMResponseStatus status) {
    this.status = status;
    return this;
  }

  @Nullable
  public RUMResponseStatus getStatus() {
    return status;
  }

  public boolean hasStatus() {
    return status != null;
  }

  public void setStatus(RUMResponseStatus status) {
    this.status = status;
  }

  public RUMResponseMetadata warnings(List<RUMWarning> warnings) {
    this.warnings = warnings;
    return this;
  }

  public RUMResponseMetadata addWarningItem(RUMWarning warningItem) {
    if (this.warnings == null) {
      this.warnings = new ArrayList<>();
    }
    this.warnings.add(warningItem);
    return this;
  }

  /**
   * A list of warnings (non-fatal errors) encountered. Partial results may return if warnings are
   * present in the response.
   */
  @Nullable
  public List<RUMWarning> getWarnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return warnings != null;
  }

  public void setWarnings(List<RUMWarning> warnings) {
    this.warnings = warnings;
  }
}
