package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** The metadata associated with a request */
public class LogsResponseMetadata extends AbstractModel {
  @Json(name = "elapsed")
  private Long elapsed;

  @Json(name = "page")
  private LogsResponseMetadataPage page;

  @Json(name = "request_id")
  private String requestId;

  @Json(name = "status")
  private LogsAggregateResponseStatus status;

  @Json(name = "warnings")
  private List<LogsWarning> warnings;

  public LogsResponseMetadata() {}

  public LogsResponseMetadata elapsed(Long elapsed) {
    this.elapsed = elapsed;
    return this;
  }

  /** The time elapsed in milliseconds */
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

  public LogsResponseMetadata page(LogsResponseMetadataPage page) {
    this.page = page;
    return this;
  }

  @Nullable
  public LogsResponseMetadataPage getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(LogsResponseMetadataPage page) {
    this.page = page;
  }

  public LogsResponseMetadata requestId(String requestId) {
    this.requestId = requestId;
    return this;
  }

  /** The identifier of the request */
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

  public LogsResponseMetadata status(LogsAggregateResponseStatus status) {
    this.status = status;
    return this;
  }

  @Nullable
  public LogsAggregateResponseStatus getStatus() {
    return status;
  }

  public boolean hasStatus() {
    return status != null;
  }

  public void setStatus(LogsAggregateResponseStatus status) {
    this.status = status;
  }

  public LogsResponseMetadata warnings(List<LogsWarning> warnings) {
    this.warnings = warnings;
    return this;
  }

  public LogsResponseMetadata addWarningItem(LogsWarning warningItem) {
    if (this.warnings == null) {
      this.warnings = new ArrayList<>();
    }
    this.warnings.add(warningItem);
    return this;
  }

  /**
   * A list of warnings (non fatal errors) encountered, partial results might be returned if
   * warnings are present in the response.
   */
  @Nullable
  public List<LogsWarning> getWarnings() {
    return warnings;
  }

  public boolean hasWarnings() {
    return warnings != null;
  }

  public void setWarnings(List<LogsWarning> warnings) {
    this.warnings = warnings;
  }
}
