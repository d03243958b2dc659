package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** JSON object containing all log attributes and their associated values. */
public class LogAttributes extends AbstractModel {
  @Json(name = "attributes")
  private Map<String, Object> attributes;

  @Json(name = "host")
  private String host;

  @Json(name = "message")
  private String message;

  @Json(name = "service")
  private String service;

  @Json(name = "status")
  private String status;

  @Json(name = "tags")
  private List<String> tags;

  @Json(name = "timestamp")
  private OffsetDateTime timestamp;

  public LogAttributes() {}

  public LogAttributes attributes(Map<String, Object> attributes) {
    this.attributes = attributes;
    return this;
  }

  public LogAttributes putAttributeItem(String key, Object attributeItem) {
    if (this.attributes == null) {
      this.attributes = new LinkedHashMap<>();
    }
    this.attributes.put(key, attributeItem);
    return this;
  }

  /** JSON object of attributes from your log. */
  @Nullable
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public boolean hasAttributes() {
    return attributes != null;
  }

  public void setAttributes(Map<String, Object> attributes) {
    this.attributes = attributes;
  }

  public LogAttributes host(String host) {
    this.host = host;
    return this;
  }

  /** Name of the machine from where the logs are being sent. */
  @Nullable
  public String getHost() {
    return host;
  }

  public boolean hasHost() {
    return host != null;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public LogAttributes message(String message) {
    this.message = message;
    return this;
  }

  /** The message reserved attribute of your log. */
  @Nullable
  public String getMessage() {
    return message;
  }

  public boolean hasMessage() {
    return message != null;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public LogAttributes service(String service) {
    this.service = service;
    return this;
  }

  /** The name of the application or service generating the log events. */
  @Nullable
  public String getService() {
    return service;
  }

  public boolean hasService() {
    return service != null;
  }

  public void setService(String service) {
    this.service = service;
  }

  public LogAttributes status(String status) {
    this.status = status;
    return this;
  }

  /** Status of the message associated with your log. */
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

  public LogAttributes tags(List<String> tags) {
    this.tags = tags;
    return this;
  }

  public LogAttributes addTagItem(String tagItem) {
    if (this.tags == null) {
      this.tags = new ArrayList<>();
    }
    this.tags.add(tagItem);
    return this;
  }

  /** Array of tags associated with your log. */
  @Nullable
  public List<String> getTags() {
    return tags;
  }

  public boolean hasTags() {
    return tags != null;
  }

  public void setTags(List<String> tags) {
    this.tags = tags;
  }

  public LogAttributes timestamp(OffsetDateTime timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  /** Timestamp of your log. */
  @Nullable
  public OffsetDateTime getTimestamp() {
    return timestamp;
  }

  public boolean hasTimestamp() {
    return timestamp != null;
  }

  public void setTimestamp(OffsetDateTime timestamp) {
    this.timestamp = timestamp;
  }
}
