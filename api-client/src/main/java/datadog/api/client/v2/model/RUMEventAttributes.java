package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** JSON object containing all event attributes and their associated values. */
public class RUMEventAttributes extends AbstractModel {
  @Json(name = "attributes")
  private Map<String, Object> attributes;

  @Json(name = "service")
  private String service;

  @Json(name = "tags")
  private List<String> tags;

  @Json(name = "timestamp")
  private OffsetDateTime timestamp;

  public RUMEventAttributes() {}

  public RUMEventAttributes attributes(Map<String, Object> attributes) {
    this.attributes = attributes;
    return this;
  }

  public RUMEventAttributes putAttributeItem(String key, Object attributeItem) {
    if (this.attributes == null) {
      this.attributes = new LinkedHashMap<>();
    }
    this.attributes.put(key, attributeItem);
    return this;
  }

  /** JSON object of attributes from RUM events. */
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

  public RUMEventAttributes service(String service) {
    this.service = service;
    return this;
  }

  /** The name of the application or service generating RUM events. */
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

  public RUMEventAttributes tags(List<String> tags) {
    this.tags = tags;
    return this;
  }

  public RUMEventAttributes addTagItem(String tagItem) {
    if (this.tags == null) {
      this.tags = new ArrayList<>();
    }
    this.tags.add(tagItem);
    return this;
  }

  /** Array of tags associated with your event. */
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

  public RUMEventAttributes timestamp(OffsetDateTime timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  /** Timestamp of your event. */
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
