package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** The object containing all signal attributes and their associated values. */
public class SecurityMonitoringSignalAttributes extends AbstractModel {
  @Json(name = "custom")
  private Map<String, Object> custom;

  @Json(name = "message")
  private String message;

  @Json(name = "tags")
  private List<String> tags;

  @Json(name = "timestamp")
  private OffsetDateTime timestamp;

  public SecurityMonitoringSignalAttributes() {}

  public SecurityMonitoringSignalAttributes custom(Map<String, Object> custom) {
    this.custom = custom;
    return this;
  }

  public SecurityMonitoringSignalAttributes putCustomItem(String key, Object customItem) {
    if (this.custom == null) {
      this.custom = new LinkedHashMap<>();
    }
    this.custom.put(key, customItem);
    return this;
  }

  /** A JSON object of attributes in the security signal. */
  @Nullable
  public Map<String, Object> getCustom() {
    return custom;
  }

  public boolean hasCustom() {
    return custom != null;
  }

  public void setCustom(Map<String, Object> custom) {
    this.custom = custom;
  }

  public SecurityMonitoringSignalAttributes message(String message) {
    this.message = message;
    return this;
  }

  /** The message in the security signal defined by the rule that generated the signal. */
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

  public SecurityMonitoringSignalAttributes tags(List<String> tags) {
    this.tags = tags;
    return this;
  }

  public SecurityMonitoringSignalAttributes addTagItem(String tagItem) {
    if (this.tags == null) {
      this.tags = new ArrayList<>();
    }
    this.tags.add(tagItem);
    return this;
  }

  /** An array of tags associated with the security signal. */
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

  public SecurityMonitoringSignalAttributes timestamp(OffsetDateTime timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  /** The timestamp of the security signal. */
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
