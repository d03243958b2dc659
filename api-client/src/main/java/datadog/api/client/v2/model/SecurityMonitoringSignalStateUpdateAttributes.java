package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import javax.annotation.Nullable;

/** Attributes describing the change of state of a security signal. */
public class SecurityMonitoringSignalStateUpdateAttributes extends AbstractModel {
  @Json(name = "archive_comment")
  private String archiveComment;

  @Json(name = "archive_reason")
  private SecurityMonitoringSignalArchiveReason archiveReason;

  @RequiredProperty
  @Json(name = "state")
  private SecurityMonitoringSignalState state;

  @Json(name = "version")
  private Long version;

  public SecurityMonitoringSignalStateUpdateAttributes() {}

  public SecurityMonitoringSignalStateUpdateAttributes(SecurityMonitoringSignalState state) {
    this.state = state;
  }

  public SecurityMonitoringSignalStateUpdateAttributes archiveComment(String archiveComment) {
    this.archiveComment = archiveComment;
    return this;
  }

  /** Optional comment to display on archived signals. */
  @Nullable
  public String getArchiveComment() {
    return archiveComment;
  }

  public boolean hasArchiveComment() {
    return archiveComment != null;
  }

  public void setArchiveComment(String archiveComment) {
    this.archiveComment = archiveComment;
  }

  public SecurityMonitoringSignalStateUpdateAttributes archiveReason(
      SecurityMonitoringSignalArchiveReason archiveReason) {
    this.archiveReason = archiveReason;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalArchiveReason getArchiveReason() {
    return archiveReason;
  }

  public boolean hasArchiveReason() {
    return archiveReason != null;
  }

  public void setArchiveReason(SecurityMonitoringSignalArchiveReason archiveReason) {
    this.archiveReason = archiveReason;
  }

  public SecurityMonitoringSignalStateUpdateAttributes state(SecurityMonitoringSignalState state) {
    this.state = state;
    return this;
  }

  public SecurityMonitoringSignalState getState() {
    return state;
  }

  public void setState(SecurityMonitoringSignalState state) {
    this.state = state;
  }

  public SecurityMonitoringSignalStateUpdateAttributes version(Long version) {
    this.version = version;
    return this;
  }

  /** Version of the updated signal. If server side version is higher, update will be rejected. */
  @Nullable
  public Long getVersion() {
    return version;
  }

  public boolean hasVersion() {
    return version != null;
  }

  public void setVersion(Long version) {
    this.version = version;
  }
}
