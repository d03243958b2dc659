package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;

/** The response returned after all triage operations, containing the updated signal triage data. */
public class SecurityMonitoringSignalTriageUpdateResponse extends AbstractModel {
  @RequiredProperty
  @Json(name = "data")
  private SecurityMonitoringSignalTriageUpdateData data;

  public SecurityMonitoringSignalTriageUpdateResponse() {}

  public SecurityMonitoringSignalTriageUpdateResponse(
      SecurityMonitoringSignalTriageUpdateData data) {
    this.data = data;
  }

  public SecurityMonitoringSignalTriageUpdateResponse data(
      SecurityMonitoringSignalTriageUpdateData data) {
    this.data = data;
    return this;
  }

  public SecurityMonitoringSignalTriageUpdateData getData() {
    return data;
  }

  public void setData(SecurityMonitoringSignalTriageUpdateData data) {
    this.data = data;
  }
}
