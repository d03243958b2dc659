package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;

/** Request body for changing the state of a given security monitoring signal. */
public class SecurityMonitoringSignalStateUpdateRequest extends AbstractModel {
  @RequiredProperty
  @Json(name = "data")
  private SecurityMonitoringSignalStateUpdateData data;

  public SecurityMonitoringSignalStateUpdateRequest() {}

  public SecurityMonitoringSignalStateUpdateRequest(SecurityMonitoringSignalStateUpdateData data) {
    this.data = data;
  }

  public SecurityMonitoringSignalStateUpdateRequest data(
      SecurityMonitoringSignalStateUpdateData data) {
    this.data = data;
    return this;
  }

  public SecurityMonitoringSignalStateUpdateData getData() {
    return data;
  }

  public void setData(SecurityMonitoringSignalStateUpdateData data) {
    this.data = data;
  }
}
