package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Security Signal response data object. */
public class SecurityMonitoringSignalResponse extends AbstractModel {
  @Json(name = "data")
  private SecurityMonitoringSignal data;

  public SecurityMonitoringSignalResponse() {}

  public SecurityMonitoringSignalResponse data(SecurityMonitoringSignal data) {
    this.data = data;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignal getData() {
    return data;
  }

  public boolean hasData() {
    return data != null;
  }

  public void setData(SecurityMonitoringSignal data) {
    this.data = data;
  }
}
