package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Meta attributes. */
public class SecurityMonitoringSignalsListResponseMeta extends AbstractModel {
  @Json(name = "page")
  private SecurityMonitoringSignalsListResponseMetaPage page;

  public SecurityMonitoringSignalsListResponseMeta() {}

  public SecurityMonitoringSignalsListResponseMeta page(
      SecurityMonitoringSignalsListResponseMetaPage page) {
    this.page = page;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalsListResponseMetaPage getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(SecurityMonitoringSignalsListResponseMetaPage page) {
    this.page = page;
  }
}
