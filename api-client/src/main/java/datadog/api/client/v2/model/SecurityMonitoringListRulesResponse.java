package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** List of rules. */
public class SecurityMonitoringListRulesResponse extends AbstractModel {
  @Json(name = "data")
  private List<SecurityMonitoringRuleResponse> data;

  @Json(name = "meta")
  private ResponseMetaAttributes meta;

  public SecurityMonitoringListRulesResponse() {}

  public SecurityMonitoringListRulesResponse data(List<SecurityMonitoringRuleResponse> data) {
    this.data = data;
    return this;
  }

  public SecurityMonitoringListRulesResponse addDataItem(SecurityMonitoringRuleResponse dataItem) {
    if (this.data == null) {
      this.data = new ArrayList<>();
    }
    this.data.add(dataItem);
    return this;
  }

  /** Array containing the list of rules. */
  @Nullable
  public List<SecurityMonitoringRuleResponse> getData() {
    return data;
  }

  public boolean hasData() {
    return data != null;
  }

  public void setData(List<SecurityMonitoringRuleResponse> data) {
    this.data = data;
  }

  public SecurityMonitoringListRulesResponse meta(ResponseMetaAttributes meta) {
    this.meta = meta;
    return this;
  }

  @Nullable
  public ResponseMetaAttributes getMeta() {
    return meta;
  }

  public boolean hasMeta() {
    return meta != null;
  }

  public void setMeta(ResponseMetaAttributes meta) {
    this.meta = meta;
  }
}
