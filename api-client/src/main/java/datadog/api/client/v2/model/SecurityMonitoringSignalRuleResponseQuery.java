package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Query for matching rule on signals. */
public class SecurityMonitoringSignalRuleResponseQuery extends AbstractModel {
  @Json(name = "aggregation")
  private SecurityMonitoringRuleQueryAggregation aggregation;

  @Json(name = "correlatedByFields")
  private List<String> correlatedByFields;

  @Json(name = "correlatedQueryIndex")
  private Integer correlatedQueryIndex;

  @Json(name = "defaultRuleId")
  private String defaultRuleId;

  @Json(name = "metrics")
  private List<String> metrics;

  @Json(name = "name")
  private String name;

  @Json(name = "ruleId")
  private String ruleId;

  public SecurityMonitoringSignalRuleResponseQuery() {}

  public SecurityMonitoringSignalRuleResponseQuery aggregation(
      SecurityMonitoringRuleQueryAggregation aggregation) {
    this.aggregation = aggregation;
    return this;
  }

  @Nullable
  public SecurityMonitoringRuleQueryAggregation getAggregation() {
    return aggregation;
  }

  public boolean hasAggregation() {
    return aggregation != null;
  }

  public void setAggregation(SecurityMonitoringRuleQueryAggregation aggregation) {
    this.aggregation = aggregation;
  }

  public SecurityMonitoringSignalRuleResponseQuery correlatedByFields(
      List<String> correlatedByFields) {
    this.correlatedByFields = correlatedByFields;
    return this;
  }

  public SecurityMonitoringSignalRuleResponseQuery addCorrelatedByFieldItem(
      String correlatedByFieldItem) {
    if (this.correlatedByFields == null) {
      this.correlatedByFields = new ArrayList<>();
    }
    this.correlatedByFields.add(correlatedByFieldItem);
    return this;
  }

  /** Fields to correlate by. */
  @Nullable
  public List<String> getCorrelatedByFields() {
    return correlatedByFields;
  }

  public boolean hasCorrelatedByFields() {
    return correlatedByFields != null;
  }

  public void setCorrelatedByFields(List<String> correlatedByFields) {
    this.correlatedByFields = correlatedByFields;
  }

  public SecurityMonitoringSignalRuleResponseQuery correlatedQueryIndex(
      Integer correlatedQueryIndex) {
    this.correlatedQueryIndex = correlatedQueryIndex;
    return this;
  }

  /** Index of the rule query used to retrieve the correlated field. */
  @Nullable
  public Integer getCorrelatedQueryIndex() {
    return correlatedQueryIndex;
  }

  public boolean hasCorrelatedQueryIndex() {
    return correlatedQueryIndex != null;
  }

  public void setCorrelatedQueryIndex(Integer correlatedQueryIndex) {
    this.correlatedQueryIndex = correlatedQueryIndex;
  }

  public SecurityMonitoringSignalRuleResponseQuery defaultRuleId(String defaultRuleId) {
    this.defaultRuleId = defaultRuleId;
    return this;
  }

  /** Default Rule ID to match on signals. */
  @Nullable
  public String getDefaultRuleId() {
    return defaultRuleId;
  }

  public boolean hasDefaultRuleId() {
    return defaultRuleId != null;
  }

  public void setDefaultRuleId(String defaultRuleId) {
    this.defaultRuleId = defaultRuleId;
  }

  public SecurityMonitoringSignalRuleResponseQuery metrics(List<String> metrics) {
    this.metrics = metrics;
    return this;
  }

  public SecurityMonitoringSignalRuleResponseQuery addMetricItem(String metricItem) {
    if (this.metrics == null) {
      this.metrics = new ArrayList<>();
    }
    this.metrics.add(metricItem);
    return this;
  }

  /** Group of target fields to aggregate over. */
  @Nullable
  public List<String> getMetrics() {
    return metrics;
  }

  public boolean hasMetrics() {
    return metrics != null;
  }

  public void setMetrics(List<String> metrics) {
    this.metrics = metrics;
  }

  public SecurityMonitoringSignalRuleResponseQuery name(String name) {
    this.name = name;
    return this;
  }

  /** Name of the query. */
  @Nullable
  public String getName() {
    return name;
  }

  public boolean hasName() {
    return name != null;
  }

  public void setName(String name) {
    this.name = name;
  }

  public SecurityMonitoringSignalRuleResponseQuery ruleId(String ruleId) {
    this.ruleId = ruleId;
    return this;
  }

  /** Rule ID to match on signals. */
  @Nullable
  public String getRuleId() {
    return ruleId;
  }

  public boolean hasRuleId() {
    return ruleId != null;
  }

  public void setRuleId(String ruleId) {
    this.ruleId = ruleId;
  }
}
