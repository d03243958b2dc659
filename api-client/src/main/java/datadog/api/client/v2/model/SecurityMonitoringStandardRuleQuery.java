package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Query for matching rule. */
public class SecurityMonitoringStandardRuleQuery extends AbstractModel {
  @Json(name = "aggregation")
  private SecurityMonitoringRuleQueryAggregation aggregation;

  @Json(name = "distinctFields")
  private List<String> distinctFields;

  @Json(name = "groupByFields")
  private List<String> groupByFields;

  @Json(name = "metric")
  private String metric;

  @Json(name = "metrics")
  private List<String> metrics;

  @Json(name = "name")
  private String name;

  @RequiredProperty
  @Json(name = "query")
  private String query;

  public SecurityMonitoringStandardRuleQuery() {}

  public SecurityMonitoringStandardRuleQuery(String query) {
    this.query = query;
  }

  public SecurityMonitoringStandardRuleQuery aggregation(
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

  public SecurityMonitoringStandardRuleQuery distinctFields(List<String> distinctFields) {
    this.distinctFields = distinctFields;
    return this;
  }

  public SecurityMonitoringStandardRuleQuery addDistinctFieldItem(String distinctFieldItem) {
    if (this.distinctFields == null) {
      this.distinctFields = new ArrayList<>();
    }
    this.distinctFields.add(distinctFieldItem);
    return this;
  }

  /** Field for which the cardinality is measured. Sent as an array. */
  @Nullable
  public List<String> getDistinctFields() {
    return distinctFields;
  }

  public boolean hasDistinctFields() {
    return distinctFields != null;
  }

  public void setDistinctFields(List<String> distinctFields) {
    this.distinctFields = distinctFields;
  }

  public SecurityMonitoringStandardRuleQuery groupByFields(List<String> groupByFields) {
    this.groupByFields = groupByFields;
    return this;
  }

  public SecurityMonitoringStandardRuleQuery addGroupByFieldItem(String groupByFieldItem) {
    if (this.groupByFields == null) {
      this.groupByFields = new ArrayList<>();
    }
    this.groupByFields.add(groupByFieldItem);
    return this;
  }

  /** Fields to group by. */
  @Nullable
  public List<String> getGroupByFields() {
    return groupByFields;
  }

  public boolean hasGroupByFields() {
    return groupByFields != null;
  }

  public void setGroupByFields(List<String> groupByFields) {
    this.groupByFields = groupByFields;
  }

  public SecurityMonitoringStandardRuleQuery metric(String metric) {
    this.metric = metric;
    return this;
  }

  /** Deprecated, use `metrics` instead. */
  @Nullable
  public String getMetric() {
    return metric;
  }

  public boolean hasMetric() {
    return metric != null;
  }

  public void setMetric(String metric) {
    this.metric = metric;
  }

  public SecurityMonitoringStandardRuleQuery metrics(List<String> metrics) {
    this.metrics = metrics;
    return this;
  }

  public SecurityMonitoringStandardRuleQuery addMetricItem(String metricItem) {
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

  public SecurityMonitoringStandardRuleQuery name(String name) {
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

  public SecurityMonitoringStandardRuleQuery query(String query) {
    this.query = query;
    return this;
  }

  /** Query to run on logs. */
  public String getQuery() {
    return query;
  }

  public void setQuery(String query) {
    this.query = query;
  }
}
