package datadog.api.client.v2.model;

import datadog.api.client.AbstractOpenApiSchema;
import datadog.api.client.OneOf;

/** Create a new rule. */
@OneOf({SecurityMonitoringStandardRuleResponse.class, SecurityMonitoringSignalRuleResponse.class})
public class SecurityMonitoringRuleResponse extends AbstractOpenApiSchema {

  public SecurityMonitoringRuleResponse() {}

  public SecurityMonitoringRuleResponse(SecurityMonitoringStandardRuleResponse o) {
    setActualInstance(o);
  }

  public SecurityMonitoringRuleResponse(SecurityMonitoringSignalRuleResponse o) {
    setActualInstance(o);
  }

  public boolean isSecurityMonitoringStandardRuleResponse() {
    return getActualInstance() instanceof SecurityMonitoringStandardRuleResponse;
  }

  public boolean isSecurityMonitoringSignalRuleResponse() {
    return getActualInstance() instanceof SecurityMonitoringSignalRuleResponse;
  }

  /**
   * @throws ClassCastException if the actual instance is not a {@link
   *     SecurityMonitoringStandardRuleResponse}
   */
  public SecurityMonitoringStandardRuleResponse getSecurityMonitoringStandardRuleResponse() {
    return getActualInstance(SecurityMonitoringStandardRuleResponse.class);
  }

  /**
   * @throws ClassCastException if the actual instance is not a {@link
   *     SecurityMonitoringSignalRuleResponse}
   */
  public SecurityMonitoringSignalRuleResponse getSecurityMonitoringSignalRuleResponse() {
    return getActualInstance(SecurityMonitoringSignalRuleResponse.class);
  }
}
