package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/** Rule. */
public class SecurityMonitoringSignalRuleResponse extends AbstractModel {
  @Json(name = "cases")
  private List<SecurityMonitoringRuleCase> cases;

  @Json(name = "createdAt")
  private Long createdAt;

  @Json(name = "creationAuthorId")
  private Long creationAuthorId;

  @Json(name = "deprecationDate")
  private Long deprecationDate;

  @Json(name = "hasExtendedTitle")
  private Boolean hasExtendedTitle;

  @Json(name = "id")
  private String id;

  @Json(name = "isDefault")
  private Boolean isDefault;

  @Json(name = "isDeleted")
  private Boolean isDeleted;

  @Json(name = "isEnabled")
  private Boolean isEnabled;

  @Json(name = "message")
  private String message;

  @Json(name = "name")
  private String name;

  @Json(name = "queries")
  private List<SecurityMonitoringSignalRuleResponseQuery> queries;

  @Json(name = "tags")
  private List<String> tags;

  @Json(name = "type")
  private SecurityMonitoringSignalRuleType type;

  @Json(name = "updateAuthorId")
  private Long updateAuthorId;

  @Json(name = "version")
  private Long version;

  public SecurityMonitoringSignalRuleResponse() {}

  public SecurityMonitoringSignalRuleResponse cases(List<SecurityMonitoringRuleCase> cases) {
    this.cases = cases;
    return this;
  }

  public SecurityMonitoringSignalRuleResponse addCaseItem(SecurityMonitoringRuleCase caseItem) {
    if (this.cases == null) {
      this.cases = new ArrayList<>();
    }
    this.cases.add(caseItem);
    return this;
  }

  /** Cases for generating signals. */
  @Nullable
  public List<SecurityMonitoringRuleCase> getCases() {
    return cases;
  }

  public boolean hasCases() {
    return cases != null;
  }

  public void setCases(List<SecurityMonitoringRuleCase> cases) {
    this.cases = cases;
  }

  public SecurityMonitoringSignalRuleResponse createdAt(Long createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  /** When the rule was created, timestamp in milliseconds. */
  @Nullable
  public Long getCreatedAt() {
    return createdAt;
  }

  public boolean hasCreatedAt() {
    return createdAt != null;
  }

  public void setCreatedAt(Long createdAt) {
    this.createdAt = createdAt;
  }

  public SecurityMonitoringSignalRuleResponse creationAuthorId(Long creationAuthorId) {
    this.creationAuthorId = creationAuthorId;
    return this;
  }

  /** User ID of the user who created the rule. */
  @Nullable
  public Long getCreationAuthorId() {
    return creationAuthorId;
  }

  public boolean hasCreationAuthorId() {
    return creationAuthorId != null;
  }

  public void setCreationAuthorId(Long creationAuthorId) {
    this.creationAuthorId = creationAuthorId;
  }

  public SecurityMonitoringSignalRuleResponse deprecationDate(Long deprecationDate) {
    this.deprecationDate = deprecationDate;
    return this;
  }

  /** When the rule will be deprecated, timestamp in milliseconds. */
  @Nullable
  public Long getDeprecationDate() {
    return deprecationDate;
  }

  public boolean hasDeprecationDate() {
    return deprecationDate != null;
  }

  public void setDeprecationDate(Long deprecationDate) {
    this.deprecationDate = deprecationDate;
  }

  public SecurityMonitoringSignalRuleResponse hasExtendedTitle(Boolean hasExtendedTitle) {
    this.hasExtendedTitle = hasExtendedTitle;
    return this;
  }

  /** Whether the notifications include the triggering group-by values in their title. */
  @Nullable
  public Boolean getHasExtendedTitle() {
    return hasExtendedTitle;
  }

  public boolean hasHasExtendedTitle() {
    return hasExtendedTitle != null;
  }

  public void setHasExtendedTitle(Boolean hasExtendedTitle) {
    this.hasExtendedTitle = hasExtendedTitle;
  }

  public SecurityMonitoringSignalRuleResponse id(String id) {
    this.id = id;
    return this;
  }

  /** The ID of the rule. */
  @Nullable
  public String getId() {
    return id;
  }

  public boolean hasId() {
    return id != null;
  }

  public void setId(String id) {
    this.id = id;
  }

  public SecurityMonitoringSignalRuleResponse isDefault(Boolean isDefault) {
    this.isDefault = isDefault;
    return this;
  }

  /** Whether the rule is included by default. */
  @Nullable
  public Boolean getIsDefault() {
    return isDefault;
  }

  public boolean hasIsDefault() {
    return isDefault != null;
  }

  public void setIsDefault(Boolean isDefault) {
    this.isDefault = isDefault;
  }

  public SecurityMonitoringSignalRuleResponse isDeleted(Boolean isDeleted) {
    this.isDeleted = isDeleted;
    return this;
  }

  /** Whether the rule has been deleted. */
  @Nullable
  public Boolean getIsDeleted() {
    return isDeleted;
  }

  public boolean hasIsDeleted() {
    return isDeleted != null;
  }

  public void setIsDeleted(Boolean isDeleted) {
    this.isDeleted = isDeleted;
  }

  public SecurityMonitoringSignalRuleResponse isEnabled(Boolean isEnabled) {
    this.isEnabled = isEnabled;
    return this;
  }

  /** Whether the rule is enabled. */
  @Nullable
  public Boolean getIsEnabled() {
    return isEnabled;
  }

  public boolean hasIsEnabled() {
    return isEnabled != null;
  }

  public void setIsEnabled(Boolean isEnabled) {
    this.isEnabled = isEnabled;
  }

  public SecurityMonitoringSignalRuleResponse message(String message) {
    this.message = message;
    return this;
  }

  /** Message for generated signals. */
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

  public SecurityMonitoringSignalRuleResponse name(String name) {
    this.name = name;
    return this;
  }

  /** The name of the rule. */
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

  public SecurityMonitoringSignalRuleResponse queries(
      List<SecurityMonitoringSignalRuleResponseQuery> queries) {
    this.queries = queries;
    return this;
  }

  public SecurityMonitoringSignalRuleResponse addQueryItem(
      SecurityMonitoringSignalRuleResponseQuery queryItem) {
    if (this.queries == null) {
      this.queries = new ArrayList<>();
    }
    this.queries.add(queryItem);
    return this;
  }

  /** Queries for selecting logs which are part of the rule. */
  @Nullable
  public List<SecurityMonitoringSignalRuleResponseQuery> getQueries() {
    return queries;
  }

  public boolean hasQueries() {
    return queries != null;
  }

  public void setQueries(List<SecurityMonitoringSignalRuleResponseQuery> queries) {
    this.queries = queries;
  }

  public SecurityMonitoringSignalRuleResponse tags(List<String> tags) {
    this.tags = tags;
    return this;
  }

  public SecurityMonitoringSignalRuleResponse addTagItem(String tagItem) {
    if (this.tags == null) {
      this.tags = new ArrayList<>();
    }
    this.tags.add(tagItem);
    return this;
  }

  /** Tags for generated signals. */
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

  public SecurityMonitoringSignalRuleResponse type(SecurityMonitoringSignalRuleType type) {
    this.type = type;
    return this;
  }

  @Nullable
  public SecurityMonitoringSignalRuleType getType() {
    return type;
  }

  public boolean hasType() {
    return type != null;
  }

  public void setType(SecurityMonitoringSignalRuleType type) {
    this.type = type;
  }

  public SecurityMonitoringSignalRuleResponse updateAuthorId(Long updateAuthorId) {
    this.updateAuthorId = updateAuthorId;
    return this;
  }

  /** User ID of the user who updated the rule. */
  @Nullable
  public Long getUpdateAuthorId() {
    return updateAuthorId;
  }

  public boolean hasUpdateAuthorId() {
    return updateAuthorId != null;
  }

  public void setUpdateAuthorId(Long updateAuthorId) {
    this.updateAuthorId = updateAuthorId;
  }

  public SecurityMonitoringSignalRuleResponse version(Long version) {
    this.version = version;
    return this;
  }

  /** The version of the rule. */
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
