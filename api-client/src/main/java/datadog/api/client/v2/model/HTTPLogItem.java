package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import datadog.api.client.RequiredProperty;
import javax.annotation.Nullable;

/** Logs that are sent over HTTP. */
public class HTTPLogItem extends AbstractModel {
  @Json(name = "ddsource")
  private String ddsource;

  @Json(name = "ddtags")
  private String ddtags;

  @Json(name = "hostname")
  private String hostname;

  @RequiredProperty
  @Json(name = "message")
  private String message;

  @Json(name = "service")
  private String service;

  public HTTPLogItem() {}

  public HTTPLogItem(String message) {
    this.message = message;
  }

  public HTTPLogItem ddsource(String ddsource) {
    this.ddsource = ddsource;
    return this;
  }

  /**
   * The integration name associated with your log: the technology from which the log originated.
   */
  @Nullable
  public String getDdsource() {
    return ddsource;
  }

  public boolean hasDdsource() {
    return ddsource != null;
  }

  public void setDdsource(String ddsource) {
    this.ddsource = ddsource;
  }

  public HTTPLogItem ddtags(String ddtags) {
    this.ddtags = ddtags;
    return this;
  }

  /** Tags associated with your logs. */
  @Nullable
  public String getDdtags() {
    return ddtags;
  }

  public boolean hasDdtags() {
    return ddtags != null;
  }

  public void setDdtags(String ddtags) {
    this.ddtags = ddtags;
  }

  public HTTPLogItem hostname(String hostname) {
    this.hostname = hostname;
    return this;
  }

  /** The name of the originating host of the log. */
  @Nullable
  public String getHostname() {
    return hostname;
  }

  public boolean hasHostname() {
    return hostname != null;
  }

  public void setHostname(String hostname) {
    this.hostname = hostname;
  }

  public HTTPLogItem message(String message) {
    this.message = message;
    return this;
  }

  /** The message reserved attribute of your log. */
  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public HTTPLogItem service(String service) {
    this.service = service;
    return this;
  }

  /** The name of the application or service generating the log events. */
  @Nullable
  public String getService() {
    return service;
  }

  public boolean hasService() {
    return service != null;
  }

  public void setService(String service) {
    this.service = service;
  }
}
