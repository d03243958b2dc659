package datadog.api.client.v2.model;

import com.squareup.moshi.Json;
import datadog.api.client.AbstractModel;
import javax.annotation.Nullable;

/** Object describing meta attributes of response. */
public class ResponseMetaAttributes extends AbstractModel {
  @Json(name = "page")
  private Pagination page;

  public ResponseMetaAttributes() {}

  public ResponseMetaAttributes page(Pagination page) {
    this.page = page;
    return this;
  }

  @Nullable
  public Pagination getPage() {
    return page;
  }

  public boolean hasPage() {
    return page != null;
  }

  public void setPage(Pagination page) {
    this.page = page;
  }
}
