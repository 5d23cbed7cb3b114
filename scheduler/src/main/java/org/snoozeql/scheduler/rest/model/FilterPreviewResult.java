package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema
public class FilterPreviewResult {

  @JsonProperty(value = "matched_count")
  private Integer matchedCount;

  @JsonProperty(value = "total_count")
  private Integer totalCount;

  @JsonProperty(value = "instances")
  private List<Instance> instances;

  public FilterPreviewResult() {}

  public FilterPreviewResult(List<Instance> instances, Integer totalCount) {
    this.instances = instances;
    this.matchedCount = instances.size();
    this.totalCount = totalCount;
  }

  public Integer getMatchedCount() {
    return matchedCount;
  }

  public void setMatchedCount(Integer matchedCount) {
    this.matchedCount = matchedCount;
  }

  public Integer getTotalCount() {
    return totalCount;
  }

  public void setTotalCount(Integer totalCount) {
    this.totalCount = totalCount;
  }

  public List<Instance> getInstances() {
    return instances;
  }

  public void setInstances(List<Instance> instances) {
    this.instances = instances;
  }
}
