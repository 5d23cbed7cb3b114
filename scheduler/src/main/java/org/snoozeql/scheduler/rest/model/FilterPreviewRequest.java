package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema
public class FilterPreviewRequest {

  @Schema(required = true)
  @JsonProperty(value = "selectors")
  private List<Selector> selectors;

  @Schema(description = "\"and\" or \"or\", defaults to \"and\"", example = "and")
  @JsonProperty(value = "operator")
  private String operator;

  @Schema(required = true, description = "The instances to filter")
  @JsonProperty(value = "instances")
  private List<Instance> instances;

  public List<Selector> getSelectors() {
    return selectors;
  }

  public void setSelectors(List<Selector> selectors) {
    this.selectors = selectors;
  }

  public String getOperator() {
    return operator;
  }

  public void setOperator(String operator) {
    this.operator = operator;
  }

  public List<Instance> getInstances() {
    return instances;
  }

  public void setInstances(List<Instance> instances) {
    this.instances = instances;
  }

  @Override
  public String toString() {
    return "FilterPreviewRequest [selectors="
        + selectors
        + ", operator="
        + operator
        + ", instances="
        + instances
        + "]";
  }
}
