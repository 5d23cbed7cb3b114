package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Map;

/** The fields of a discovered database instance that selectors look at. */
@Schema
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Instance {

  @Schema(example = "7f1d2c0e-2b8e-4b51-9d0c-1a2b3c4d5e6f")
  @JsonProperty(value = "id")
  private String id;

  @Schema(example = "prod-db-1")
  @JsonProperty(value = "name")
  private String name;

  @Schema(example = "aws_123456789012_us-east-1")
  @JsonProperty(value = "provider")
  private String provider;

  @Schema(example = "us-east-1")
  @JsonProperty(value = "region")
  private String region;

  @Schema(example = "postgres")
  @JsonProperty(value = "engine")
  private String engine;

  @Schema
  @JsonProperty(value = "tags")
  private Map<String, String> tags;

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getProvider() {
    return provider;
  }

  public void setProvider(String provider) {
    this.provider = provider;
  }

  public String getRegion() {
    return region;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  public String getEngine() {
    return engine;
  }

  public void setEngine(String engine) {
    this.engine = engine;
  }

  public Map<String, String> getTags() {
    return tags;
  }

  public void setTags(Map<String, String> tags) {
    this.tags = tags;
  }

  @Override
  public String toString() {
    return "Instance [id="
        + id
        + ", name="
        + name
        + ", provider="
        + provider
        + ", region="
        + region
        + ", engine="
        + engine
        + ", tags="
        + tags
        + "]";
  }
}
