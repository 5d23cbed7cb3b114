package org.snoozeql.scheduler.rest.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.LinkedHashMap;
import java.util.Map;
import org.snoozeql.scheduler.util.ProviderEnum;

/**
 * A conjunctive rule choosing the instances a schedule applies to. Every populated field must
 * match.
 */
@Schema
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Selector {

  @Schema
  @JsonProperty(value = "name")
  private Matcher name;

  @Schema(example = "aws")
  @JsonProperty(value = "provider")
  private ProviderEnum provider;

  @Schema
  @JsonProperty(value = "region")
  private Matcher region;

  @Schema
  @JsonProperty(value = "engine")
  private Matcher engine;

  @Schema(description = "Tag key to matcher; the instance must carry every listed tag")
  @JsonProperty(value = "tags")
  private Map<String, Matcher> tags;

  public Matcher getName() {
    return name;
  }

  public void setName(Matcher name) {
    this.name = name;
  }

  public ProviderEnum getProvider() {
    return provider;
  }

  public void setProvider(ProviderEnum provider) {
    this.provider = provider;
  }

  public Matcher getRegion() {
    return region;
  }

  public void setRegion(Matcher region) {
    this.region = region;
  }

  public Matcher getEngine() {
    return engine;
  }

  public void setEngine(Matcher engine) {
    this.engine = engine;
  }

  public Map<String, Matcher> getTags() {
    return tags;
  }

  public void setTags(Map<String, Matcher> tags) {
    this.tags = tags == null ? null : new LinkedHashMap<>(tags);
  }

  @Override
  public String toString() {
    return "Selector [name="
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
