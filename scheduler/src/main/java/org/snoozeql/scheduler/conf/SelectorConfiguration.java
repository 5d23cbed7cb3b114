package org.snoozeql.scheduler.conf;

import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@ConfigurationProperties(prefix = "scheduler.selector")
@Data
@Component
@AllArgsConstructor
@NoArgsConstructor
public class SelectorConfiguration {
  private int maxPatternLength = 256;

  @PostConstruct
  public void init() {
    if (this.maxPatternLength <= 0) {
      throw new IllegalStateException(
          "Selector max pattern length must be positive, got " + this.maxPatternLength);
    }
  }
}
