package org.snoozeql.scheduler.rest.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.snoozeql.scheduler.util.MatchTypeEnum;
import org.snoozeql.scheduler.util.error.InvalidDataException;

class ScheduleGridTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void rejectsWrongShape() {
    assertThrows(InvalidDataException.class, () -> new ScheduleGrid(null));
    assertThrows(InvalidDataException.class, () -> new ScheduleGrid(new boolean[8][24]));
    assertThrows(InvalidDataException.class, () -> new ScheduleGrid(new boolean[7][25]));
  }

  @Test
  void isNotChangedByTheCallerArrays() {
    boolean[][] cells = new boolean[7][24];
    ScheduleGrid grid = new ScheduleGrid(cells);

    cells[0][0] = true;
    grid.getCells()[1][1] = true;

    assertThat(grid.isEmpty(), is(true));
  }

  @Test
  void readsAndWritesAsNestedArrays() throws Exception {
    boolean[][] cells = new boolean[7][24];
    cells[2][3] = true;

    String json = mapper.writeValueAsString(new ScheduleGrid(cells));
    ScheduleGrid grid = mapper.readValue(json, ScheduleGrid.class);

    assertThat(json, startsWith("[[false,"));
    assertThat(grid.getActiveDays(), contains(2));
    assertThat(grid.getSleepHours(2), contains(3));
  }

  @Test
  void matcherWithoutTypeIsContains() throws Exception {
    Matcher matcher = mapper.readValue("{\"pattern\":\"db\",\"type\":null}", Matcher.class);

    assertThat(matcher.getType(), is(MatchTypeEnum.CONTAINS));
    assertThat(mapper.readValue("{}", Matcher.class).hasPattern(), is(false));
  }
}
