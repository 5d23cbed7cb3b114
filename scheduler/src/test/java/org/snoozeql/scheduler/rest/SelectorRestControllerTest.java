package org.snoozeql.scheduler.rest;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.snoozeql.scheduler.rest.model.FilterPreviewRequest;
import org.snoozeql.scheduler.rest.model.RegexValidationRequest;
import org.snoozeql.scheduler.rest.model.Selector;
import org.snoozeql.scheduler.util.MatchTypeEnum;
import org.snoozeql.scheduler.util.ProviderEnum;
import org.snoozeql.scheduler.util.TestDataSetupHelper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

@SpringBootTest
class SelectorRestControllerTest {

  @Autowired private WebApplicationContext wac;
  private MockMvc mockMvc;

  private final ObjectMapper mapper = new ObjectMapper();

  @BeforeEach
  void beforeTest() {
    mockMvc = MockMvcBuilders.webAppContextSetup(wac).build();
  }

  @Test
  void getTemplate() throws Exception {
    ResultActions resultActions = mockMvc.perform(get("/v1/selectors/template"));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$.name.pattern", is("")));
    resultActions.andExpect(jsonPath("$.name.type", is("contains")));
    resultActions.andExpect(jsonPath("$.provider").doesNotExist());
  }

  @Test
  void preview() throws Exception {
    Selector selector = TestDataSetupHelper.generateNameSelector("PROD", MatchTypeEnum.PREFIX);
    selector.setProvider(ProviderEnum.AWS);

    FilterPreviewRequest request = new FilterPreviewRequest();
    request.setSelectors(Arrays.asList(selector));
    request.setInstances(
        Arrays.asList(
            TestDataSetupHelper.generateProdAwsInstance(),
            TestDataSetupHelper.generateStagingGcpInstance()));

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/preview")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(request)));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$.matched_count", is(1)));
    resultActions.andExpect(jsonPath("$.total_count", is(2)));
    resultActions.andExpect(jsonPath("$.instances[0].name", is("prod-db-1")));
    resultActions.andExpect(jsonPath("$.instances[0].tags.env", is("prod")));
  }

  @Test
  void preview_missingMatcherTypeMeansContains() throws Exception {
    String content =
        "{\"selectors\":[{\"name\":{\"pattern\":\"db\"}}],"
            + "\"instances\":[{\"name\":\"staging-db\",\"provider\":\"gcp_p\",\"status\":\"running\"}]}";

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/preview").contentType(MediaType.APPLICATION_JSON).content(content));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$.matched_count", is(1)));
  }

  @Test
  void preview_unknownOperator() throws Exception {
    String content = "{\"selectors\":[],\"operator\":\"xor\",\"instances\":[]}";

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/preview").contentType(MediaType.APPLICATION_JSON).content(content));

    resultActions.andExpect(status().isBadRequest());
    resultActions.andExpect(jsonPath("$[0]", is("Operator must be 'and' or 'or', got 'xor'.")));
  }

  @Test
  void preview_nullInstance() throws Exception {
    String content = "{\"selectors\":[{\"name\":{\"pattern\":\"db\"}}],\"instances\":[null]}";

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/preview").contentType(MediaType.APPLICATION_JSON).content(content));

    resultActions.andExpect(status().isBadRequest());
    resultActions.andExpect(jsonPath("$[0]", is("The value for instances[0] is not specified.")));
  }

  @Test
  void preview_unknownMatcherType() throws Exception {
    String content =
        "{\"selectors\":[{\"name\":{\"pattern\":\"db\",\"type\":\"fuzzy\"}}],\"instances\":[]}";

    mockMvc
        .perform(
            post("/v1/selectors/preview").contentType(MediaType.APPLICATION_JSON).content(content))
        .andExpect(status().isBadRequest());
  }

  @Test
  void validate() throws Exception {
    String content =
        mapper.writeValueAsString(
            Arrays.asList(TestDataSetupHelper.generateNameSelector("^prod", MatchTypeEnum.REGEX)));

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/validation")
                .contentType(MediaType.APPLICATION_JSON)
                .content(content));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$", hasSize(0)));
  }

  @Test
  void validate_invalidRegex() throws Exception {
    String content =
        mapper.writeValueAsString(
            Arrays.asList(TestDataSetupHelper.generateNameSelector("(", MatchTypeEnum.REGEX)));

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/validation")
                .contentType(MediaType.APPLICATION_JSON)
                .content(content));

    resultActions.andExpect(status().isBadRequest());
    resultActions.andExpect(jsonPath("$", hasSize(1)));
    resultActions.andExpect(jsonPath("$[0]", startsWith("Invalid regex in selector 1 name: ")));
  }

  @Test
  void validate_noSelectors() throws Exception {
    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/validation").contentType(MediaType.APPLICATION_JSON).content("[]"));

    resultActions.andExpect(status().isBadRequest());
    resultActions.andExpect(jsonPath("$[0]", is("The value for selectors is not specified.")));
  }

  @Test
  void validateRegex() throws Exception {
    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/regex-validation")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(new RegexValidationRequest("[a-"))));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$.pattern", is("[a-")));
    resultActions.andExpect(jsonPath("$.valid", is(false)));
  }

  @Test
  void validateRegex_tooLong() throws Exception {
    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/regex-validation")
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(new RegexValidationRequest("a".repeat(300)))));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$.valid", is(false)));
    resultActions.andExpect(jsonPath("$.message", is("Pattern is longer than 256 characters")));
  }

  @Test
  void describe() throws Exception {
    String content =
        mapper.writeValueAsString(
            Arrays.asList(
                TestDataSetupHelper.generateTagSelector("env", "prod", MatchTypeEnum.EXACT),
                new Selector()));

    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/description")
                .contentType(MediaType.APPLICATION_JSON)
                .content(content));

    resultActions.andExpect(status().isOk());
    resultActions.andExpect(jsonPath("$[0]", is("tag \"env\" equals \"prod\"")));
    resultActions.andExpect(jsonPath("$[1]", is("No conditions")));
  }

  @Test
  void describe_nullSelector() throws Exception {
    ResultActions resultActions =
        mockMvc.perform(
            post("/v1/selectors/description")
                .contentType(MediaType.APPLICATION_JSON)
                .content("[null]"));

    resultActions.andExpect(status().isBadRequest());
    resultActions.andExpect(jsonPath("$[0]", is("The value for selectors[0] is not specified.")));
  }
}
