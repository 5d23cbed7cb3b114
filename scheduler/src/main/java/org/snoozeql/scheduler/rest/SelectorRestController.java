package org.snoozeql.scheduler.rest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import java.util.ArrayList;
import java.util.List;
import org.snoozeql.scheduler.rest.model.FilterPreviewRequest;
import org.snoozeql.scheduler.rest.model.FilterPreviewResult;
import org.snoozeql.scheduler.rest.model.RegexValidationRequest;
import org.snoozeql.scheduler.rest.model.RegexValidationResult;
import org.snoozeql.scheduler.rest.model.Selector;
import org.snoozeql.scheduler.service.SelectorManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Controller class for the selector editor. */
@RestController
@RequestMapping(value = "/v1/selectors")
public class SelectorRestController {

  @Autowired SelectorManager selectorManager;
  private final Logger logger = LoggerFactory.getLogger(this.getClass());

  @GetMapping("/template")
  @Operation(summary = "Get the selector a new rule starts from.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "A selector with an empty name matcher.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = Selector.class)))
      })
  public ResponseEntity<Selector> getTemplate() {
    return new ResponseEntity<>(selectorManager.createEmptySelector(), HttpStatus.OK);
  }

  @PostMapping("/preview")
  @Operation(summary = "Preview which instances a list of selectors matches.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The matching instances.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = FilterPreviewResult.class))),
        @ApiResponse(responseCode = "400", description = "The operator is neither and nor or.")
      })
  public ResponseEntity<FilterPreviewResult> preview(@RequestBody FilterPreviewRequest request) {
    logger.info("Preview selectors: {}", request);

    return new ResponseEntity<>(selectorManager.previewFilter(request), HttpStatus.OK);
  }

  @PostMapping("/validation")
  @Operation(summary = "Validate a list of selectors before it is saved.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "The selectors are valid."),
        @ApiResponse(responseCode = "400", description = "The reasons the selectors are invalid.")
      })
  public ResponseEntity<List<String>> validate(@RequestBody List<Selector> selectors) {
    selectorManager.validateSelectors(selectors);

    return new ResponseEntity<>(new ArrayList<>(), HttpStatus.OK);
  }

  @PostMapping("/regex-validation")
  @Operation(summary = "Check whether a regex pattern compiles.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "The verdict for the pattern.",
            content =
                @Content(
                    mediaType = "application/json",
                    schema = @Schema(implementation = RegexValidationResult.class)))
      })
  public ResponseEntity<RegexValidationResult> validateRegex(
      @RequestBody RegexValidationRequest request) {
    return new ResponseEntity<>(
        selectorManager.validateRegex(request.getPattern()), HttpStatus.OK);
  }

  @PostMapping("/description")
  @Operation(summary = "Describe each selector of a list in words.")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "One description per selector.")
      })
  public ResponseEntity<List<String>> describe(@RequestBody List<Selector> selectors) {
    return new ResponseEntity<>(selectorManager.describeSelectors(selectors), HttpStatus.OK);
  }
}
