package com.ospicorp.dataapi.web;

import com.ospicorp.dataapi.data.RequestDescriptor;
import com.ospicorp.dataapi.data.RequestProperties;
import com.ospicorp.dataapi.format.MetricCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.constraints.Pattern;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

@RestController
@RequestMapping("/api/v2")
@Validated
@Tag(name = "Data")
public class DataController {
  private static final String AREA_TYPE_REGEX = "^[a-zA-Z]{1,10}$";
  private static final String AREA_CODE_REGEX = "^\\s*([a-zA-Z0-9]{1,10}\\s*)?$";
  private static final String METRIC_REGEX = "^([a-zA-Z0-9_-]{2,120})?$";

  private final DataService service;
  private final MetricCatalog catalog;
  private final RequestProperties properties;

  public DataController(DataService service, MetricCatalog catalog, RequestProperties properties) {
    this.service = service;
    this.catalog = catalog;
    this.properties = properties;
  }

  @RequestMapping(path = "/data", method = RequestMethod.GET)
  @Operation(summary = "Get data", description = "Released metrics for one area type, or one area, "
      + "as CSV, JSON or JSON lines. Cached responses are served by redirect.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Response body",
          headers = {
              @Header(name = "Content-Disposition", description = "Download file name", schema = @Schema(type = "string")),
              @Header(name = "Content-Location", description = "Permalink", schema = @Schema(type = "string"))
          },
          content = {
              @Content(mediaType = "application/vnd.PHE-COVID19.v2+json"),
              @Content(mediaType = "application/vnd.PHE-COVID19.v2+jsonl"),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "204", description = "No data matches the request"),
      @ApiResponse(responseCode = "302", description = "Redirect to the cached response",
          headers = @Header(name = "Location", description = "Download URL", schema = @Schema(type = "string"))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "412", description = "Metrics cannot be combined",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class))),
      @ApiResponse(responseCode = "413", description = "Too many metrics",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public CompletableFuture<ResponseEntity<StreamingResponseBody>> data(
      @RequestParam @Pattern(regexp = AREA_TYPE_REGEX, message = "Invalid areaType parameter.")
      @Parameter(description = "Area type", example = "nation") String areaType,
      @RequestParam @Parameter(description = "Release date", example = "2021-03-01") String release,
      @RequestParam @Parameter(description = "Metric names; repeat or comma separate", example = "newCasesByPublishDate")
      List<@Pattern(regexp = METRIC_REGEX, message = "Invalid metric name.") String> metric,
      @RequestParam(defaultValue = "json") @Parameter(description = "csv, json, jsonl or xml", example = "csv") String format,
      @RequestParam(required = false) @Pattern(regexp = AREA_CODE_REGEX, message = "Invalid areaCode parameter.")
      @Parameter(description = "Restrict to one area", example = "E92000001") String areaCode,
      HttpServletRequest request) {
    RequestDescriptor descriptor = RequestDescriptor.of(areaType, release, format, metric, areaCode,
        RequestDescriptor.GET, catalog, properties);
    HttpHeaders headers = responseHeaders(descriptor, permalink(request));
    return service.get(descriptor).thenApply(response -> toEntity(response, headers));
  }

  @RequestMapping(path = "/data", method = RequestMethod.HEAD)
  @Operation(summary = "Check data", description = "Whether any released data matches, without the body.")
  public CompletableFuture<ResponseEntity<StreamingResponseBody>> head(
      @RequestParam @Pattern(regexp = AREA_TYPE_REGEX, message = "Invalid areaType parameter.") String areaType,
      @RequestParam String release,
      @RequestParam List<@Pattern(regexp = METRIC_REGEX, message = "Invalid metric name.") String> metric,
      @RequestParam(defaultValue = "json") String format,
      @RequestParam(required = false) @Pattern(regexp = AREA_CODE_REGEX, message = "Invalid areaCode parameter.") String areaCode,
      HttpServletRequest request) {
    RequestDescriptor descriptor = RequestDescriptor.of(areaType, release, format, metric, areaCode,
        RequestDescriptor.HEAD, catalog, properties);
    HttpHeaders headers = responseHeaders(descriptor, permalink(request));
    return service.head(descriptor).thenApply(response -> toEntity(response, headers));
  }

  static ResponseEntity<StreamingResponseBody> toEntity(DataResponse response, HttpHeaders headers) {
    switch (response.kind()) {
      case REDIRECT:
        return ResponseEntity.status(HttpStatus.FOUND)
            .headers(withoutBodyHeaders(headers))
            .location(response.location())
            .build();
      case INLINE:
        byte[] body = response.body();
        StreamingResponseBody cached = out -> out.write(body);
        return ResponseEntity.ok()
            .headers(headers)
            .contentLength(body.length)
            .body(cached);
      case STREAM:
        return ResponseEntity.ok().headers(headers).body(response.stream());
      case EXISTS:
        return ResponseEntity.ok().headers(headers).build();
      default:
        return ResponseEntity.noContent().build();
    }
  }

  private static HttpHeaders responseHeaders(RequestDescriptor descriptor, String permalink) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.parseMediaType(descriptor.format().contentType()));
    headers.setContentDisposition(ContentDisposition.attachment()
        .filename(descriptor.fileName())
        .build());
    headers.setCacheControl("public, max-age=90, must-revalidate");
    headers.set(HttpHeaders.CONTENT_LANGUAGE, "en-GB");
    headers.set(HttpHeaders.CONTENT_LOCATION, permalink);
    return headers;
  }

  private static HttpHeaders withoutBodyHeaders(HttpHeaders headers) {
    HttpHeaders copy = new HttpHeaders();
    copy.putAll(headers);
    copy.remove(HttpHeaders.CONTENT_DISPOSITION);
    return copy;
  }

  private String permalink(HttpServletRequest request) {
    String base = properties.permalinkBase();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String query = request.getQueryString();
    return base + request.getRequestURI() + (query == null || query.isBlank() ? "" : "?" + query);
  }
}
