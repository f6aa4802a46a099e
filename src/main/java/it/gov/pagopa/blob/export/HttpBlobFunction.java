package it.gov.pagopa.blob.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.azure.functions.ExecutionContext;
import com.microsoft.azure.functions.HttpMethod;
import com.microsoft.azure.functions.HttpRequestMessage;
import com.microsoft.azure.functions.HttpResponseMessage;
import com.microsoft.azure.functions.HttpStatus;
import com.microsoft.azure.functions.annotation.AuthorizationLevel;
import com.microsoft.azure.functions.annotation.FunctionName;
import com.microsoft.azure.functions.annotation.HttpTrigger;
import it.gov.pagopa.blob.export.exception.ConfigurationException;
import it.gov.pagopa.blob.export.exception.CredentialException;
import it.gov.pagopa.blob.export.model.ParsedBlobUri;
import it.gov.pagopa.blob.export.parser.BlobUriParser;
import it.gov.pagopa.blob.export.storage.BlobStore;
import it.gov.pagopa.blob.export.util.CommonUtil;
import it.gov.pagopa.blob.export.util.ErrorCodes;
import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import lombok.Getter;

/** Azure Functions with Azure Http trigger. */
public class HttpBlobFunction {

  private static final ObjectMapper objectMapper = new ObjectMapper();
  private static final String CONTENT_TYPE = "Content-Type";
  private static final String APPLICATION_JSON = "application/json";
  private static final String JSON_CONTAINER = "container";
  private static final String JSON_BLOB_PATH = "blobPath";
  private static final String JSON_VALID_FOR_DAYS = "validForDays";
  private static final String JSON_URI = "uri";

  @Getter private final String connectionString;
  @Getter private final int defaultValidDays;

  public HttpBlobFunction() {
    this(
        System.getenv(CommonUtil.STORAGE_CONNECTION_STRING),
        CommonUtil.parsePositiveInt(
            "SAS_TOKEN_VALID_DAYS", CommonUtil.getEnv("SAS_TOKEN_VALID_DAYS", "7")));
  }

  public HttpBlobFunction(String connectionString, int defaultValidDays) {
    this.connectionString = connectionString;
    this.defaultValidDays = defaultValidDays;
  }

  @FunctionName("HTTPBlobLink")
  public HttpResponseMessage link(
      @HttpTrigger(
              name = "HTTPBlobLinkTrigger",
              methods = {HttpMethod.POST},
              route = "blob/link",
              authLevel = AuthorizationLevel.FUNCTION)
          HttpRequestMessage<Optional<String>> request,
      final ExecutionContext context) {

    Optional<String> requestBody = request.getBody();
    if (!requestBody.isPresent()) {
      return badRequest(request, "Missing request body");
    }

    JsonNode jsonNode;
    try {
      jsonNode = objectMapper.readTree(requestBody.get());
    } catch (IOException e) {
      return badRequest(request, "Invalid JSON format");
    }

    String container = text(jsonNode, JSON_CONTAINER);
    String blobPath = text(jsonNode, JSON_BLOB_PATH);
    if (container == null || blobPath == null) {
      return badRequest(request, "Missing required fields: container, blobPath");
    }

    int validDays;
    try {
      String requested = text(jsonNode, JSON_VALID_FOR_DAYS);
      validDays =
          requested == null
              ? defaultValidDays
              : CommonUtil.parsePositiveInt(JSON_VALID_FOR_DAYS, requested);
    } catch (ConfigurationException e) {
      return badRequest(request, e.getMessage());
    }

    context
        .getLogger()
        .fine(
            () ->
                String.format(
                    "[HTTP BLOB] Link requested at: %s for Blob container: %s, name: %s",
                    LocalDateTime.now()
                        .format(DateTimeFormatter.ofPattern(CommonUtil.LOG_DATETIME_PATTERN)),
                    container,
                    blobPath));

    try {
      BlobStore store = blobStore(context);

      if (!store.listBlobs(container).contains(blobPath)) {
        return notFound(
            request, String.format("Blob %s not found in container %s", blobPath, container));
      }

      String sasToken =
          store.generateSasTokenForBlob(container, blobPath, Duration.ofDays(validDays));
      String uri = store.generateUri(container, blobPath, sasToken);
      return response(
          request, HttpStatus.OK, objectMapper.createObjectNode().put(JSON_URI, uri).toString());

    } catch (CredentialException | ConfigurationException e) {
      context
          .getLogger()
          .severe(
              () ->
                  String.format(
                      "%s [HTTP BLOB] Storage account not configured: %s",
                      ErrorCodes.HTTP_E1.prefix(), e.getMessage()));
      return serverError(request, "Storage account not configured");
    } catch (Exception e) {
      context
          .getLogger()
          .severe(
              () ->
                  String.format(
                      "%s [HTTP BLOB] Unexpected error: %s",
                      ErrorCodes.HTTP_E1.prefix(), e.getMessage()));
      return serverError(request, "Internal Server Error");
    }
  }

  @FunctionName("HTTPBlobParse")
  public HttpResponseMessage parse(
      @HttpTrigger(
              name = "HTTPBlobParseTrigger",
              methods = {HttpMethod.POST},
              route = "blob/parse",
              authLevel = AuthorizationLevel.FUNCTION)
          HttpRequestMessage<Optional<String>> request,
      final ExecutionContext context) {

    Optional<String> requestBody = request.getBody();
    if (!requestBody.isPresent()) {
      return badRequest(request, "Missing request body");
    }

    try {
      String uri = text(objectMapper.readTree(requestBody.get()), JSON_URI);
      if (uri == null) {
        return badRequest(request, "Missing required field: uri");
      }

      ParsedBlobUri parsed = BlobUriParser.parse(uri);
      if (parsed.isEmpty()) {
        return unprocessableEntity(request, "Not a blob URI");
      }
      return response(request, HttpStatus.OK, objectMapper.writeValueAsString(parsed));

    } catch (IOException e) {
      return badRequest(request, "Invalid JSON format");
    }
  }

  private BlobStore blobStore(ExecutionContext context) {
    if (connectionString == null || connectionString.isBlank()) {
      throw new ConfigurationException(
          "Missing required setting: " + CommonUtil.STORAGE_CONNECTION_STRING);
    }
    return CommonUtil.createBlobStore(connectionString, context.getLogger());
  }

  private static String text(JsonNode jsonNode, String field) {
    return Optional.ofNullable(jsonNode)
        .map(node -> node.get(field))
        .filter(node -> !node.isNull())
        .map(JsonNode::asText)
        .orElse(null);
  }

  private HttpResponseMessage badRequest(HttpRequestMessage<?> request, String message) {
    return message(request, HttpStatus.BAD_REQUEST, message);
  }

  private HttpResponseMessage notFound(HttpRequestMessage<?> request, String message) {
    return message(request, HttpStatus.NOT_FOUND, message);
  }

  private HttpResponseMessage unprocessableEntity(HttpRequestMessage<?> request, String message) {
    return message(request, HttpStatus.UNPROCESSABLE_ENTITY, message);
  }

  private HttpResponseMessage serverError(HttpRequestMessage<?> request, String message) {
    return message(request, HttpStatus.INTERNAL_SERVER_ERROR, message);
  }

  private HttpResponseMessage message(
      HttpRequestMessage<?> request, HttpStatus status, String message) {
    return response(
        request, status, objectMapper.createObjectNode().put("message", message).toString());
  }

  private HttpResponseMessage response(
      HttpRequestMessage<?> request, HttpStatus status, String body) {
    return request
        .createResponseBuilder(status)
        .header(CONTENT_TYPE, APPLICATION_JSON)
        .body(body)
        .build();
  }
}
