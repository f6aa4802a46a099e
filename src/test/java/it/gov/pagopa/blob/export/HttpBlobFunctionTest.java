package it.gov.pagopa.blob.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.azure.functions.ExecutionContext;
import com.microsoft.azure.functions.HttpRequestMessage;
import com.microsoft.azure.functions.HttpResponseMessage;
import com.microsoft.azure.functions.HttpStatus;
import it.gov.pagopa.blob.export.exception.ConfigurationException;
import it.gov.pagopa.blob.export.util.CommonUtil;
import it.gov.pagopa.blob.export.util.InMemoryBlobStorage;
import it.gov.pagopa.blob.export.wrapper.BlobServiceClientWrapperImpl;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.org.webcompere.systemstubs.environment.EnvironmentVariables;
import uk.org.webcompere.systemstubs.jupiter.SystemStub;
import uk.org.webcompere.systemstubs.jupiter.SystemStubsExtension;

@ExtendWith({MockitoExtension.class, SystemStubsExtension.class})
class HttpBlobFunctionTest {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  @Mock private ExecutionContext mockContext;
  @Mock private HttpRequestMessage<Optional<String>> mockRequest;

  @SystemStub private EnvironmentVariables environmentVariables = new EnvironmentVariables();

  private InMemoryBlobStorage storage;
  private HttpBlobFunction function;

  private final AtomicReference<HttpStatus> status = new AtomicReference<>();
  private final AtomicReference<Object> body = new AtomicReference<>();

  @BeforeEach
  void setUp() {
    storage = new InMemoryBlobStorage();
    CommonUtil.setBlobServiceClientWrapper(storage.wrapper());
    function = new HttpBlobFunction(InMemoryBlobStorage.CONNECTION_STRING, 7);

    Logger logger = mock(Logger.class);
    lenient().when(mockContext.getLogger()).thenReturn(logger);

    HttpResponseMessage.Builder mockResponseBuilder = mock(HttpResponseMessage.Builder.class);
    HttpResponseMessage mockResponse = mock(HttpResponseMessage.class);

    lenient()
        .when(mockResponseBuilder.header(anyString(), anyString()))
        .thenReturn(mockResponseBuilder);
    lenient()
        .when(mockResponseBuilder.body(any()))
        .thenAnswer(
            invocation -> {
              body.set(invocation.getArgument(0));
              return mockResponseBuilder;
            });
    lenient().when(mockResponseBuilder.build()).thenReturn(mockResponse);
    lenient().when(mockResponse.getStatus()).thenAnswer(invocation -> status.get());
    lenient()
        .when(mockRequest.createResponseBuilder(any(HttpStatus.class)))
        .thenAnswer(
            invocation -> {
              status.set(invocation.getArgument(0));
              return mockResponseBuilder;
            });
  }

  @AfterEach
  void tearDown() {
    CommonUtil.setBlobServiceClientWrapper(new BlobServiceClientWrapperImpl());
  }

  private JsonNode responseBody() throws Exception {
    return objectMapper.readTree((String) body.get());
  }

  private void requestBody(Map<String, ?> json) throws Exception {
    when(mockRequest.getBody()).thenReturn(Optional.of(objectMapper.writeValueAsString(json)));
  }

  @Test
  void testLinkMissingRequestBody() {
    when(mockRequest.getBody()).thenReturn(Optional.empty());

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
  }

  @Test
  void testLinkInvalidJsonFormat() throws Exception {
    when(mockRequest.getBody()).thenReturn(Optional.of("invalid-json"));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
    assertEquals("Invalid JSON format", responseBody().get("message").asText());
  }

  @Test
  void testLinkMissingFields() throws Exception {
    requestBody(Map.of("container", "logs"));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
  }

  @Test
  void testLinkInvalidValidity() throws Exception {
    requestBody(Map.of("container", "logs", "blobPath", "run.csv", "validForDays", 0));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
  }

  @Test
  void testLinkBlobNotFound() throws Exception {
    requestBody(Map.of("container", "logs", "blobPath", "2024/run.csv"));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.NOT_FOUND, response.getStatus());
  }

  @Test
  void testLinkSuccess() throws Exception {
    storage.withBlob("logs", "2024/run.csv", new byte[] {1, 2, 3});
    requestBody(Map.of("container", "logs", "blobPath", "2024/run.csv", "validForDays", 2));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.OK, response.getStatus());
    String uri = responseBody().get("uri").asText();
    assertTrue(uri.startsWith("https://acme.blob.core.windows.net/logs/2024/run.csv?"));
    assertTrue(uri.contains("sp=r"));
  }

  @Test
  void testLinkWithoutConnectionString() throws Exception {
    function = new HttpBlobFunction(null, 7);
    requestBody(Map.of("container", "logs", "blobPath", "run.csv"));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatus());
  }

  @Test
  void testLinkWithoutAccountKey() throws Exception {
    function = new HttpBlobFunction("AccountName=acme;EndpointSuffix=core.windows.net", 7);
    storage.withBlob("logs", "run.csv", new byte[] {1});
    requestBody(Map.of("container", "logs", "blobPath", "run.csv"));

    HttpResponseMessage response = function.link(mockRequest, mockContext);

    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatus());
    assertEquals("Storage account not configured", responseBody().get("message").asText());
  }

  @Test
  void testParseBlobUri() throws Exception {
    requestBody(Map.of("uri", "https://acme.blob.core.windows.net/logs/2024/run.csv?sv=2020-01-01"));

    HttpResponseMessage response = function.parse(mockRequest, mockContext);

    assertEquals(HttpStatus.OK, response.getStatus());
    JsonNode parsed = responseBody();
    assertEquals("acme", parsed.get("account").asText());
    assertEquals("logs", parsed.get("container").asText());
    assertEquals("2024/run.csv", parsed.get("blobPath").asText());
    assertEquals("run.csv", parsed.get("fileName").asText());
    assertEquals("csv", parsed.get("fileExtension").asText());
    assertEquals("?sv=2020-01-01", parsed.get("sasToken").asText());
    assertFalse(parsed.has("empty"));
  }

  @Test
  void testParseNotABlobUri() throws Exception {
    requestBody(Map.of("uri", "https://justahost/nopath"));

    HttpResponseMessage response = function.parse(mockRequest, mockContext);

    assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatus());
  }

  @Test
  void testParseMissingUri() throws Exception {
    requestBody(Map.of("url", "https://acme.blob.core.windows.net/logs/a.csv"));

    HttpResponseMessage response = function.parse(mockRequest, mockContext);

    assertEquals(HttpStatus.BAD_REQUEST, response.getStatus());
  }

  @Test
  void testConstructorReadsEnvironment() {
    environmentVariables.set(CommonUtil.STORAGE_CONNECTION_STRING, "fake-connection-string");
    environmentVariables.set("SAS_TOKEN_VALID_DAYS", "3");

    HttpBlobFunction fromEnv = new HttpBlobFunction();

    assertEquals("fake-connection-string", fromEnv.getConnectionString());
    assertEquals(3, fromEnv.getDefaultValidDays());
  }

  @Test
  void testConstructorDefaults() {
    HttpBlobFunction fromEnv = new HttpBlobFunction();

    assertNull(fromEnv.getConnectionString());
    assertEquals(7, fromEnv.getDefaultValidDays());

    environmentVariables.set("SAS_TOKEN_VALID_DAYS", "week");
    assertThrows(ConfigurationException.class, HttpBlobFunction::new);
  }
}
