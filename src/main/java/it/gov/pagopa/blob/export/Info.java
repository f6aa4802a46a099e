package it.gov.pagopa.blob.export;

import com.microsoft.azure.functions.ExecutionContext;
import com.microsoft.azure.functions.HttpMethod;
import com.microsoft.azure.functions.HttpRequestMessage;
import com.microsoft.azure.functions.HttpResponseMessage;
import com.microsoft.azure.functions.HttpStatus;
import com.microsoft.azure.functions.annotation.AuthorizationLevel;
import com.microsoft.azure.functions.annotation.FunctionName;
import com.microsoft.azure.functions.annotation.HttpTrigger;
import it.gov.pagopa.blob.export.model.AppInfo;
import it.gov.pagopa.blob.export.util.CommonUtil;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/** Azure Functions with Azure Http trigger. */
public class Info {

  static final String POM_PROPERTIES =
      "/META-INF/maven/it.gov.pagopa/pagopa-blob-export/pom.properties";
  static final String DEFAULT_ENVIRONMENT = "local";

  /** This function will be invoked when a Http Trigger occurs */
  @FunctionName("Info")
  public HttpResponseMessage run(
      @HttpTrigger(
              name = "InfoTrigger",
              methods = {HttpMethod.GET},
              route = "info",
              authLevel = AuthorizationLevel.ANONYMOUS)
          HttpRequestMessage<Optional<String>> request,
      final ExecutionContext context) {

    return request
        .createResponseBuilder(HttpStatus.OK)
        .header("Content-Type", "application/json")
        .body(getInfo(context.getLogger(), POM_PROPERTIES))
        .build();
  }

  public synchronized AppInfo getInfo(Logger logger, String path) {
    String version = null;
    String name = null;
    try (InputStream inputStream = loadResource(path)) {
      if (inputStream != null) {
        Properties properties = new Properties();
        properties.load(inputStream);
        version = properties.getProperty("version", null);
        name = properties.getProperty("artifactId", null);
      }
    } catch (Exception e) {
      if (logger != null) {
        logger.severe("Impossible to retrieve information from pom.properties file.");
      }
    }
    return AppInfo.builder()
        .version(version)
        .environment(CommonUtil.getEnv("ENV", DEFAULT_ENVIRONMENT))
        .name(name)
        .build();
  }

  public InputStream loadResource(String path) {
    return this.getClass().getResourceAsStream(path);
  }
}
