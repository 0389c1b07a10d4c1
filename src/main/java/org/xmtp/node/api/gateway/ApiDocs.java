/*
 * Copyright 2026 The gRPC Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.xmtp.node.api.gateway;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.io.Files;
import com.google.common.net.MediaType;
import io.grpc.Status;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;
import javax.annotation.Nullable;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;

/**
 * Serves the API schema at {@code /swagger.json} and Swagger UI at {@code /} and
 * {@code /swagger-ui*}. The UI assets come from the {@code org.webjars:swagger-ui} jar.
 */
final class ApiDocs {
  static final String SCHEMA_PATH = "/swagger.json";
  static final String UI_PREFIX = "/swagger-ui";

  private static final String WEBJAR_ROOT = "META-INF/resources/webjars/swagger-ui/";
  private static final String WEBJAR_POM =
      "META-INF/maven/org.webjars/swagger-ui/pom.properties";

  private static final ImmutableMap<String, MediaType> CONTENT_TYPES =
      ImmutableMap.<String, MediaType>builder()
          .put("html", MediaType.HTML_UTF_8)
          .put("js", MediaType.JAVASCRIPT_UTF_8)
          .put("css", MediaType.CSS_UTF_8)
          .put("json", MediaType.JSON_UTF_8)
          .put("map", MediaType.JSON_UTF_8)
          .put("png", MediaType.PNG)
          .build();

  private static final String INDEX_HTML = "<!DOCTYPE html>\n"
      + "<html lang=\"en\">\n"
      + "<head>\n"
      + "  <meta charset=\"utf-8\">\n"
      + "  <title>API</title>\n"
      + "  <link rel=\"stylesheet\" href=\"/swagger-ui/swagger-ui.css\">\n"
      + "</head>\n"
      + "<body>\n"
      + "  <div id=\"swagger-ui\"></div>\n"
      + "  <script src=\"/swagger-ui/swagger-ui-bundle.js\"></script>\n"
      + "  <script src=\"/swagger-ui/swagger-ui-standalone-preset.js\"></script>\n"
      + "  <script>\n"
      + "    window.ui = SwaggerUIBundle({\n"
      + "      url: \"" + SCHEMA_PATH + "\",\n"
      + "      dom_id: \"#swagger-ui\",\n"
      + "      presets: [SwaggerUIBundle.presets.apis, SwaggerUIStandalonePreset],\n"
      + "      layout: \"StandaloneLayout\"\n"
      + "    });\n"
      + "  </script>\n"
      + "</body>\n"
      + "</html>\n";

  private final byte[] schema;
  @Nullable private final String webjarVersion;
  private final StructuredLogger log;

  ApiDocs(byte[] schema, StructuredLogger log) {
    this(schema, readWebjarVersion(log), log);
  }

  @VisibleForTesting
  ApiDocs(byte[] schema, @Nullable String webjarVersion, StructuredLogger log) {
    this.schema = checkNotNull(schema, "schema").clone();
    this.webjarVersion = webjarVersion;
    this.log = checkNotNull(log, "log");
  }

  static boolean handles(String path) {
    return path.equals("/") || path.equals(SCHEMA_PATH) || path.startsWith(UI_PREFIX);
  }

  FullHttpResponse respond(HttpMethod method, String path) {
    if (!HttpMethod.GET.equals(method) && !HttpMethod.HEAD.equals(method)) {
      return HttpResponses.error(Status.UNIMPLEMENTED.withDescription("Method Not Allowed"))
          .setStatus(HttpResponseStatus.METHOD_NOT_ALLOWED);
    }
    if (path.equals(SCHEMA_PATH)) {
      return HttpResponses.full(HttpResponseStatus.OK, HttpResponses.JSON, schema);
    }
    if (path.equals("/") || path.equals(UI_PREFIX) || path.equals(UI_PREFIX + "/")
        || path.equals(UI_PREFIX + "/index.html")) {
      return HttpResponses.full(HttpResponseStatus.OK, MediaType.HTML_UTF_8.toString(),
          INDEX_HTML.getBytes(StandardCharsets.UTF_8));
    }
    String asset = path.startsWith(UI_PREFIX + "/") ? path.substring(UI_PREFIX.length() + 1) : "";
    byte[] content = asset.isEmpty() || asset.contains("..") ? null : readAsset(asset);
    if (content == null) {
      return HttpResponses.error(Status.NOT_FOUND.withDescription("Not Found"));
    }
    MediaType type = CONTENT_TYPES.get(Files.getFileExtension(asset).toLowerCase(Locale.ROOT));
    return HttpResponses.full(HttpResponseStatus.OK,
        (type == null ? MediaType.OCTET_STREAM : type).toString(), content);
  }

  @Nullable
  private byte[] readAsset(String asset) {
    if (webjarVersion == null) {
      return null;
    }
    String resource = WEBJAR_ROOT + webjarVersion + "/" + asset;
    try (InputStream in = ApiDocs.class.getClassLoader().getResourceAsStream(resource)) {
      return in == null ? null : ByteStreams.toByteArray(in);
    } catch (IOException e) {
      log.warn("failed to read swagger-ui asset", LogField.string("asset", asset),
          LogField.error(e));
      return null;
    }
  }

  @Nullable
  private static String readWebjarVersion(StructuredLogger log) {
    try (InputStream in = ApiDocs.class.getClassLoader().getResourceAsStream(WEBJAR_POM)) {
      if (in == null) {
        log.warn("swagger-ui webjar not on the classpath, serving the schema only");
        return null;
      }
      Properties properties = new Properties();
      properties.load(in);
      return properties.getProperty("version");
    } catch (IOException e) {
      log.warn("failed to read swagger-ui webjar version", LogField.error(e));
      return null;
    }
  }
}
