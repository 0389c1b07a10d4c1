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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.testing.GrpcCleanupRule;
import java.io.ByteArrayInputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.xmtp.node.api.EchoService;
import org.xmtp.node.api.RequesterInfo;
import org.xmtp.node.api.TelemetryInterceptor;
import org.xmtp.node.logging.StructuredLogger;

/** End-to-end tests for {@link HttpGateway} in front of an in-process gRPC server. */
@RunWith(JUnit4.class)
public class HttpGatewayTest {
  private static final String SCHEMA = "{\"swagger\":\"2.0\",\"paths\":{}}";

  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

  private final EchoService service = new EchoService();
  private final HttpClient http = HttpClient.newBuilder()
      .version(HttpClient.Version.HTTP_1_1)
      .connectTimeout(Duration.ofSeconds(5))
      .build();
  private HttpGateway gateway;
  private InetSocketAddress address;

  @Before
  public void setUp() throws Exception {
    String serverName = InProcessServerBuilder.generateName();
    grpcCleanup.register(InProcessServerBuilder.forName(serverName)
        .addService(service.bindService())
        .build()
        .start());
    ManagedChannel channel =
        grpcCleanup.register(InProcessChannelBuilder.forName(serverName).build());
    gateway = HttpGateway.create(channel, ImmutableList.of(service.bindService()),
        SCHEMA.getBytes(StandardCharsets.UTF_8), 1024 * 1024,
        StructuredLogger.of(HttpGatewayTest.class));
    address = gateway.bind("127.0.0.1", 0);
  }

  @After
  public void tearDown() {
    gateway.close();
  }

  private HttpRequest.Builder request(String path) {
    return HttpRequest.newBuilder(
            URI.create("http://127.0.0.1:" + address.getPort() + path))
        .timeout(Duration.ofSeconds(10));
  }

  private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
    return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> get(String path) throws Exception {
    return send(request(path).GET());
  }

  private HttpResponse<String> post(String path, String body) throws Exception {
    return send(request(path).POST(HttpRequest.BodyPublishers.ofString(body)));
  }

  @Test
  public void routeCountIncludesFallbacks() {
    assertThat(gateway.routeCount()).isEqualTo(7);
  }

  @Test
  public void fallbackRoute() throws Exception {
    HttpResponse<String> response = post("/xmtp.test.Echo/Echo", "{\"reason\":\"hi\"}");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.headers().firstValue("content-type")).hasValue(HttpResponses.JSON);
    assertThat(response.body())
        .isEqualTo("{\"reason\":\"hi\",\"domain\":\"\",\"metadata\":{}}");
  }

  @Test
  public void declaredGetRoute() throws Exception {
    HttpResponse<String> response = get("/v1/echo/hello?domain=example.com");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"reason\":\"hello\"");
    assertThat(response.body()).contains("\"domain\":\"example.com\"");
  }

  @Test
  public void additionalBinding() throws Exception {
    HttpResponse<String> response = post("/v1/echo", "{\"reason\":\"extra\"}");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"reason\":\"extra\"");
  }

  @Test
  public void grpcErrorsBecomeHttpErrors() throws Exception {
    HttpResponse<String> response = post("/xmtp.test.Echo/Fail", "{}");

    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(response.body())
        .isEqualTo("{\"code\":5,\"message\":\"no such thing\",\"details\":[]}");
  }

  @Test
  public void handlerExceptionIsUnknown() throws Exception {
    HttpResponse<String> response = post("/xmtp.test.Echo/Boom", "{}");

    assertThat(response.statusCode()).isEqualTo(500);
    assertThat(response.body()).contains("\"code\":2");
  }

  @Test
  public void unknownPath() throws Exception {
    HttpResponse<String> response = get("/v2/nothing");

    assertThat(response.statusCode()).isEqualTo(404);
    assertThat(response.body()).isEqualTo("{\"code\":5,\"message\":\"Not Found\",\"details\":[]}");
    assertThat(service.handledCount()).isEqualTo(0);
  }

  @Test
  public void wrongMethod() throws Exception {
    HttpResponse<String> response = get("/xmtp.test.Echo/Echo");

    assertThat(response.statusCode()).isEqualTo(405);
    assertThat(response.body()).contains("\"code\":12");
  }

  @Test
  public void malformedBody() throws Exception {
    HttpResponse<String> response = post("/xmtp.test.Echo/Echo", "{not json");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).contains("\"code\":3");
    assertThat(service.handledCount()).isEqualTo(0);
  }

  @Test
  public void serverStreamingWritesOneLinePerMessage() throws Exception {
    HttpResponse<String> response = get("/v1/echo-stream/a,b,c");

    assertThat(response.statusCode()).isEqualTo(200);
    List<String> lines = Splitter.on('\n').omitEmptyStrings().splitToList(response.body());
    assertThat(lines).hasSize(3);
    assertThat(lines.get(0)).startsWith("{\"result\":{\"reason\":\"a\"");
    assertThat(lines.get(2)).startsWith("{\"result\":{\"reason\":\"c\"");
  }

  @Test
  public void serverStreamingErrorAfterFirstMessage() throws Exception {
    HttpResponse<String> response = get("/v1/echo-stream/error,never");

    assertThat(response.statusCode()).isEqualTo(200);
    List<String> lines = Splitter.on('\n').omitEmptyStrings().splitToList(response.body());
    assertThat(lines).hasSize(2);
    assertThat(lines.get(0)).startsWith("{\"result\":{\"reason\":\"error\"");
    assertThat(lines.get(1)).isEqualTo(
        "{\"error\":{\"code\":14,\"message\":\"stream broke\",\"details\":[]}}");
  }

  @Test
  public void forwardsCallerHeaders() throws Exception {
    HttpResponse<String> response = send(request("/xmtp.test.Echo/Echo")
        .header("Authorization", "Bearer token")
        .header("X-Client-Version", "xmtp-js/7.1.0")
        .header("X-App-Version", "converse/1.0.0")
        .header("X-Forwarded-For", "198.51.100.7")
        .header("X-Ignored", "dropped")
        .POST(HttpRequest.BodyPublishers.ofString("{}")));

    assertThat(response.statusCode()).isEqualTo(200);
    Metadata headers = service.lastHeaders();
    assertThat(headers.get(GatewayHandler.AUTHORIZATION_KEY)).isEqualTo("Bearer token");
    assertThat(headers.get(RequesterInfo.CLIENT_VERSION_KEY)).isEqualTo("xmtp-js/7.1.0");
    assertThat(headers.get(RequesterInfo.APP_VERSION_KEY)).isEqualTo("converse/1.0.0");
    assertThat(headers.get(TelemetryInterceptor.X_FORWARDED_FOR_KEY))
        .isEqualTo("198.51.100.7, 127.0.0.1");
    assertThat(headers.get(GatewayHandler.X_FORWARDED_HOST_KEY))
        .isEqualTo("127.0.0.1:" + address.getPort());
    assertThat(headers.get(Metadata.Key.of("x-ignored", Metadata.ASCII_STRING_MARSHALLER)))
        .isNull();
  }

  @Test
  public void peerBecomesForwardedFor() throws Exception {
    post("/xmtp.test.Echo/Echo", "{}");

    assertThat(service.lastHeaders().get(TelemetryInterceptor.X_FORWARDED_FOR_KEY))
        .isEqualTo("127.0.0.1");
  }

  @Test
  public void corsPreflight() throws Exception {
    HttpResponse<String> response = send(request("/xmtp.test.Echo/Echo")
        .header("Origin", "https://example.com")
        .header("Access-Control-Request-Method", "POST")
        .method("OPTIONS", HttpRequest.BodyPublishers.noBody()));

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.headers().firstValue("access-control-allow-origin")).hasValue("*");
    assertThat(response.headers().firstValue("access-control-allow-methods"))
        .hasValue("GET,HEAD,POST,PUT,PATCH,DELETE");
    assertThat(service.handledCount()).isEqualTo(0);
  }

  @Test
  public void responsesCarryCorsHeader() throws Exception {
    HttpResponse<String> response = get("/v2/nothing");

    assertThat(response.headers().firstValue("access-control-allow-origin")).hasValue("*");
  }

  @Test
  public void gzipWhenAccepted() throws Exception {
    HttpResponse<byte[]> response = http.send(request("/swagger.json")
            .header("Accept-Encoding", "gzip")
            .GET()
            .build(),
        HttpResponse.BodyHandlers.ofByteArray());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.headers().firstValue("content-encoding")).hasValue("gzip");
    byte[] body = ByteStreams.toByteArray(
        new GZIPInputStream(new ByteArrayInputStream(response.body())));
    assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo(SCHEMA);
  }

  @Test
  public void servesSchemaAndUi() throws Exception {
    HttpResponse<String> schema = get("/swagger.json");
    assertThat(schema.statusCode()).isEqualTo(200);
    assertThat(schema.body()).isEqualTo(SCHEMA);
    assertThat(schema.headers().firstValue("content-encoding")).isEmpty();

    HttpResponse<String> index = get("/");
    assertThat(index.statusCode()).isEqualTo(200);
    assertThat(index.headers().firstValue("content-type").get()).startsWith("text/html");
    assertThat(index.body()).contains("/swagger.json");

    HttpResponse<String> css = get("/swagger-ui/swagger-ui.css");
    assertThat(css.statusCode()).isEqualTo(200);
    assertThat(css.headers().firstValue("content-type").get()).startsWith("text/css");
  }
}
