/**
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
package org.kronos.scheduler.execution;

import java.io.IOException;
import java.util.List;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import com.google.common.collect.Lists;
import com.google.common.io.CharStreams;

import org.asynchttpclient.DefaultAsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClientConfig;
import org.asynchttpclient.channel.DefaultKeepAliveStrategy;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.kronos.common.stats.StatsRegistry;
import org.kronos.scheduler.job.RemoteProperties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HttpRemoteInvokerTest {
  private static final int TIMEOUT = 5000;

  private Server jettyServer;
  private StatsRegistry stats;
  private HttpRemoteInvoker invoker;
  private final List<String> received = Lists.newCopyOnWriteArrayList();

  @Before
  public void setUp() throws Exception {
    DefaultAsyncHttpClientConfig testConfig = new DefaultAsyncHttpClientConfig.Builder()
        .setConnectTimeout(TIMEOUT)
        .setHandshakeTimeout(TIMEOUT)
        .setRequestTimeout(TIMEOUT)
        .setKeepAliveStrategy(new DefaultKeepAliveStrategy())
        .build();
    stats = new StatsRegistry();
    invoker = new HttpRemoteInvoker(new DefaultAsyncHttpClient(testConfig), stats);
    invoker.startAsync().awaitRunning();

    jettyServer = new Server(0); // Ephemeral port.
    jettyServer.setHandler(new AbstractHandler() {
      @Override
      public void handle(
          String target,
          Request baseRequest,
          HttpServletRequest request,
          HttpServletResponse response) throws IOException {

        String body = CharStreams.toString(request.getReader());
        received.add(request.getMethod() + " " + target + " "
            + request.getHeader("X-Token") + " " + body);
        response.setStatus("/fail".equals(target) ? 500 : 200);
        baseRequest.setHandled(true);
      }
    });
    jettyServer.start();
  }

  @After
  public void tearDown() throws Exception {
    invoker.stopAsync().awaitTerminated();
    jettyServer.stop();
  }

  private String url(String path) {
    int port = ((ServerConnector) jettyServer.getConnectors()[0]).getLocalPort();
    return "http://localhost:" + port + path;
  }

  @Test
  public void testSuccessfulCall() throws Exception {
    invoker.invoke(RemoteProperties.newBuilder()
        .setUrl(url("/hook"))
        .setMethod("POST")
        .setHeader("X-Token", "secret")
        .setBody("{\"a\":1}")
        .build());

    assertEquals(1, received.size());
    assertEquals("POST /hook secret {\"a\":1}", received.get(0));
    assertEquals(1L, stats.getLongValue(HttpRemoteInvoker.ATTEMPTS_STAT_NAME));
    assertEquals(0L, stats.getLongValue(HttpRemoteInvoker.ERRORS_STAT_NAME));
    assertEquals(0L, stats.getLongValue(HttpRemoteInvoker.UNEXPECTED_STATUS_STAT_NAME));
  }

  @Test
  public void testUnexpectedStatus() throws Exception {
    try {
      invoker.invoke(RemoteProperties.newBuilder().setUrl(url("/fail")).build());
      fail("Expected JobExecutionException");
    } catch (JobExecutionException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("unexpected status 500"));
    }
    assertEquals(1L, stats.getLongValue(HttpRemoteInvoker.UNEXPECTED_STATUS_STAT_NAME));
  }

  @Test
  public void testCustomExpectedStatus() throws Exception {
    invoker.invoke(RemoteProperties.newBuilder()
        .setUrl(url("/fail"))
        .addExpectedResponseCode(500)
        .build());
    assertEquals(0L, stats.getLongValue(HttpRemoteInvoker.UNEXPECTED_STATUS_STAT_NAME));
  }

  @Test
  public void testUnreachable() throws Exception {
    try {
      invoker.invoke(RemoteProperties.newBuilder().setUrl("http://localhost:1/").build());
      fail("Expected JobExecutionException");
    } catch (JobExecutionException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith("Call to GET http://localhost:1/"));
    }
    assertEquals(1L, stats.getLongValue(HttpRemoteInvoker.ERRORS_STAT_NAME));
    assertEquals(0L, stats.getLongValue(HttpRemoteInvoker.UNEXPECTED_STATUS_STAT_NAME));
  }
}
