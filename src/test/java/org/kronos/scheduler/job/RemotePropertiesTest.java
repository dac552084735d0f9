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
package org.kronos.scheduler.job;

import java.net.URI;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class RemotePropertiesTest {

  @Test
  public void testDefaults() {
    RemoteProperties remote = RemoteProperties.newBuilder().setUrl("https://example.com/x").build();
    assertEquals(URI.create("https://example.com/x"), remote.getTargetURI());
    assertEquals("GET", remote.getMethod());
    assertEquals(ImmutableMap.of(), remote.getHeaders());
    assertEquals(Optional.empty(), remote.getBody());
    assertEquals(RemoteProperties.DEFAULT_TIMEOUT_MSEC, remote.getTimeoutMsec());
    assertEquals(ImmutableSet.of(200), remote.getExpectedResponseCodes());
  }

  @Test
  public void testCustomized() {
    RemoteProperties remote = RemoteProperties.newBuilder()
        .setUrl("http://example.com/hook")
        .setMethod("post")
        .setHeader("Content-Type", "application/json")
        .setHeaders(ImmutableMap.of("X-Token", "abc"))
        .setBody("{}")
        .setTimeoutMsec(500)
        .addExpectedResponseCode(201)
        .addExpectedResponseCode(204)
        .build();

    assertEquals("POST", remote.getMethod());
    assertEquals(
        ImmutableMap.of("Content-Type", "application/json", "X-Token", "abc"),
        remote.getHeaders());
    assertEquals(Optional.of("{}"), remote.getBody());
    assertEquals(500, remote.getTimeoutMsec());
    assertEquals(ImmutableSet.of(201, 204), remote.getExpectedResponseCodes());
  }

  @Test
  public void testEmptyBodyIsAbsent() {
    assertEquals(
        Optional.empty(),
        RemoteProperties.newBuilder().setUrl("http://example.com").setBody("").build().getBody());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingUrl() {
    RemoteProperties.newBuilder().build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedUrl() {
    RemoteProperties.newBuilder().setUrl("http://exa mple.com").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnsupportedScheme() {
    RemoteProperties.newBuilder().setUrl("ftp://example.com/file").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveTimeout() {
    RemoteProperties.newBuilder().setUrl("http://example.com").setTimeoutMsec(0).build();
  }
}
