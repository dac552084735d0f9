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
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Describes the HTTP call made when a {@link JobType#REMOTE remote} job runs.
 */
public final class RemoteProperties {
  public static final String DEFAULT_METHOD = "GET";
  public static final int DEFAULT_TIMEOUT_MSEC = 30000;
  public static final Set<Integer> DEFAULT_EXPECTED_RESPONSE_CODES = ImmutableSet.of(200);

  private final URI targetURI;
  private final String method;
  private final Map<String, String> headers;
  private final Optional<String> body;
  private final int timeoutMsec;
  private final Set<Integer> expectedResponseCodes;

  private RemoteProperties(Builder builder) throws URISyntaxException {
    checkArgument(!Strings.isNullOrEmpty(builder.url), "Remote job requires a URL");
    this.targetURI = new URI(builder.url);
    checkArgument(
        "http".equalsIgnoreCase(targetURI.getScheme())
            || "https".equalsIgnoreCase(targetURI.getScheme()),
        "Remote job URL must be http or https: %s", builder.url);
    this.method = Strings.isNullOrEmpty(builder.method)
        ? DEFAULT_METHOD
        : builder.method.toUpperCase();
    this.headers = ImmutableMap.copyOf(builder.headers);
    this.body = Optional.ofNullable(Strings.emptyToNull(builder.body));
    checkArgument(builder.timeoutMsec > 0, "Remote job timeout must be positive");
    this.timeoutMsec = builder.timeoutMsec;
    this.expectedResponseCodes = builder.expectedResponseCodes.isEmpty()
        ? DEFAULT_EXPECTED_RESPONSE_CODES
        : ImmutableSet.copyOf(builder.expectedResponseCodes);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Returns URI the request is sent to.
   *
   * @return URI
   */
  public URI getTargetURI() {
    return targetURI;
  }

  /**
   * Returns the upper-cased HTTP method, {@code GET} when none was given.
   *
   * @return HTTP method.
   */
  public String getMethod() {
    return method;
  }

  /**
   * Return key:value pairs of headers to set on the request.
   *
   * @return Map
   */
  public Map<String, String> getHeaders() {
    return headers;
  }

  public Optional<String> getBody() {
    return body;
  }

  /**
   * Returns the request timeout.
   *
   * @return Timeout in milliseconds.
   */
  public int getTimeoutMsec() {
    return timeoutMsec;
  }

  /**
   * Returns the status codes that count as a successful call.
   *
   * @return Set of HTTP status codes.
   */
  public Set<Integer> getExpectedResponseCodes() {
    return expectedResponseCodes;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof RemoteProperties)) {
      return false;
    }
    RemoteProperties other = (RemoteProperties) o;
    return timeoutMsec == other.timeoutMsec
        && targetURI.equals(other.targetURI)
        && method.equals(other.method)
        && headers.equals(other.headers)
        && body.equals(other.body)
        && expectedResponseCodes.equals(other.expectedResponseCodes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(targetURI, method, headers, body, timeoutMsec, expectedResponseCodes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("targetURI", targetURI)
        .add("method", method)
        .add("headers", headers)
        .add("timeoutMsec", timeoutMsec)
        .add("expectedResponseCodes", expectedResponseCodes)
        .toString();
  }

  public static class Builder {
    private String url;
    private String method;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String body;
    private int timeoutMsec = DEFAULT_TIMEOUT_MSEC;
    private final Set<Integer> expectedResponseCodes = new LinkedHashSet<>();

    public Builder setUrl(String url) {
      this.url = url;
      return this;
    }

    public Builder setMethod(String method) {
      this.method = method;
      return this;
    }

    public Builder setHeader(String key, String value) {
      headers.put(requireNonNull(key), requireNonNull(value));
      return this;
    }

    /**
     * This method will add the supplied headers to the current headers.
     *
     * @param values The headers to add.
     * @return The modified builder.
     */
    public Builder setHeaders(Map<String, String> values) {
      for (Map.Entry<String, String> entry : values.entrySet()) {
        setHeader(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public Builder setBody(String body) {
      this.body = body;
      return this;
    }

    public Builder setTimeoutMsec(int timeoutMsec) {
      this.timeoutMsec = timeoutMsec;
      return this;
    }

    public Builder addExpectedResponseCode(int code) {
      expectedResponseCodes.add(code);
      return this;
    }

    /**
     * Builds the properties.
     *
     * @return Validated remote properties.
     * @throws IllegalArgumentException If the URL is missing or malformed, or the timeout is not
     *     positive.
     */
    public RemoteProperties build() {
      try {
        return new RemoteProperties(this);
      } catch (URISyntaxException e) {
        throw new IllegalArgumentException("Malformed remote job URL: " + url, e);
      }
    }
  }
}
