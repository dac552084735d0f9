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

import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractIdleService;

import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.BoundRequestBuilder;
import org.asynchttpclient.Response;
import org.kronos.common.stats.StatsProvider;
import org.kronos.scheduler.job.RemoteProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Invokes remote jobs over HTTP.  Only the response status is inspected.
 */
class HttpRemoteInvoker extends AbstractIdleService implements RemoteInvoker {
  private static final Logger LOG = LoggerFactory.getLogger(HttpRemoteInvoker.class);

  @VisibleForTesting
  static final String ATTEMPTS_STAT_NAME = "remote_job_calls";
  @VisibleForTesting
  static final String ERRORS_STAT_NAME = "remote_job_call_errors";
  @VisibleForTesting
  static final String UNEXPECTED_STATUS_STAT_NAME = "remote_job_unexpected_status";

  private final AsyncHttpClient httpClient;
  private final AtomicLong attemptsCounter;
  private final AtomicLong errorsCounter;
  private final AtomicLong unexpectedStatusCounter;

  @Inject
  HttpRemoteInvoker(AsyncHttpClient httpClient, StatsProvider statsProvider) {
    this.httpClient = requireNonNull(httpClient);
    this.attemptsCounter = statsProvider.makeCounter(ATTEMPTS_STAT_NAME);
    this.errorsCounter = statsProvider.makeCounter(ERRORS_STAT_NAME);
    this.unexpectedStatusCounter = statsProvider.makeCounter(UNEXPECTED_STATUS_STAT_NAME);
  }

  private BoundRequestBuilder createRequest(RemoteProperties properties) {
    BoundRequestBuilder request = httpClient
        .prepare(properties.getMethod(), properties.getTargetURI().toString())
        .setSingleHeaders(properties.getHeaders())
        .setRequestTimeout(properties.getTimeoutMsec());
    properties.getBody().ifPresent(request::setBody);
    return request;
  }

  @Override
  public void invoke(RemoteProperties properties)
      throws JobExecutionException, InterruptedException {

    attemptsCounter.incrementAndGet();
    String target = properties.getMethod() + " " + properties.getTargetURI();
    Response response;
    try {
      response = createRequest(properties).execute().get();
    } catch (ExecutionException e) {
      errorsCounter.incrementAndGet();
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw new JobExecutionException("Call to " + target + " failed: " + cause, cause);
    } catch (RuntimeException e) {
      errorsCounter.incrementAndGet();
      throw new JobExecutionException("Call to " + target + " failed: " + e, e);
    }

    int status = response.getStatusCode();
    LOG.debug("Call to {} returned {}", target, status);
    if (!properties.getExpectedResponseCodes().contains(status)) {
      unexpectedStatusCounter.incrementAndGet();
      throw new JobExecutionException(
          "Call to " + target + " returned unexpected status " + status);
    }
  }

  @Override
  protected void startUp() {
    // No-op
  }

  @Override
  protected void shutDown() throws Exception {
    LOG.info("Shutting down remote job http client.");
    httpClient.close();
  }
}
