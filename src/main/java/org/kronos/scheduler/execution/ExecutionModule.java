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

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.AbstractModule;
import com.google.inject.PrivateModule;

import org.asynchttpclient.AsyncHttpClient;
import org.asynchttpclient.DefaultAsyncHttpClientConfig;
import org.asynchttpclient.channel.DefaultKeepAliveStrategy;
import org.kronos.common.util.BackoffStrategy;
import org.kronos.common.util.TruncatedBinaryBackoff;
import org.kronos.scheduler.SchedulerServicesModule;
import org.kronos.scheduler.cache.JobRunner;
import org.kronos.scheduler.config.types.TimeAmount;
import org.kronos.scheduler.config.validators.PositiveAmount;

import static org.asynchttpclient.Dsl.asyncHttpClient;

/**
 * Binding module for running jobs: the execution coordinator and the local and remote executors.
 */
public class ExecutionModule extends AbstractModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-retry_initial_backoff",
        validateValueWith = PositiveAmount.class,
        description = "Initial delay before retrying a failed run attempt.")
    public TimeAmount retryInitialBackoff = new TimeAmount(1, TimeAmount.Unit.SECONDS);

    @Parameter(names = "-retry_max_backoff",
        validateValueWith = PositiveAmount.class,
        description = "Maximum delay before retrying a failed run attempt.")
    public TimeAmount retryMaxBackoff = new TimeAmount(1, TimeAmount.Unit.MINUTES);

    @Parameter(names = "-remote_connect_timeout",
        validateValueWith = PositiveAmount.class,
        description = "Connection timeout for calls made by remote jobs.")
    public TimeAmount remoteConnectTimeout = new TimeAmount(10, TimeAmount.Unit.SECONDS);
  }

  private final Options options;

  public ExecutionModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    bind(BackoffStrategy.class).toInstance(new TruncatedBinaryBackoff(
        options.retryInitialBackoff.asDuration(),
        options.retryMaxBackoff.asDuration()));
    bind(CommandRunner.class).to(LocalCommandRunner.class);
    bind(LocalCommandRunner.class).in(Singleton.class);

    install(new PrivateModule() {
      @Override
      protected void configure() {
        int connectTimeoutMs = (int) options.remoteConnectTimeout.asDuration().toMillis();
        DefaultAsyncHttpClientConfig config = new DefaultAsyncHttpClientConfig.Builder()
            .setConnectTimeout(connectTimeoutMs)
            .setHandshakeTimeout(connectTimeoutMs)
            .setKeepAliveStrategy(new DefaultKeepAliveStrategy())
            .build();
        bind(AsyncHttpClient.class).toInstance(asyncHttpClient(config));

        bind(RemoteInvoker.class).to(HttpRemoteInvoker.class);
        bind(HttpRemoteInvoker.class).in(Singleton.class);
        expose(RemoteInvoker.class);
        expose(HttpRemoteInvoker.class);
      }
    });
    SchedulerServicesModule.addSchedulerActiveServiceBinding(binder())
        .to(HttpRemoteInvoker.class);

    bind(JobRunner.class).to(ExecutionCoordinator.class);
    bind(ExecutionCoordinator.class).in(Singleton.class);
  }
}
