/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package logstream.server;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.Service;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.net.HostAndPort;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDatagramChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import logstream.LogStreamConstants;
import logstream.backend.JournaldBackend;
import logstream.backend.SyslogBackend;
import logstream.config.ServerConfig;
import logstream.entry.EntryCodec;
import logstream.interfaces.Backend;
import logstream.router.MessageRouter;
import logstream.storage.RotatingFileBackend;
import logstream.util.HostIdentity;
import logstream.util.PoolFiberSupplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The whole daemon: session registry, backends, router and acceptor, started in that order and
 * stopped in reverse. The file backend and the acceptor are required; an auxiliary backend that
 * fails to start is left out of routing with a warning.
 */
public class LogStreamServer extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(LogStreamServer.class);

  private final ServerConfig config;
  private final Clock clock;
  private final ServerCounters counters = new ServerCounters();
  private final EntryCodec codec = new EntryCodec();

  // These should be final, but they are created in doStart().
  private ExecutorService fiberPool;
  private PoolFiberSupplier fiberSupplier;
  private ListeningExecutorService compressionExecutor;
  private EventLoopGroup acceptGroup;
  private EventLoopGroup workerGroup;
  private SessionRegistry sessionRegistry;
  private RotatingFileBackend fileBackend;
  private final List<Backend> auxiliaryBackends = new ArrayList<>();
  private volatile MessageRouter router;
  private LogStreamAcceptor acceptor;

  public LogStreamServer(ServerConfig config) {
    this(config, Clock.systemUTC());
  }

  public LogStreamServer(ServerConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  public ServerConfig getConfig() {
    return config;
  }

  public ServerCounters getCounters() {
    return counters;
  }

  public SessionRegistry getSessionRegistry() {
    return sessionRegistry;
  }

  @Nullable
  public RotatingFileBackend getFileBackend() {
    return fileBackend;
  }

  /**
   * The backends entries are routed to; empty until the server is running.
   */
  public ImmutableList<Backend> getActiveBackends() {
    MessageRouter current = router;
    return current == null ? ImmutableList.of() : current.getBackends();
  }

  @Override
  protected void doStart() {
    if (!Epoll.isAvailable()) {
      LOG.error("The native epoll transport is unavailable", Epoll.unavailabilityCause());
      notifyFailed(Epoll.unavailabilityCause());
      return;
    }
    LOG.info("Starting with {}", config);
    createResources();

    ListenableFuture<Void> started = Futures.transformAsync(
        startModule(sessionRegistry),
        ignore -> fileBackend == null ? Futures.immediateVoidFuture() : startModule(fileBackend),
        MoreExecutors.directExecutor());
    started = Futures.transformAsync(started, ignore -> startAuxiliaryBackends(), MoreExecutors.directExecutor());
    started = Futures.transformAsync(started, ignore -> startAcceptor(), MoreExecutors.directExecutor());

    Futures.addCallback(started, new FutureCallback<Void>() {
      @Override
      public void onSuccess(Void result) {
        LOG.info("Accepting connections on {}", config.getSocketPath());
        notifyStarted();
      }

      @Override
      public void onFailure(Throwable t) {
        LOG.error("Startup failed, shutting down", t);
        runInBackground("logstream-startup-failure", () -> {
          shutDown();
          notifyFailed(t);
        });
      }
    }, MoreExecutors.directExecutor());
  }

  @Override
  protected void doStop() {
    runInBackground("logstream-shutdown", () -> {
      shutDown();
      notifyStopped();
    });
  }

  private void createResources() {
    fiberPool = Executors.newFixedThreadPool(LogStreamConstants.SERVER_THREAD_POOL_SIZE,
        new ThreadFactoryBuilder().setNameFormat("logstream-fiber-%d").setDaemon(true).build());
    fiberSupplier = new PoolFiberSupplier(fiberPool);
    compressionExecutor = MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(LogStreamConstants.COMPRESSION_THREAD_POOL_SIZE,
            new ThreadFactoryBuilder().setNameFormat("logstream-compress-%d").setDaemon(true).build()));
    acceptGroup = new EpollEventLoopGroup(1,
        new ThreadFactoryBuilder().setNameFormat("logstream-accept-%d").build());
    workerGroup = new EpollEventLoopGroup(0,
        new ThreadFactoryBuilder().setNameFormat("logstream-io-%d").build());

    sessionRegistry = new SessionRegistry(fiberSupplier);
    if (config.isFileEnabled()) {
      fileBackend = new RotatingFileBackend(config.fileBackendConfig(), fiberSupplier, compressionExecutor, clock);
    } else {
      LOG.warn("File backend disabled: entries are delivered best-effort only");
    }
    if (config.isJournaldEnabled()) {
      auxiliaryBackends.add(new JournaldBackend(workerGroup, config.getJournaldSocketPath(),
          config.getJournaldIdentifier()));
    }
    if (config.isSyslogEnabled()) {
      HostAndPort syslogServer = config.getSyslogHostAndPort();
      auxiliaryBackends.add(new SyslogBackend(workerGroup, EpollDatagramChannel.class,
          config.getSyslogFacility(), syslogServer.getHost(), syslogServer.getPort()));
    }
  }

  private ListenableFuture<Void> startAuxiliaryBackends() {
    List<ListenableFuture<Void>> starts = new ArrayList<>();
    for (Backend backend : auxiliaryBackends) {
      starts.add(startModule(backend));
    }
    return Futures.transform(Futures.successfulAsList(starts), ignore -> {
      for (Backend backend : auxiliaryBackends) {
        if (!backend.isRunning()) {
          LOG.warn("{} backend is unavailable and will not receive entries", backend.kind());
        }
      }
      return null;
    }, MoreExecutors.directExecutor());
  }

  private ListenableFuture<Void> startAcceptor() {
    ImmutableList.Builder<Backend> running = ImmutableList.builder();
    if (fileBackend != null) {
      running.add(fileBackend);
    }
    for (Backend backend : auxiliaryBackends) {
      if (backend.isRunning()) {
        running.add(backend);
      }
    }
    router = new MessageRouter(running.build(), counters);
    acceptor = new LogStreamAcceptor(
        config.getSocketPath(),
        config.getBufferSize(),
        acceptGroup,
        workerGroup,
        new SessionChannelInitializer(
            new ConnectionAdmission(config.getMaxConnections()),
            counters,
            router,
            sessionRegistry,
            codec,
            clock,
            HostIdentity.hostname(),
            config.getBufferSize()));
    return startModule(acceptor);
  }

  private static ListenableFuture<Void> startModule(Service service) {
    SettableFuture<Void> startedFuture = SettableFuture.create();
    service.addListener(new ServiceLifecycleListener(service,
            () -> startedFuture.set(null),
            startedFuture::setException),
        MoreExecutors.directExecutor());
    service.startAsync();
    return startedFuture;
  }

  /**
   * Stop accepting, close sessions, then stop the backends and release threads. Each stage gets
   * the configured grace period; whatever remains after it is abandoned.
   */
  private void shutDown() {
    long grace = config.getShutdownGraceSeconds();

    if (acceptor != null) {
      awaitStopped(acceptor, grace);
    }
    if (sessionRegistry != null && sessionRegistry.isRunning()) {
      awaitStage("closing sessions", sessionRegistry.closeAll(), grace);
      awaitStopped(sessionRegistry, grace);
    }
    for (Backend backend : auxiliaryBackends) {
      awaitStopped(backend, grace);
    }
    if (fileBackend != null) {
      awaitStopped(fileBackend, grace);
    }

    if (workerGroup != null) {
      workerGroup.shutdownGracefully(0, grace, TimeUnit.SECONDS).awaitUninterruptibly(grace + 1, TimeUnit.SECONDS);
      acceptGroup.shutdownGracefully(0, grace, TimeUnit.SECONDS).awaitUninterruptibly(grace + 1, TimeUnit.SECONDS);
    }
    if (compressionExecutor != null) {
      compressionExecutor.shutdown();
      try {
        if (!compressionExecutor.awaitTermination(grace, TimeUnit.SECONDS)) {
          LOG.warn("Compression still running after {}s, abandoning it", grace);
          compressionExecutor.shutdownNow();
        }
        if (!fiberSupplier.shutdown(grace, TimeUnit.SECONDS)) {
          LOG.warn("Fiber pool still busy after {}s, abandoning remaining work", grace);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        compressionExecutor.shutdownNow();
        fiberPool.shutdownNow();
      }
    }
    LOG.info("Shutdown complete: {}", counters);
  }

  private static void awaitStopped(Service service, long graceSeconds) {
    try {
      service.stopAsync().awaitTerminated(graceSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      LOG.warn("{} did not stop within {}s, abandoning it", service, graceSeconds);
    } catch (IllegalStateException e) {
      LOG.debug("{} had already failed", service, e);
    }
  }

  private static void awaitStage(String stage, ListenableFuture<?> future, long graceSeconds) {
    try {
      future.get(graceSeconds, TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      LOG.warn("{} did not finish within {}s", stage, graceSeconds);
    } catch (ExecutionException e) {
      LOG.warn("{} failed", stage, e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted while {}", stage);
    }
  }

  private static void runInBackground(String name, Runnable task) {
    new ThreadFactoryBuilder().setNameFormat(name).build().newThread(task).start();
  }

  @Override
  public String toString() {
    return "LogStreamServer{" + config.getSocketPath() + '}';
  }
}
