package de.bsommerfeld.feedupdate.inject;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import de.bsommerfeld.feedupdate.api.FeedUpdater;
import de.bsommerfeld.feedupdate.api.LoggingUpdateDiagnostics;
import de.bsommerfeld.feedupdate.api.NoOpUpdateAnalytics;
import de.bsommerfeld.feedupdate.api.UpdateAnalytics;
import de.bsommerfeld.feedupdate.api.UpdateDiagnostics;
import de.bsommerfeld.feedupdate.core.config.UpdaterConfig;
import de.bsommerfeld.feedupdate.core.util.StorageUtils;
import de.bsommerfeld.feedupdate.download.ArtifactPaths;
import de.bsommerfeld.feedupdate.download.ContentFetcher;
import de.bsommerfeld.feedupdate.download.HttpContentFetcher;
import de.bsommerfeld.feedupdate.model.AppIdentity;
import de.bsommerfeld.feedupdate.trust.TrustGate;
import de.bsommerfeld.feedupdate.version.FileSkippedVersionStore;
import de.bsommerfeld.feedupdate.version.SkippedVersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/**
 * Guice wiring for the updater.
 *
 * <p>
 * Everything except the {@code UpdateHost} is bound here; the host
 * application binds its own implementation in one of its modules:
 *
 * <pre>{@code
 * Injector injector = Guice.createInjector(
 *         UpdaterModule.forApplication("my-app", "1.4.2"),
 *         binder -> binder.bind(UpdateHost.class).to(SwingUpdateHost.class));
 * injector.getInstance(FeedUpdater.class).checkInBackground();
 * }</pre>
 *
 * Analytics and diagnostics defaults can be replaced with
 * {@code Modules.override}.
 */
public class UpdaterModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(UpdaterModule.class);

    private final AppIdentity identity;
    private final UpdaterConfig config;
    private final Path skippedVersionFile;

    public UpdaterModule(AppIdentity identity, UpdaterConfig config, Path skippedVersionFile) {
        this.identity = identity;
        this.config = config;
        this.skippedVersionFile = skippedVersionFile;
    }

    /**
     * Loads {@code updater.toml} from the application's data directory and
     * builds the module around it.
     *
     * @throws de.bsommerfeld.feedupdate.core.config.ConfigException if the configuration cannot be loaded
     * @throws IllegalArgumentException if the version or feed URL is invalid
     */
    public static UpdaterModule forApplication(String appName, String currentVersion) {
        Path configFile = StorageUtils.getConfigFile(appName);
        LOG.info("Loading updater configuration from: {}", configFile);
        UpdaterConfig config = UpdaterConfig.load(configFile);
        return new UpdaterModule(AppIdentity.of(config, currentVersion), config,
                StorageUtils.getSkippedVersionFile(appName));
    }

    @Override
    protected void configure() {
        bind(AppIdentity.class).toInstance(identity);
        bind(UpdaterConfig.class).toInstance(config);

        bind(ContentFetcher.class).to(HttpContentFetcher.class);
        bind(UpdateDiagnostics.class).to(LoggingUpdateDiagnostics.class);
        bind(UpdateAnalytics.class).to(NoOpUpdateAnalytics.class);
        bind(SkippedVersionStore.class).toInstance(new FileSkippedVersionStore(skippedVersionFile));
    }

    @Provides
    @Singleton
    TrustGate trustGate() {
        return new TrustGate(config.getSignatureAlgorithm());
    }

    @Provides
    @Singleton
    ArtifactPaths artifactPaths() {
        return new ArtifactPaths(config.resolveDownloadDirectory());
    }

    @Provides
    @Singleton
    @Named(FeedUpdater.WORKER_EXECUTOR)
    Executor workerExecutor() {
        return Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("feedupdate-worker-%d").setDaemon(true).build());
    }
}
