package io.clusterengine;

import io.clusterengine.actions.ActionEnvelope;
import io.clusterengine.api.handlers.HandlerSupport;
import io.clusterengine.capacity.CapacityResolver;
import io.clusterengine.clusters.ClusterManager;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.ResourceDriver;
import io.clusterengine.driver.SimulatedResourceDriver;
import io.clusterengine.identity.IdentityResolver;
import io.clusterengine.lock.ClusterLockManager;
import io.clusterengine.lock.EtcdClusterLockManager;
import io.clusterengine.lock.LocalClusterLockManager;
import io.clusterengine.membership.MembershipCoordinator;
import io.clusterengine.metrics.MetricsProvider;
import io.clusterengine.nodes.NodeManager;
import io.clusterengine.policies.PolicyBindingManager;
import io.clusterengine.policies.PolicyManager;
import io.clusterengine.policies.enforcement.PolicyEnforcement;
import io.clusterengine.profiles.ProfileManager;
import io.clusterengine.receivers.ReceiverManager;
import io.clusterengine.store.EtcdMetadataStore;
import io.clusterengine.store.EtcdPathResolver;
import io.clusterengine.store.InMemoryMetadataStore;
import io.clusterengine.store.MetadataStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

import static io.clusterengine.config.Constants.LOCK_BACKEND_ETCD;
import static io.clusterengine.config.Constants.STORE_BACKEND_ETCD;

/**
 * Main Spring Boot application class for the cluster engine.
 *
 * Wires the request-path managers, the REST handlers and the action dispatcher over
 * the configured metadata store and cluster lock backends.
 */
@Slf4j
@SpringBootApplication
public class ClusterEngineApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Engine");

        try {
            SpringApplication.run(ClusterEngineApplication.class, args);
            log.info("Cluster Engine started successfully");
        } catch (Exception e) {
            log.error("Failed to start Cluster Engine: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public EngineConfig config() {
        EngineConfig config = new EngineConfig();
        log.info("Loaded configuration for engine {}", config.getEngineId());
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * MetadataStore bean, in memory or backed by etcd depending on {@code engine.store.backend}.
     */
    @Bean(destroyMethod = "close")
    public MetadataStore metadataStore(EngineConfig config) {
        try {
            MetadataStore store;
            if (STORE_BACKEND_ETCD.equals(config.getStoreBackend())) {
                log.info("Initializing MetadataStore connection to etcd");
                store = EtcdMetadataStore.getInstance(config.getEtcdEndpoints());
            } else {
                log.info("Initializing in-memory MetadataStore");
                store = new InMemoryMetadataStore();
            }
            store.initialize();
            log.info("MetadataStore initialized successfully");
            return store;
        } catch (Exception e) {
            log.error("Failed to initialize MetadataStore: {}", e.getMessage(), e);
            throw new RuntimeException("MetadataStore initialization failed", e);
        }
    }

    @Bean
    public ClusterLockManager clusterLockManager(EngineConfig config, MetadataStore metadataStore, Clock clock) {
        if (LOCK_BACKEND_ETCD.equals(config.getLockBackend())) {
            if (!(metadataStore instanceof EtcdMetadataStore)) {
                throw new IllegalStateException("The etcd lock backend requires the etcd metadata store");
            }
            log.info("Initializing etcd cluster locks");
            return new EtcdClusterLockManager(((EtcdMetadataStore) metadataStore).getEtcdClient(),
                    EtcdPathResolver.getInstance());
        }
        log.info("Initializing in-process cluster locks");
        return new LocalClusterLockManager(clock);
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, EngineConfig config) {
        return new MetricsProvider(meterRegistry, config.getEngineId());
    }

    @Bean
    public ResourceDriver resourceDriver() {
        log.info("Initializing simulated ResourceDriver");
        return new SimulatedResourceDriver();
    }

    // =================================================================
    // CORE COMPONENTS
    // =================================================================

    @Bean
    public IdentityResolver identityResolver(MetadataStore metadataStore) {
        return new IdentityResolver(metadataStore);
    }

    @Bean
    public CapacityResolver capacityResolver(EngineConfig config) {
        return new CapacityResolver(config);
    }

    @Bean
    public MembershipCoordinator membershipCoordinator(MetadataStore metadataStore, IdentityResolver identityResolver,
                                                       Clock clock) {
        return new MembershipCoordinator(metadataStore, identityResolver, clock);
    }

    @Bean
    public PolicyBindingManager policyBindingManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                                                     EngineConfig config, Clock clock) {
        return new PolicyBindingManager(metadataStore, identityResolver, config, clock);
    }

    @Bean
    public PolicyEnforcement policyEnforcement(MetadataStore metadataStore, PolicyBindingManager policyBindingManager,
                                               Clock clock) {
        return new PolicyEnforcement(metadataStore, policyBindingManager, clock);
    }

    @Bean
    public ActionEnvelope actionEnvelope(MetadataStore metadataStore, EngineConfig config, Clock clock) {
        return new ActionEnvelope(metadataStore, config, clock);
    }

    /**
     * The dispatcher starts with the application and releases its locks on shutdown.
     */
    @Bean(destroyMethod = "stop")
    public ActionDispatcher actionDispatcher(MetadataStore metadataStore,
                                             ActionEnvelope actionEnvelope,
                                             ClusterLockManager clusterLockManager,
                                             IdentityResolver identityResolver,
                                             CapacityResolver capacityResolver,
                                             MembershipCoordinator membershipCoordinator,
                                             PolicyBindingManager policyBindingManager,
                                             PolicyEnforcement policyEnforcement,
                                             ResourceDriver resourceDriver,
                                             MetricsProvider metricsProvider,
                                             EngineConfig config,
                                             Clock clock) {
        ActionDispatcher dispatcher = new ActionDispatcher(metadataStore, actionEnvelope, clusterLockManager,
                identityResolver, capacityResolver, membershipCoordinator, policyBindingManager, policyEnforcement,
                resourceDriver, metricsProvider, config, clock);
        dispatcher.start();
        log.info("ActionDispatcher started for engine {}", config.getEngineId());
        return dispatcher;
    }

    // =================================================================
    // REQUEST PATH
    // =================================================================

    @Bean
    public ClusterManager clusterManager(MetadataStore metadataStore,
                                         IdentityResolver identityResolver,
                                         CapacityResolver capacityResolver,
                                         MembershipCoordinator membershipCoordinator,
                                         PolicyBindingManager policyBindingManager,
                                         ActionEnvelope actionEnvelope,
                                         EngineConfig config) {
        return new ClusterManager(metadataStore, identityResolver, capacityResolver, membershipCoordinator,
                policyBindingManager, actionEnvelope, config);
    }

    @Bean
    public NodeManager nodeManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                                   MembershipCoordinator membershipCoordinator, ActionEnvelope actionEnvelope) {
        return new NodeManager(metadataStore, identityResolver, membershipCoordinator, actionEnvelope);
    }

    @Bean
    public ProfileManager profileManager(MetadataStore metadataStore, IdentityResolver identityResolver, Clock clock) {
        return new ProfileManager(metadataStore, identityResolver, clock);
    }

    @Bean
    public PolicyManager policyManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                                       PolicyEnforcement policyEnforcement, Clock clock) {
        return new PolicyManager(metadataStore, identityResolver, policyEnforcement, clock);
    }

    @Bean
    public ReceiverManager receiverManager(MetadataStore metadataStore, IdentityResolver identityResolver,
                                           ActionEnvelope actionEnvelope, Clock clock) {
        return new ReceiverManager(metadataStore, identityResolver, actionEnvelope, clock);
    }

    @Bean
    public HandlerSupport handlerSupport(EngineConfig config) {
        return new HandlerSupport(config.isDebug());
    }
}
