package com.caura.txmapper.registry;

import com.caura.txmapper.domain.ClientRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of the active client registry snapshot.
 * <p>
 * {@link #load()} parses the registry once and caches it; later calls return the cached snapshot.
 * {@link #reload()} builds a complete new snapshot and only then publishes it, so concurrent
 * readers see either the old or the new registry, never a half-built index.
 * A failed reload leaves the previous snapshot active.
 */
@Component
@Slf4j
public class ClientRegistry {

    private final ClientRegistryLoader loader;
    private final Resource source;
    private final AtomicReference<RegistrySnapshot> active = new AtomicReference<>();
    private final Object loadLock = new Object();

    public ClientRegistry(ClientRegistryLoader loader,
                          @Value("${registry.location:classpath:registry/client-map.json}") Resource source) {
        this.loader = loader;
        this.source = source;
    }

    /**
     * Returns the active snapshot, loading it on first use.
     */
    public RegistrySnapshot load() {
        RegistrySnapshot snapshot = active.get();
        if (snapshot != null) {
            return snapshot;
        }
        synchronized (loadLock) {
            snapshot = active.get();
            if (snapshot == null) {
                snapshot = loader.load(source);
                active.set(snapshot);
            }
            return snapshot;
        }
    }

    /**
     * Re-reads the registry source and atomically replaces the active snapshot.
     */
    public RegistrySnapshot reload() {
        synchronized (loadLock) {
            RegistrySnapshot fresh = loader.load(source);
            RegistrySnapshot previous = active.getAndSet(fresh);
            log.info("Client registry reloaded: {} clients (previously {})",
                    fresh.size(), previous != null ? previous.size() : 0);
            return fresh;
        }
    }

    public Optional<ClientRecord> getClient(String clientId) {
        return load().getClient(clientId);
    }

    public Optional<String> findByEmail(String email) {
        return load().findByEmail(email);
    }

    public List<String> findByName(String name) {
        return load().findByName(name);
    }

    public Optional<String> findByPlatformIdentifier(String platform, String identifier) {
        return load().findByPlatformIdentifier(platform, identifier);
    }

    public Optional<AddressMatch> findByAddress(String freeText, double minScore) {
        return load().findByAddress(freeText, minScore);
    }
}
