package com.qqsuccubus.roomcast.socket.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authenticated connections of this node, by id and by wallet.
 * <p>
 * Mutated only through {@link #add} and {@link #remove}. The per-wallet index is maintained inside
 * {@link ConcurrentHashMap#compute} so concurrent add/remove for one wallet never lose an entry.
 * </p>
 */
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Connection> byId = new ConcurrentHashMap<>();
    private final Map<String, Set<Connection>> byWallet = new ConcurrentHashMap<>();
    private volatile boolean admitting = true;

    /**
     * @throws IllegalArgumentException if the connection has no actor or its id is already registered
     */
    public void add(Connection connection) {
        String wallet = connection.getWallet();
        if (wallet == null) {
            throw new IllegalArgumentException("Connection " + connection.getId() + " is not authenticated");
        }
        if (byId.putIfAbsent(connection.getId(), connection) != null) {
            throw new IllegalArgumentException("Connection already registered: " + connection.getId());
        }
        byWallet.compute(wallet, (key, connections) -> {
            Set<Connection> set = connections != null ? connections : ConcurrentHashMap.newKeySet();
            set.add(connection);
            return set;
        });
        log.debug("Registered connection {} for {} ({} total)", connection.getId(), wallet, byId.size());
    }

    /**
     * Removes a connection. Only the first call for an id returns it; later calls are no-ops.
     */
    public Optional<Connection> remove(String connectionId) {
        Connection connection = byId.remove(connectionId);
        if (connection == null) {
            return Optional.empty();
        }
        byWallet.computeIfPresent(connection.getWallet(), (key, connections) -> {
            connections.remove(connection);
            return connections.isEmpty() ? null : connections;
        });
        log.debug("Removed connection {} ({} total)", connectionId, byId.size());
        return Optional.of(connection);
    }

    public Optional<Connection> get(String connectionId) {
        return Optional.ofNullable(byId.get(connectionId));
    }

    public List<Connection> byActor(String wallet) {
        Set<Connection> connections = byWallet.get(wallet);
        return connections == null ? Collections.emptyList() : new ArrayList<>(connections);
    }

    public List<Connection> all() {
        return new ArrayList<>(byId.values());
    }

    public int size() {
        return byId.size();
    }

    public int uniqueActorCount() {
        return byWallet.size();
    }

    /**
     * Refuses new admissions from now on. Registered connections stay until removed. A caller that
     * registers a connection and then finds admission stopped must close it itself.
     */
    public void stopAdmitting() {
        if (admitting) {
            admitting = false;
            log.info("Connection admission stopped ({} registered)", byId.size());
        }
    }

    public boolean isAdmitting() {
        return admitting;
    }
}
