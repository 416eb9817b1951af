package com.xmer.qbittorrent.bridge.tracker;

import io.quarkus.arc.profile.IfBuildProfile;
import io.quarkus.redis.datasource.RedisDataSource;
import io.quarkus.redis.datasource.set.SetCommands;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Redis-backed tracker. Membership lives in a single Redis set, so it survives restarts and each
 * add/remove is one atomic command.
 */
@ApplicationScoped
@IfBuildProfile("prod")
public class RedisTorrentTracker extends AbstractTorrentTracker {

    private static final Logger LOG = Logger.getLogger(RedisTorrentTracker.class);

    private final SetCommands<String, String> sets;
    private final String key;

    public RedisTorrentTracker(
            RedisDataSource dataSource,
            @ConfigProperty(name = "qbittorrent.tracker.redis-key",
                    defaultValue = "qbittorrent-consumer:tracked-torrents") String key
    ) {
        this.sets = dataSource.set(String.class);
        this.key = key;
    }

    @Override
    protected void addMember(String hash) {
        sets.sadd(key, hash);
        LOG.debugf("Hash tracked: %s", hash);
    }

    @Override
    protected void removeMember(String hash) {
        sets.srem(key, hash);
        LOG.debugf("Hash untracked: %s", hash);
    }

    @Override
    public List<String> trackedHashes() {
        return List.copyOf(sets.smembers(key));
    }

    /**
     * The connection itself belongs to the Quarkus Redis client and is closed with the application.
     */
    @Override
    public void close() {
        LOG.infof("Tracker released (key=%s), Redis connection is closed by Quarkus", key);
    }
}
