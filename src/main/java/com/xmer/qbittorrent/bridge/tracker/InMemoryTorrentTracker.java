package com.xmer.qbittorrent.bridge.tracker;

import io.quarkus.arc.profile.IfBuildProfile;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory tracker for dev/test environments.
 * Not persistent - tracked torrents are lost on restart.
 */
@ApplicationScoped
@IfBuildProfile(anyOf = {"dev", "test"})
public class InMemoryTorrentTracker extends AbstractTorrentTracker {

    private static final Logger LOG = Logger.getLogger(InMemoryTorrentTracker.class);

    private final Set<String> members = ConcurrentHashMap.newKeySet();

    @Override
    protected void addMember(String hash) {
        members.add(hash);
        LOG.debugf("Hash tracked: %s", hash);
    }

    @Override
    protected void removeMember(String hash) {
        members.remove(hash);
        LOG.debugf("Hash untracked: %s", hash);
    }

    @Override
    public List<String> trackedHashes() {
        return List.copyOf(members);
    }
}
