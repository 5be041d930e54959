package io.github.orkee.live;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Snapshot of all active preview servers, as returned by {@code GET /api/preview/servers}.
 */
public final class ServerList {

    private final List<ServerInfo> servers;

    /**
     * Creates a new ServerList instance.
     *
     * @param servers the active servers
     */
    public ServerList(List<ServerInfo> servers) {
        this.servers = servers == null ? List.of() : List.copyOf(servers);
    }

    /**
     * Returns the active servers.
     *
     * @return the servers, never null
     */
    public List<ServerInfo> getServers() {
        // gson bypasses the constructor, so the field can be null
        return servers == null ? List.of() : servers;
    }

    /**
     * Returns the ids of projects with an active server.
     *
     * @return the project ids
     */
    public List<String> getProjectIds() {
        return getServers().stream().map(ServerInfo::getProjectId).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerList that = (ServerList) o;
        return Objects.equals(getServers(), that.getServers());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getServers());
    }

    @Override
    public String toString() {
        return "ServerList{" + getProjectIds() + '}';
    }
}
