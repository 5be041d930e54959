package io.github.orkee.live;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * One running preview server.
 */
public final class ServerInfo {

    @SerializedName("project_id")
    private final String projectId;

    private final Integer port;

    private final String status;

    @SerializedName("framework_name")
    private final String framework;

    /**
     * Creates a new ServerInfo instance.
     *
     * @param projectId the project the server belongs to
     * @param port      the port, may be null while starting
     * @param status    the server status, may be null
     * @param framework the detected framework, may be null
     */
    public ServerInfo(String projectId, Integer port, String status, String framework) {
        this.projectId = projectId;
        this.port = port;
        this.status = status;
        this.framework = framework;
    }

    public String getProjectId() {
        return projectId;
    }

    public Integer getPort() {
        return port;
    }

    public String getStatus() {
        return status;
    }

    public String getFramework() {
        return framework;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerInfo that = (ServerInfo) o;
        return Objects.equals(projectId, that.projectId) &&
                Objects.equals(port, that.port) &&
                Objects.equals(status, that.status) &&
                Objects.equals(framework, that.framework);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectId, port, status, framework);
    }

    @Override
    public String toString() {
        return "ServerInfo{" +
                "projectId='" + projectId + '\'' +
                ", port=" + port +
                ", status='" + status + '\'' +
                '}';
    }
}
