package io.possync.remote;

public record HealthResponse(String status, String database, String timestamp) {
    public boolean statusHealthy() {
        return "healthy".equalsIgnoreCase(status);
    }

    public boolean databaseConnected() {
        return "connected".equalsIgnoreCase(database);
    }

    public boolean isHealthy() {
        return statusHealthy() && databaseConnected();
    }
}
