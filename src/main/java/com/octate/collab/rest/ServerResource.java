package com.octate.collab.rest;

import com.octate.collab.room.MemoryMonitor;
import com.octate.collab.room.RoomManager;
import com.octate.collab.room.ServerStats;
import com.octate.collab.websocket.ConnectionRegistry;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health, statistics and maintenance endpoints.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
public class ServerResource {

    private static final Logger LOG = Logger.getLogger(ServerResource.class);
    private static final double MB = 1024.0 * 1024.0;

    public record Memory(double heapUsedMB, double heapTotalMB, double heapPercent, double nonHeapMB) {

        static Memory of(ServerStats.MemoryUsage usage) {
            return new Memory(megabytes(usage.heapUsed()), megabytes(usage.heapTotal()),
                round(usage.heapPercent()), megabytes(usage.nonHeapUsed()));
        }
    }

    public record Health(String status, long timestamp, double uptime, Memory memory) {}

    public record Server(long uptime, int activeRooms, int totalRooms, int totalConnections,
                         int openSockets, long timestamp) {}

    public record Thresholds(double warningMB, double criticalMB, long cooldownMs) {}

    public record Stats(Server server, Memory memory, ServerStats.CpuUsage cpu, Thresholds thresholds) {}

    public record CleanupStats(int activeRooms, int totalConnections) {}

    public record CleanupResult(String message, CleanupStats stats) {}

    public record Info(String name, String version, String description, List<String> features,
                       Map<String, String> endpoints) {}

    private final RoomManager roomManager;
    private final MemoryMonitor memoryMonitor;
    private final ConnectionRegistry registry;

    public ServerResource(RoomManager roomManager, MemoryMonitor memoryMonitor, ConnectionRegistry registry) {
        this.roomManager = roomManager;
        this.memoryMonitor = memoryMonitor;
        this.registry = registry;
    }

    @GET
    @Path("health")
    public Health health() {
        ServerStats stats = roomManager.getStats();
        return new Health("ok", stats.timestamp(), stats.uptime() / 1000.0, Memory.of(stats.memoryUsage()));
    }

    @GET
    @Path("stats")
    public Stats stats() {
        ServerStats stats = roomManager.getStats();
        MemoryMonitor.Thresholds limits = memoryMonitor.thresholds();
        return new Stats(
            new Server(stats.uptime(), stats.activeRooms(), stats.totalRooms(), stats.totalConnections(),
                registry.openCount(), stats.timestamp()),
            Memory.of(stats.memoryUsage()),
            stats.cpuUsage(),
            new Thresholds(megabytes(limits.warningBytes()), megabytes(limits.criticalBytes()),
                limits.cooldown().toMillis()));
    }

    @GET
    @Path("info")
    public Info info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "GET /health");
        endpoints.put("stats", "GET /stats");
        endpoints.put("rooms", "GET /rooms");
        endpoints.put("roomDetail", "GET /rooms/{roomId}");
        endpoints.put("roomStats", "GET /rooms/{roomId}/stats");
        endpoints.put("roomPeers", "GET /rooms/{roomId}/peers");
        endpoints.put("cleanup", "POST /maintenance/cleanup");
        endpoints.put("info", "GET /info");
        endpoints.put("signaling", "WS /signaling");
        return new Info("Collaboration Relay", "1.0.0",
            "Operational-transform relay and signaling server for collaborative editing",
            List.of("Operational Transform", "Room Management", "Peer Discovery", "Signaling", "Active/Idle States"),
            endpoints);
    }

    @POST
    @Path("maintenance/cleanup")
    public CleanupResult cleanup() {
        LOG.info("Manual cleanup triggered");
        roomManager.cleanup();
        ServerStats stats = roomManager.getStats();
        return new CleanupResult("Cleanup completed",
            new CleanupStats(stats.activeRooms(), stats.totalConnections()));
    }

    static double megabytes(long bytes) {
        return round(bytes / MB);
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
