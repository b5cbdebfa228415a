package com.locofleet.fleethealth.probe;

import com.locofleet.fleethealth.config.FleetMonitorProperties;
import com.locofleet.fleethealth.discovery.DiscoveryCache;
import com.locofleet.fleethealth.discovery.FleetInstance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fast reachability probe: RFB handshake banner on the display port plus a GET of the
 * health endpoint, both bounded by {@code fleet.connectivity.timeout}.
 */
@Slf4j
@Service
public class ConnectivityProber {

    private static final Pattern RFB_BANNER = Pattern.compile("^RFB (\\d{3}\\.\\d{3})");
    private static final int BANNER_LENGTH = 12;

    private final DiscoveryCache discoveryCache;
    private final RestTemplate restTemplate;
    private final ExecutorService probeExecutor;
    private final Clock clock;
    private final Duration timeout;
    private final String healthPath;

    private volatile Map<String, ConnectivityReport> latestReports = Map.of();
    private volatile Instant lastProbeAt;

    public ConnectivityProber(DiscoveryCache discoveryCache,
                              @Qualifier("connectivityRestTemplate") RestTemplate restTemplate,
                              @Qualifier("fleetProbeExecutor") ExecutorService probeExecutor,
                              Clock clock,
                              FleetMonitorProperties properties) {
        this.discoveryCache = discoveryCache;
        this.restTemplate = restTemplate;
        this.probeExecutor = probeExecutor;
        this.clock = clock;
        this.timeout = properties.getConnectivity().getTimeout();
        this.healthPath = properties.getHealth().getPath();
    }

    /**
     * Probes every instance of the current snapshot in parallel and replaces the latest reports.
     */
    public List<ConnectivityReport> probeAll() {
        List<FleetInstance> instances = discoveryCache.getInstances().getInstances();
        List<CompletableFuture<ConnectivityReport>> futures = new ArrayList<>(instances.size());
        for (FleetInstance instance : instances) {
            try {
                futures.add(CompletableFuture.supplyAsync(() -> probe(instance), probeExecutor));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.completedFuture(unknown(instance, "Probe rejected: executor saturated")));
            }
        }

        // Each probe is bounded by two timeouts; allow some slack before giving up on it
        long waitMs = timeout.toMillis() * 3;
        List<ConnectivityReport> reports = new ArrayList<>(instances.size());
        Map<String, ConnectivityReport> byInstance = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            ConnectivityReport report;
            try {
                report = futures.get(i).get(waitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                report = unknown(instances.get(i), "Probe interrupted");
            } catch (Exception e) {
                futures.get(i).cancel(true);
                report = unknown(instances.get(i), "Probe did not complete: " + e.getMessage());
            }
            reports.add(report);
            byInstance.put(report.getInstanceId(), report);
        }

        latestReports = Map.copyOf(byInstance);
        lastProbeAt = clock.instant();
        long reachable = reports.stream().filter(ConnectivityReport::isReachable).count();
        log.debug("Connectivity probe: {}/{} instances reachable", reachable, reports.size());
        return reports;
    }

    public ConnectivityReport probe(FleetInstance instance) {
        ConnectivityReport.ConnectivityReportBuilder report = ConnectivityReport.builder()
            .instanceId(instance.getId());

        long displayStart = System.nanoTime();
        probeDisplay(instance, report);
        report.displayLatencyMs(elapsedMs(displayStart));

        long healthStart = System.nanoTime();
        probeHealthEndpoint(instance, report);
        report.healthLatencyMs(elapsedMs(healthStart));

        return report.checkedAt(clock.instant()).build();
    }

    public Map<String, ConnectivityReport> getLatestReports() {
        return latestReports;
    }

    public ConnectivitySummary getSummary() {
        Map<String, ConnectivityReport> reports = latestReports;
        int total = reports.size();
        int reachable = (int) reports.values().stream().filter(ConnectivityReport::isReachable).count();
        int display = (int) reports.values().stream()
            .filter(report -> report.getDisplayStatus() == ProbeStatus.OK)
            .count();
        return ConnectivitySummary.builder()
            .totalInstances(total)
            .reachableInstances(reachable)
            .displayAvailable(display)
            .availabilityPercent(total > 0 ? (reachable * 100.0) / total : 0.0)
            .lastProbeAt(lastProbeAt)
            .build();
    }

    private void probeDisplay(FleetInstance instance, ConnectivityReport.ConnectivityReportBuilder report) {
        int timeoutMs = (int) timeout.toMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(instance.getAddress(), instance.getVncPort()), timeoutMs);
            socket.setSoTimeout(timeoutMs);
            String banner = readBanner(socket.getInputStream());
            Matcher matcher = RFB_BANNER.matcher(banner);
            if (matcher.find()) {
                report.displayStatus(ProbeStatus.OK).rfbVersion(matcher.group(1));
            } else {
                report.displayStatus(ProbeStatus.PROTOCOL_ERROR).error("Unexpected display banner");
            }
        } catch (SocketTimeoutException e) {
            report.displayStatus(ProbeStatus.TIMEOUT).error("Display port timed out");
        } catch (IOException e) {
            report.displayStatus(ProbeStatus.FAILED).error("Display port: " + e.getMessage());
        }
    }

    private void probeHealthEndpoint(FleetInstance instance, ConnectivityReport.ConnectivityReportBuilder report) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(instance.agentBaseUrl() + healthPath, String.class);
            int status = response.getStatusCode().value();
            report.healthHttpStatus(status)
                .healthStatus(response.getStatusCode().is2xxSuccessful() ? ProbeStatus.OK : ProbeStatus.FAILED);
        } catch (HttpStatusCodeException e) {
            report.healthHttpStatus(e.getStatusCode().value()).healthStatus(ProbeStatus.FAILED);
        } catch (ResourceAccessException e) {
            report.healthStatus(e.getCause() instanceof SocketTimeoutException ? ProbeStatus.TIMEOUT : ProbeStatus.FAILED);
        } catch (RestClientException e) {
            report.healthStatus(ProbeStatus.FAILED);
        }
    }

    private static String readBanner(InputStream in) throws IOException {
        byte[] buffer = new byte[BANNER_LENGTH];
        int read = 0;
        while (read < BANNER_LENGTH) {
            int n = in.read(buffer, read, BANNER_LENGTH - read);
            if (n < 0) {
                break;
            }
            read += n;
        }
        return new String(buffer, 0, read, StandardCharsets.US_ASCII);
    }

    private ConnectivityReport unknown(FleetInstance instance, String error) {
        return ConnectivityReport.builder()
            .instanceId(instance.getId())
            .checkedAt(clock.instant())
            .displayStatus(ProbeStatus.UNKNOWN)
            .healthStatus(ProbeStatus.UNKNOWN)
            .error(error)
            .build();
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
