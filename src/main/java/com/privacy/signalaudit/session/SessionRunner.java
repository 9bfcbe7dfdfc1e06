package com.privacy.signalaudit.session;

import com.privacy.signalaudit.classification.RequestClassifier;
import com.privacy.signalaudit.config.MetricsConfig;
import com.privacy.signalaudit.config.ScanConfig;
import com.privacy.signalaudit.model.PageStatus;
import com.privacy.signalaudit.model.PageVisit;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.SignalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Drives one browsing session per signal config over the same itinerary.
 *
 * <p>Sessions run concurrently, one worker thread each; within a session pages
 * are visited strictly in itinerary order. A failing page or session never
 * stops the others. Results are merged only once every worker has finished
 * or the hard deadline (total timeout plus grace) has passed. Data captured
 * before a timeout or crash is kept.
 */
@Component
public class SessionRunner {

    private static final Logger log = LoggerFactory.getLogger(SessionRunner.class);

    private final BrowserEngine browserEngine;
    private final RequestClassifier classifier;
    private final MetricsConfig metricsConfig;
    private final Duration grace;
    private final Supplier<SessionClock> clockFactory;

    @Autowired
    public SessionRunner(BrowserEngine browserEngine, RequestClassifier classifier,
                         MetricsConfig metricsConfig, ScanConfig scanConfig) {
        this(browserEngine, classifier, metricsConfig,
                Duration.ofMillis(scanConfig.getSessionGraceMs()), SessionClock::monotonic);
    }

    public SessionRunner(BrowserEngine browserEngine, RequestClassifier classifier,
                         MetricsConfig metricsConfig, Duration grace, Supplier<SessionClock> clockFactory) {
        this.browserEngine = browserEngine;
        this.classifier = classifier;
        this.metricsConfig = metricsConfig;
        this.grace = grace;
        this.clockFactory = clockFactory;
    }

    /**
     * Run every session over the itinerary.
     *
     * @return session logs keyed by label, in the order of {@code configs}
     */
    public Map<String, SessionLog> runSessions(List<String> itinerary, List<SignalConfig> configs,
                                               Duration perPageTimeout, Duration totalTimeout,
                                               ScanEventSink events) {
        Map<String, TrafficRecorder> recorders = new LinkedHashMap<>();
        for (SignalConfig config : configs) {
            if (recorders.containsKey(config.getLabel())) {
                throw new IllegalArgumentException("Duplicate session label: " + config.getLabel());
            }
            recorders.put(config.getLabel(), new TrafficRecorder(config.getLabel(), clockFactory.get(), classifier));
        }
        if (configs.isEmpty()) {
            return Map.of();
        }

        long deadlineNanos = System.nanoTime() + totalTimeout.toNanos();
        List<Callable<SessionLog>> tasks = new ArrayList<>();
        for (SignalConfig config : configs) {
            TrafficRecorder recorder = recorders.get(config.getLabel());
            tasks.add(() -> runSession(config, recorder, itinerary, perPageTimeout, deadlineNanos, events));
        }

        log.info("Starting {} sessions over {} pages (per-page timeout {}ms, total timeout {}ms)",
                configs.size(), itinerary.size(), perPageTimeout.toMillis(), totalTimeout.toMillis());

        ExecutorService pool = Executors.newFixedThreadPool(configs.size(), sessionThreadFactory());
        Map<String, SessionLog> logs = new LinkedHashMap<>();
        try {
            List<Future<SessionLog>> futures = pool.invokeAll(tasks,
                    totalTimeout.plus(grace).toMillis(), TimeUnit.MILLISECONDS);
            for (int i = 0; i < configs.size(); i++) {
                String label = configs.get(i).getLabel();
                logs.put(label, collect(label, futures.get(i), recorders.get(label), events));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for sessions; keeping captured data");
            for (TrafficRecorder recorder : recorders.values()) {
                logs.put(recorder.getSessionLabel(), recorder.freeze(false, true, "scan interrupted"));
            }
        } finally {
            pool.shutdownNow();
        }
        return logs;
    }

    private SessionLog collect(String label, Future<SessionLog> future, TrafficRecorder recorder,
                               ScanEventSink events) throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            events.warning(label, "Session did not finish before the hard deadline; keeping captured data");
            return recorder.freeze(true, false, null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Session {} failed: {}", label, cause.getMessage(), cause);
            events.warning(label, "Session aborted: " + cause.getMessage());
            return recorder.freeze(false, true, cause.getMessage());
        }
    }

    private SessionLog runSession(SignalConfig config, TrafficRecorder recorder, List<String> itinerary,
                                  Duration perPageTimeout, long deadlineNanos, ScanEventSink events) {
        String label = config.getLabel();
        final BrowsingSession session;
        try {
            session = browserEngine.open(config, recorder);
        } catch (RuntimeException e) {
            log.error("Session {} could not open a browser: {}", label, e.getMessage(), e);
            events.warning(label, "Browser launch failed: " + e.getMessage());
            return recorder.freeze(false, true, "browser launch failed: " + e.getMessage());
        }
        events.info(label, "Session started");

        boolean timedOut = false;
        boolean aborted = false;
        String abortReason = null;
        int loaded = 0;

        try (session) {
            for (int index = 0; index < itinerary.size(); index++) {
                if (Thread.currentThread().isInterrupted() || recorder.isFrozen()) {
                    log.debug("Session {} stopped before page {}", label, index);
                    break;
                }
                long remainingNanos = deadlineNanos - System.nanoTime();
                if (remainingNanos <= 0) {
                    timedOut = true;
                    events.warning(label, String.format("Total timeout reached; %d of %d pages not visited",
                            itinerary.size() - index, itinerary.size()));
                    break;
                }

                String url = itinerary.get(index);
                if (!isHttpUrl(url)) {
                    events.warning(label, "Skipping non-http(s) itinerary entry: " + url);
                    continue;
                }

                Duration pageTimeout = perPageTimeout.compareTo(Duration.ofNanos(remainingNanos)) <= 0
                        ? perPageTimeout
                        : Duration.ofNanos(remainingNanos);
                if (visitPage(session, recorder, index, url, pageTimeout, events)) {
                    loaded++;
                }
            }
        } catch (RuntimeException e) {
            aborted = true;
            abortReason = e.getMessage();
            log.error("Session {} aborted: {}", label, e.getMessage(), e);
            events.warning(label, "Session aborted, keeping partial data: " + e.getMessage());
        }

        SessionLog sessionLog = recorder.freeze(timedOut, aborted, abortReason);
        log.info("Session {} finished: {}/{} pages loaded, {} requests captured (timedOut={}, aborted={})",
                label, loaded, sessionLog.getPageVisits().size(), sessionLog.getRequests().size(),
                sessionLog.isTimedOut(), sessionLog.isAborted());
        return sessionLog;
    }

    private boolean visitPage(BrowsingSession session, TrafficRecorder recorder, int index, String url,
                              Duration timeout, ScanEventSink events) {
        String label = recorder.getSessionLabel();
        long loadTimestamp = recorder.beginPage(index, url);
        try {
            PageObservation observation = session.visit(url, timeout);
            recorder.recordPage(PageVisit.builder()
                    .index(index)
                    .url(url)
                    .loadTimestampMs(loadTimestamp)
                    .cookieBannerPresent(observation.isCookieBannerPresent())
                    .optOutLinkPresent(observation.isOptOutLinkPresent())
                    .consentAction(observation.getConsentAction())
                    .status(PageStatus.LOADED)
                    .build());
            metricsConfig.recordPageVisit(label, PageStatus.LOADED.name());
            events.info(label, "Loaded " + url);
            return true;
        } catch (NavigationException e) {
            recorder.recordPage(PageVisit.failed(index, url, loadTimestamp, e.getMessage()));
            metricsConfig.recordPageVisit(label, PageStatus.FAILED.name());
            events.warning(label, (e.isTimeout() ? "Timed out loading " : "Failed to load ") + url
                    + ": " + e.getMessage());
            return false;
        }
    }

    private static boolean isHttpUrl(String url) {
        if (url == null) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private static ThreadFactory sessionThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "browser-session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
