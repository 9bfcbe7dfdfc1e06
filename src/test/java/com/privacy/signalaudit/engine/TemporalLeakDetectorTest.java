package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.SessionLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.privacy.signalaudit.testutil.TestDataFactory.firstPartyRequest;
import static com.privacy.signalaudit.testutil.TestDataFactory.loadedPage;
import static com.privacy.signalaudit.testutil.TestDataFactory.trackerRequest;
import static org.assertj.core.api.Assertions.assertThat;

class TemporalLeakDetectorTest {

    private static final String HOME = "https://shop.example.com/";
    private static final String ABOUT = "https://shop.example.com/about";

    private final TemporalLeakDetector detector = new TemporalLeakDetector();

    @Test
    void trackerInsideWindow_isLeak_outsideIsNot() {
        NetworkRequest early = trackerRequest("compliance", HOME, "tracker.io", 1200);
        NetworkRequest late = trackerRequest("compliance", HOME, "tracker.io", 1800);
        SessionLog log = SessionLog.builder()
                .label("compliance")
                .pageVisits(List.of(loadedPage(0, HOME, 1000)))
                .requests(List.of(early, late))
                .build();

        assertThat(detector.detectLeaks(log, 500)).containsExactly(early);
    }

    @Test
    void window_lowerBoundInclusive_upperBoundExclusive() {
        NetworkRequest atLoad = trackerRequest("compliance", HOME, "a.tracker.io", 1000);
        NetworkRequest lastMs = trackerRequest("compliance", HOME, "b.tracker.io", 1499);
        NetworkRequest atThreshold = trackerRequest("compliance", HOME, "c.tracker.io", 1500);
        NetworkRequest beforeLoad = trackerRequest("compliance", HOME, "d.tracker.io", 999);
        SessionLog log = SessionLog.builder()
                .label("compliance")
                .pageVisits(List.of(loadedPage(0, HOME, 1000)))
                .requests(List.of(beforeLoad, atLoad, lastMs, atThreshold))
                .build();

        assertThat(detector.detectLeaks(log, 500)).containsExactly(atLoad, lastMs);
    }

    @Test
    void nonTrackerRequests_neverLeak() {
        SessionLog log = SessionLog.builder()
                .label("compliance")
                .pageVisits(List.of(loadedPage(0, HOME, 0)))
                .requests(List.of(firstPartyRequest("compliance", HOME, "shop.example.com", 10)))
                .build();

        assertThat(detector.detectLeaks(log, 500)).isEmpty();
    }

    @Test
    void requestOfAnotherPage_notMatchedAgainstThisPagesWindow() {
        NetworkRequest fromHome = trackerRequest("compliance", HOME, "tracker.io", 5100);
        SessionLog log = SessionLog.builder()
                .label("compliance")
                .pageVisits(List.of(loadedPage(0, HOME, 0), loadedPage(1, ABOUT, 5000)))
                .requests(List.of(fromHome))
                .build();

        assertThat(detector.detectLeaks(log, 500)).isEmpty();
    }

    @Test
    void sameUrlVisitedTwice_requestReportedOnce_inCaptureOrder() {
        NetworkRequest first = trackerRequest("compliance", HOME, "tracker.io", 100);
        NetworkRequest second = trackerRequest("compliance", HOME, "x.tracker.io", 5050);
        NetworkRequest third = trackerRequest("compliance", HOME, "y.tracker.io", 5060);
        SessionLog log = SessionLog.builder()
                .label("compliance")
                .pageVisits(List.of(loadedPage(0, HOME, 0), loadedPage(1, HOME, 5000)))
                .requests(List.of(first, second, third))
                .build();

        assertThat(detector.detectLeaks(log, 10_000)).containsExactly(first, second, third);
    }

    @Test
    void detectLeaks_isIdempotent() {
        SessionLog log = SessionLog.builder()
                .label("compliance")
                .pageVisits(List.of(loadedPage(0, HOME, 0)))
                .requests(List.of(trackerRequest("compliance", HOME, "tracker.io", 200),
                        trackerRequest("compliance", HOME, "tracker.io", 900)))
                .build();

        List<NetworkRequest> first = detector.detectLeaks(log, 500);
        List<NetworkRequest> second = detector.detectLeaks(log, 500);

        assertThat(second).isEqualTo(first).hasSize(1);
    }

    @Test
    void emptyLog_hasNoLeaks() {
        assertThat(detector.detectLeaks(SessionLog.empty("compliance"), 500)).isEmpty();
    }
}
