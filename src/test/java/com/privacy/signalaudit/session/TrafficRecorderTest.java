package com.privacy.signalaudit.session;

import com.privacy.signalaudit.classification.PiiPatternTable;
import com.privacy.signalaudit.classification.RequestClassifier;
import com.privacy.signalaudit.classification.TrackerDomainTable;
import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.PageStatus;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class TrafficRecorderTest {

    private static final String PAGE = "https://shop.example.com/";

    private final AtomicLong now = new AtomicLong();
    private TrafficRecorder recorder;

    @BeforeEach
    void setUp() {
        RequestClassifier classifier = new RequestClassifier(
                new TrackerDomainTable(List.of("doubleclick.net")),
                new PiiPatternTable(Map.of("uid_param", "[?&]uid=[^&]+")));
        recorder = new TrafficRecorder("compliance", SessionClock.of(now::get), classifier);
    }

    @Test
    void onRequest_recordsClassifiedRequestAgainstCurrentPage() {
        now.set(100);
        long loadedAt = recorder.beginPage(0, PAGE);
        now.set(150);
        recorder.onRequest("https://ad.doubleclick.net/px?uid=42", "GET", "image");
        recorder.recordPage(TestDataFactory.loadedPage(0, PAGE, loadedAt));

        SessionLog log = recorder.freeze(false, false, null);

        assertThat(loadedAt).isEqualTo(100);
        assertThat(log.getRequests()).hasSize(1);
        NetworkRequest request = log.getRequests().get(0);
        assertThat(request.getSessionLabel()).isEqualTo("compliance");
        assertThat(request.getPageUrl()).isEqualTo(PAGE);
        assertThat(request.getVisitIndex()).isZero();
        assertThat(request.getRequestTimestampMs()).isEqualTo(150);
        assertThat(request.getDomain()).isEqualTo("ad.doubleclick.net");
        assertThat(request.isTracker()).isTrue();
        assertThat(request.isContainsPii()).isTrue();
        assertThat(request.getPiiTypes()).containsExactly("uid_param");
    }

    @Test
    void duplicateTriple_recordedOnce_butSameRequestLaterIsKept() {
        recorder.beginPage(0, PAGE);
        now.set(10);
        recorder.onRequest("https://ad.doubleclick.net/px", "GET", "image");
        recorder.onRequest("https://ad.doubleclick.net/px", "GET", "image");
        recorder.onRequest("https://ad.doubleclick.net/px", "POST", "xhr");
        now.set(11);
        recorder.onRequest("https://ad.doubleclick.net/px", "GET", "image");

        SessionLog log = recorder.freeze(false, false, null);

        assertThat(log.getRequests()).extracting(NetworkRequest::getMethod, NetworkRequest::getRequestTimestampMs)
                .containsExactly(
                        tuple("GET", 10L),
                        tuple("POST", 10L),
                        tuple("GET", 11L));
    }

    @Test
    void malformedUrl_recordedWithErrorInsteadOfDropped() {
        recorder.beginPage(0, PAGE);
        recorder.onRequest("https:///px?q=1", "GET", "image");

        SessionLog log = recorder.freeze(false, false, null);

        assertThat(log.getRequests()).hasSize(1);
        assertThat(log.getRequests().get(0).getClassificationError()).isNotNull();
        assertThat(log.getRequests().get(0).isTracker()).isFalse();
        assertThat(log.getRequests().get(0).isContainsPii()).isFalse();
    }

    @Test
    void freeze_isFinal_laterAppendsIgnored() {
        recorder.beginPage(0, PAGE);
        recorder.recordPage(TestDataFactory.loadedPage(0, PAGE, 0));
        SessionLog first = recorder.freeze(false, false, null);

        recorder.onRequest("https://ad.doubleclick.net/late", "GET", "image");
        SessionLog second = recorder.freeze(true, true, "ignored");

        assertThat(second).isSameAs(first);
        assertThat(second.getRequests()).isEmpty();
        assertThat(second.isTimedOut()).isFalse();
        assertThat(recorder.isFrozen()).isTrue();
        assertThatThrownBy(() -> recorder.beginPage(1, PAGE)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void freeze_keepsInterruptedPageAsFailed() {
        recorder.beginPage(0, PAGE);
        recorder.onRequest("https://ad.doubleclick.net/px", "GET", "image");

        SessionLog log = recorder.freeze(true, false, null);

        assertThat(log.isTimedOut()).isTrue();
        assertThat(log.getPageVisits()).hasSize(1);
        assertThat(log.getPageVisits().get(0).getStatus()).isEqualTo(PageStatus.FAILED);
        assertThat(log.getRequests()).hasSize(1);
    }

    @Test
    void requestsBeforeFirstPage_areNotAttributed() {
        recorder.onRequest("https://ad.doubleclick.net/px", "GET", "image");

        assertThat(recorder.freeze(false, false, null).getRequests()).isEmpty();
    }

    @Test
    void frozenLog_isUnmodifiable() {
        recorder.beginPage(0, PAGE);
        recorder.onRequest("https://ad.doubleclick.net/px", "GET", "image");
        SessionLog log = recorder.freeze(false, false, null);

        assertThatThrownBy(() -> log.getRequests().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> log.getPageVisits().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void concurrentAppends_captureOrderIsNonDecreasingInTime() throws Exception {
        AtomicLong ticking = new AtomicLong();
        TrafficRecorder concurrent = new TrafficRecorder("baseline",
                SessionClock.of(ticking::incrementAndGet),
                new RequestClassifier(new TrackerDomainTable(List.of("doubleclick.net")), new PiiPatternTable(Map.of())));
        concurrent.beginPage(0, PAGE);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 4; t++) {
            int thread = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 250; i++) {
                    concurrent.onRequest("https://ad.doubleclick.net/px?t=" + thread + "&i=" + i, "GET", "image");
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        SessionLog log = concurrent.freeze(false, false, null);
        List<Long> timestamps = new ArrayList<>();
        log.getRequests().forEach(r -> timestamps.add(r.getRequestTimestampMs()));

        assertThat(log.getRequests()).hasSize(1000);
        assertThat(timestamps).isSorted();
    }
}
