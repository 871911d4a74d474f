package com.autodialer.engine.calllog;

import com.autodialer.engine.TestFixtures;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.model.CallStatistics;
import com.autodialer.engine.model.CallStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;
import static org.assertj.core.api.Assertions.within;

class CallLogTest {

    private static final Instant T0 = Instant.parse("2026-10-01T10:00:00Z");

    @TempDir
    Path dir;

    private static CallRecord record(String id, String number, CallStatus status, Instant ts) {
        return CallRecord.builder()
                .callId(id)
                .phoneNumber(number)
                .status(status)
                .duration(status == CallStatus.ANSWERED ? 12.5 : null)
                .errorMessage(status == CallStatus.FAILED ? "No answer" : null)
                .timestamp(ts)
                .build();
    }

    @Test
    void emptyLogHasZeroStatistics() {
        CallStatistics stats = TestFixtures.callLog(dir).stats();

        assertThat(stats.getTotalCalls()).isZero();
        assertThat(stats.getSuccessRate()).isZero();
    }

    @Test
    void appendIsVisibleImmediatelyAndDurable() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("c1", "+12345678900", CallStatus.ANSWERED, T0));

        assertThat(log.stats().getTotalCalls()).isEqualTo(1);

        CallLog reloaded = TestFixtures.callLog(dir);
        assertThat(reloaded.list(10)).singleElement().satisfies(r -> {
            assertThat(r.getCallId()).isEqualTo("c1");
            assertThat(r.getStatus()).isEqualTo(CallStatus.ANSWERED);
            assertThat(r.getDuration()).isEqualTo(12.5);
            assertThat(r.getTimestamp()).isEqualTo(T0);
        });
    }

    @Test
    void listIsNewestFirstAndBounded() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("old", "1234567890", CallStatus.FAILED, T0));
        log.append(record("new", "1234567890", CallStatus.QUEUED, T0.plusSeconds(60)));
        log.append(record("mid", "1234567890", CallStatus.ANSWERED, T0.plusSeconds(30)));

        assertThat(log.list(10)).extracting(CallRecord::getCallId).containsExactly("new", "mid", "old");
        assertThat(log.list(2)).extracting(CallRecord::getCallId).containsExactly("new", "mid");
        assertThat(log.list(0)).isEmpty();
    }

    @Test
    void sameTimestampListsLaterAppendFirst() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("first", "1234567890", CallStatus.QUEUED, T0));
        log.append(record("second", "1234567890", CallStatus.QUEUED, T0));

        assertThat(log.list(10)).extracting(CallRecord::getCallId).containsExactly("second", "first");
    }

    @Test
    void listCanFilterByStatus() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("a", "1234567890", CallStatus.ANSWERED, T0));
        log.append(record("f", "1234567890", CallStatus.FAILED, T0.plusSeconds(1)));

        assertThat(log.list(10, CallStatus.FAILED)).extracting(CallRecord::getCallId).containsExactly("f");
    }

    @Test
    void statsCoverWholeLogNotJustPage() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("1", "1234567890", CallStatus.ANSWERED, T0));
        log.append(record("2", "1234567890", CallStatus.ANSWERED, T0.plusSeconds(1)));
        log.append(record("3", "1234567890", CallStatus.FAILED, T0.plusSeconds(2)));
        log.append(record("4", "1234567890", CallStatus.QUEUED, T0.plusSeconds(3)));
        log.list(1);

        CallStatistics stats = log.stats();

        assertThat(stats.getTotalCalls()).isEqualTo(4);
        assertThat(stats.getAnswered()).isEqualTo(2);
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.getQueued()).isEqualTo(1);
        assertThat(stats.getAnswered() + stats.getFailed() + stats.getQueued()).isEqualTo(stats.getTotalCalls());
        assertThat(stats.getSuccessRate()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void deleteAllForPrunesOnlyThatNumber() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("1", "+12345678900", CallStatus.ANSWERED, T0));
        log.append(record("2", "19998887777", CallStatus.FAILED, T0));
        log.append(record("3", "+12345678900", CallStatus.QUEUED, T0));

        assertThat(log.deleteAllFor("+12345678900")).isEqualTo(2);
        assertThat(log.deleteAllFor("+12345678900")).isZero();
        assertThat(TestFixtures.callLog(dir).list(10)).extracting(CallRecord::getCallId).containsExactly("2");
    }

    @Test
    void clearRemovesEverything() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("1", "+12345678900", CallStatus.ANSWERED, T0));

        log.clear();

        assertThat(log.size()).isZero();
        assertThat(TestFixtures.callLog(dir).list(10)).isEmpty();
    }

    @Test
    void persistedStatusUsesLowercaseCodes() throws Exception {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("1", "+12345678900", CallStatus.ANSWERED, T0));

        String json = Files.readString(dir.resolve("call_logs.json"));
        assertThat(json).contains("\"status\" : \"answered\"").contains("2026-10-01T10:00:00Z");
    }

    @Test
    void listReturnsSnapshot() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("1", "+12345678900", CallStatus.ANSWERED, T0));
        List<CallRecord> page = log.list(10);

        log.append(record("2", "+12345678900", CallStatus.ANSWERED, T0.plusSeconds(5)));

        assertThat(page).hasSize(1);
    }

    @Test
    void returnedRecordsCannotRewriteHistory() {
        CallLog log = TestFixtures.callLog(dir);
        log.append(record("1", "+12345678900", CallStatus.ANSWERED, T0));
        log.append(record("2", "+12345678900", CallStatus.QUEUED, T0.plusSeconds(1)));

        assertThat(CallRecord.class.getMethods()).extracting(Method::getName)
                .noneMatch(name -> name.startsWith("set"));
        assertThat(log.list(10)).isUnmodifiable();

        CallStatistics stats = log.stats();
        assertThat(stats.getAnswered()).isEqualTo(1);
        assertThat(stats.getQueued()).isEqualTo(1);
        assertThat(stats.getSuccessRate()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void recordWithoutStatusIsRejectedBeforeWrite() {
        CallLog log = TestFixtures.callLog(dir);

        assertThatNullPointerException()
                .isThrownBy(() -> log.append(record("1", "+12345678900", null, T0)));
        assertThat(log.size()).isZero();
        assertThat(Files.exists(dir.resolve("call_logs.json"))).isFalse();
    }
}
