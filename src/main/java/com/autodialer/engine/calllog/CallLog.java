package com.autodialer.engine.calllog;

import com.autodialer.engine.exception.PersistenceException;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.model.CallStatistics;
import com.autodialer.engine.model.CallStatus;
import com.autodialer.engine.store.JsonFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 只追加的呼叫历史。唯一持有呼叫日志存储的组件。
 *
 * append 在返回前已经写盘并对后续读可见；并发写在对象锁上串行。
 * 统计每次都基于全量日志重新计算。
 */
@Service
@Slf4j
public class CallLog {

    private static final Comparator<CallRecord> NEWEST_FIRST = Comparator.comparing(
            CallRecord::getTimestamp, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final JsonFileStore<List<CallRecord>> store;
    private final List<CallRecord> records = new ArrayList<>();

    public CallLog(JsonFileStore<List<CallRecord>> store) {
        this.store = store;
        records.addAll(store.load());
        log.info("Loaded {} call logs", records.size());
    }

    public synchronized void append(CallRecord record) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(record.getStatus(), "record.status");
        records.add(record);
        try {
            persist();
        } catch (PersistenceException e) {
            records.remove(records.size() - 1);
            throw e;
        }
        log.info("Logged call: {} - {}", record.getPhoneNumber(), record.getStatus().code());
    }

    /**
     * 最新的在前；时间戳相同时后追加的在前。
     *
     * @param status 为 null 时不过滤
     */
    public synchronized List<CallRecord> list(int limit, CallStatus status) {
        if (limit <= 0) {
            return List.of();
        }
        List<CallRecord> view = new ArrayList<>(records.size());
        for (CallRecord r : records) {
            if (status == null || status == r.getStatus()) {
                view.add(r);
            }
        }
        Collections.reverse(view);
        view.sort(NEWEST_FIRST);
        return List.copyOf(view.subList(0, Math.min(limit, view.size())));
    }

    public List<CallRecord> list(int limit) {
        return list(limit, null);
    }

    public synchronized CallStatistics stats() {
        long answered = 0;
        long failed = 0;
        long queued = 0;
        for (CallRecord r : records) {
            if (r.getStatus() == null) continue;
            switch (r.getStatus()) {
                case ANSWERED -> answered++;
                case FAILED -> failed++;
                case QUEUED -> queued++;
            }
        }
        long total = answered + failed + queued;
        double successRate = total == 0 ? 0d : (double) answered / total;
        return new CallStatistics(total, answered, failed, queued, successRate);
    }

    /**
     * 删除某个号码的全部历史。只在调用方明确要求时使用，删号码本身不会触发。
     *
     * @return 删除的记录数
     */
    public synchronized int deleteAllFor(String phoneNumber) {
        List<CallRecord> previous = new ArrayList<>(records);
        records.removeIf(r -> Objects.equals(r.getPhoneNumber(), phoneNumber));
        int removed = previous.size() - records.size();
        if (removed == 0) {
            return 0;
        }
        try {
            persist();
        } catch (PersistenceException e) {
            records.clear();
            records.addAll(previous);
            throw e;
        }
        log.info("Purged {} call logs for {}", removed, phoneNumber);
        return removed;
    }

    public synchronized void clear() {
        List<CallRecord> previous = new ArrayList<>(records);
        records.clear();
        try {
            persist();
        } catch (PersistenceException e) {
            records.addAll(previous);
            throw e;
        }
        log.info("Cleared {} call logs", previous.size());
    }

    public synchronized int size() {
        return records.size();
    }

    private void persist() {
        store.save(new ArrayList<>(records));
    }
}
