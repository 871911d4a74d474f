package com.autodialer.engine.registry;

import com.autodialer.engine.exception.PersistenceException;
import com.autodialer.engine.exception.PhoneNumberNotFoundException;
import com.autodialer.engine.model.AddOutcome;
import com.autodialer.engine.model.BulkAddResult;
import com.autodialer.engine.store.JsonFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 号码登记表。唯一持有号码存储的组件，所有写操作串行执行，
 * 每次变更后同步写入完整快照；写盘失败时内存状态回滚。
 */
@Service
@Slf4j
public class PhoneRegistry {

    private final JsonFileStore<PhoneNumberSnapshot> store;
    private final Set<String> numbers = new LinkedHashSet<>();

    public PhoneRegistry(JsonFileStore<PhoneNumberSnapshot> store) {
        this.store = store;
        PhoneNumberSnapshot snapshot = store.load();
        if (snapshot.getPhoneNumbers() != null) {
            for (String n : snapshot.getPhoneNumbers()) {
                // 旧文件里可能有手工写入的脏数据
                PhoneNumberNormalizer.tryNormalize(n).ifPresentOrElse(
                        numbers::add,
                        () -> log.warn("Dropping invalid stored phone number: {}", n));
            }
        }
        log.info("Loaded {} phone numbers from storage", numbers.size());
    }

    public synchronized AddOutcome add(String raw) {
        BulkAddResult result = addAll(List.of(raw == null ? "" : raw));
        if (result.getAdded() == 1) return AddOutcome.ADDED;
        if (result.getDuplicates() == 1) return AddOutcome.DUPLICATE;
        return AddOutcome.INVALID;
    }

    public synchronized BulkAddResult addAll(Collection<String> rawNumbers) {
        BulkAddResult result = new BulkAddResult();
        List<String> added = new ArrayList<>();

        for (String raw : rawNumbers) {
            String normalized = PhoneNumberNormalizer.tryNormalize(raw).orElse(null);
            if (normalized == null) {
                result.record(AddOutcome.INVALID, raw, null);
            } else if (!numbers.add(normalized)) {
                result.record(AddOutcome.DUPLICATE, raw, normalized);
            } else {
                added.add(normalized);
                result.record(AddOutcome.ADDED, raw, normalized);
            }
        }

        if (!added.isEmpty()) {
            try {
                persist();
            } catch (PersistenceException e) {
                added.forEach(numbers::remove);
                throw e;
            }
        }
        result.setTotal(numbers.size());
        log.info("Phone upload: added={}, invalid={}, duplicates={}, total={}",
                result.getAdded(), result.getInvalid(), result.getDuplicates(), result.getTotal());
        return result;
    }

    /**
     * 按行读取上传的 txt / csv，每行一个号码，逗号分隔时只取第一列。
     */
    public BulkAddResult addFromStream(InputStream in) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                String cell = line.split(",", 2)[0].strip();
                if (!cell.isEmpty()) {
                    lines.add(cell);
                }
            }
        }
        log.info("Uploading {} phone numbers from file", lines.size());
        return addAll(lines);
    }

    /**
     * @return 删除后剩余的号码数量
     */
    public synchronized int remove(String raw) {
        String normalized = PhoneNumberNormalizer.tryNormalize(raw)
                .orElseThrow(() -> new PhoneNumberNotFoundException(raw));
        if (!numbers.contains(normalized)) {
            throw new PhoneNumberNotFoundException(raw);
        }
        List<String> previous = new ArrayList<>(numbers);
        numbers.remove(normalized);
        try {
            persist();
        } catch (PersistenceException e) {
            numbers.clear();
            numbers.addAll(previous);
            throw e;
        }
        log.info("Removed phone number {}, remaining={}", normalized, numbers.size());
        return numbers.size();
    }

    public synchronized void clear() {
        List<String> previous = new ArrayList<>(numbers);
        numbers.clear();
        try {
            persist();
        } catch (PersistenceException e) {
            numbers.addAll(previous);
            throw e;
        }
        log.info("Cleared {} phone numbers", previous.size());
    }

    public synchronized List<String> list() {
        return List.copyOf(numbers);
    }

    public synchronized boolean contains(String normalized) {
        return numbers.contains(normalized);
    }

    public synchronized int size() {
        return numbers.size();
    }

    private void persist() {
        store.save(new PhoneNumberSnapshot(new ArrayList<>(numbers)));
    }
}
