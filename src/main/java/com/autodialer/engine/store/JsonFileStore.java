package com.autodialer.engine.store;

import com.autodialer.engine.exception.PersistenceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 以整份快照读写的 JSON 文件存储。
 *
 * 写入流程：同目录临时文件 -> 原子 rename，读者要么看到旧快照，要么看到新快照，不会看到半截文件。
 * 所有写都在同一把锁里串行执行；每个存储只允许一个所有者组件持有。
 */
@Slf4j
public class JsonFileStore<T> {

    private final Path file;
    private final TypeReference<T> type;
    private final Supplier<T> emptyValue;
    private final ObjectMapper mapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JsonFileStore(Path file, TypeReference<T> type, Supplier<T> emptyValue) {
        this(file, type, emptyValue, defaultMapper());
    }

    public JsonFileStore(Path file, TypeReference<T> type, Supplier<T> emptyValue, ObjectMapper mapper) {
        this.file = file;
        this.type = type;
        this.emptyValue = emptyValue;
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /**
     * 读取完整快照。文件不存在视为空存储；文件存在但读不出来直接抛 {@link PersistenceException}。
     */
    public T load() {
        if (!Files.exists(file)) {
            log.info("Store file {} does not exist yet, starting empty", file);
            return emptyValue.get();
        }
        try {
            T value = mapper.readValue(file.toFile(), type);
            return value != null ? value : emptyValue.get();
        } catch (IOException e) {
            log.error("Failed to read store file {}", file, e);
            throw new PersistenceException("Could not read " + file.getFileName(), e);
        }
    }

    /**
     * 原子地写入完整快照。
     */
    public void save(T snapshot) {
        writeLock.lock();
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                try (OutputStream out = Files.newOutputStream(tmp)) {
                    mapper.writeValue(out, snapshot);
                }
                moveIntoPlace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            log.error("Failed to write store file {}", file, e);
            throw new PersistenceException("Could not write " + file.getFileName(), e);
        } finally {
            writeLock.unlock();
        }
    }

    public Path getFile() {
        return file;
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
