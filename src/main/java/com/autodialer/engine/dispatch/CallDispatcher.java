package com.autodialer.engine.dispatch;

import com.autodialer.engine.calllog.CallLog;
import com.autodialer.engine.config.AutodialerProperties;
import com.autodialer.engine.exception.AutodialerException;
import com.autodialer.engine.exception.NoPhoneNumbersException;
import com.autodialer.engine.exception.NumberNotRegisteredException;
import com.autodialer.engine.gateway.CallGateway;
import com.autodialer.engine.gateway.CallGatewaySelector;
import com.autodialer.engine.model.CallOutcome;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.model.CallStatus;
import com.autodialer.engine.registry.PhoneNumberNormalizer;
import com.autodialer.engine.registry.PhoneRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 呼叫调度：从登记表取号码，逐个交给网关，把结果写入呼叫日志。
 *
 * 自身不持有任何持久状态。单个号码的任何异常都在这里被转换成 failed 记录，
 * 不会中断同一批次里的其他号码。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallDispatcher {

    private final PhoneRegistry registry;
    private final CallLog callLog;
    private final CallGatewaySelector gatewaySelector;
    private final AutodialerProperties properties;

    /**
     * 单呼，网关现选。
     */
    public CallRecord callOne(String rawNumber) {
        return callOne(rawNumber, gatewaySelector.select());
    }

    /**
     * 单呼。号码先规范化；开启 require-registered 时要求号码已登记。
     */
    public CallRecord callOne(String rawNumber, CallGateway gateway) {
        String number = PhoneNumberNormalizer.normalize(rawNumber);
        if (properties.getDispatch().isRequireRegistered() && !registry.contains(number)) {
            throw new NumberNotRegisteredException(number);
        }
        log.info("Calling number {} via {}", number, gateway.name());
        return dial(number, gateway);
    }

    /**
     * 呼叫登记表里的全部号码，网关只选一次。
     */
    public BatchResult callAll() {
        return callAll(gatewaySelector.select());
    }

    public BatchResult callAll(CallGateway gateway) {
        List<String> numbers = registry.list();
        if (numbers.isEmpty()) {
            throw new NoPhoneNumbersException();
        }
        log.info("Calling {} numbers via {} (concurrency={})",
                numbers.size(), gateway.name(), properties.getDispatch().getConcurrency());

        List<CallRecord> results = runBatch(numbers, gateway);
        long answered = results.stream().filter(r -> r.getStatus() == CallStatus.ANSWERED).count();
        log.info("Batch finished: {} calls, {} answered", results.size(), answered);
        return new BatchResult(gateway.name(), results.size(), results);
    }

    /**
     * 呼叫一组指定号码（自然语言命令里一次给出多个号码时使用）。
     * 先全部校验再拨号，校验失败时一个都不拨。
     */
    public BatchResult callNumbers(List<String> rawNumbers) {
        List<String> numbers = new ArrayList<>(rawNumbers.size());
        for (String raw : rawNumbers) {
            String number = PhoneNumberNormalizer.normalize(raw);
            if (properties.getDispatch().isRequireRegistered() && !registry.contains(number)) {
                throw new NumberNotRegisteredException(number);
            }
            numbers.add(number);
        }
        CallGateway gateway = gatewaySelector.select();
        log.info("Calling {} given numbers via {}", numbers.size(), gateway.name());
        List<CallRecord> results = runBatch(numbers, gateway);
        return new BatchResult(gateway.name(), results.size(), results);
    }

    private List<CallRecord> runBatch(List<String> numbers, CallGateway gateway) {
        int concurrency = Math.min(properties.getDispatch().getConcurrency(), numbers.size());
        if (concurrency <= 1) {
            List<CallRecord> results = new ArrayList<>(numbers.size());
            for (String number : numbers) {
                results.add(dial(number, gateway));
            }
            return results;
        }

        // 并发模式：日志顺序不保证，但每个号码恰好一条记录，结果按登记顺序返回
        ExecutorService pool = Executors.newFixedThreadPool(concurrency);
        try {
            List<Future<CallRecord>> futures = new ArrayList<>(numbers.size());
            for (String number : numbers) {
                futures.add(pool.submit(() -> dial(number, gateway)));
            }
            List<CallRecord> results = new ArrayList<>(numbers.size());
            RuntimeException firstError = null;
            for (Future<CallRecord> f : futures) {
                try {
                    results.add(f.get());
                } catch (ExecutionException e) {
                    // dial 只会因存储失败抛出，等其他呼叫结束后再抛
                    if (firstError == null) {
                        firstError = e.getCause() instanceof RuntimeException
                                ? (RuntimeException) e.getCause()
                                : new AutodialerException("Call failed", e.getCause());
                    }
                }
            }
            if (firstError != null) {
                throw firstError;
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AutodialerException("Call batch interrupted", e);
        } finally {
            pool.shutdown();
        }
    }

    private CallRecord dial(String number, CallGateway gateway) {
        String callId = UUID.randomUUID().toString();
        Instant timestamp = Instant.now();

        CallOutcome outcome;
        try {
            outcome = gateway.placeCall(number);
            if (outcome == null || outcome.getStatus() == null) {
                outcome = CallOutcome.failed("Gateway returned no outcome");
            }
        } catch (RuntimeException e) {
            log.warn("Error making call to {}: {}", number, e.getMessage());
            outcome = CallOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        CallRecord record = CallRecord.builder()
                .callId(callId)
                .phoneNumber(number)
                .status(outcome.getStatus())
                .duration(outcome.getStatus() == CallStatus.ANSWERED ? outcome.getDuration() : null)
                .errorMessage(outcome.getStatus() == CallStatus.FAILED ? outcome.getErrorMessage() : null)
                .message(outcome.getMessage())
                .providerSid(outcome.getProviderSid())
                .timestamp(timestamp)
                .build();
        callLog.append(record);
        return record;
    }
}
