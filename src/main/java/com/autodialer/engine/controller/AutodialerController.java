package com.autodialer.engine.controller;

import com.autodialer.engine.calllog.CallLog;
import com.autodialer.engine.command.CommandInterpreter;
import com.autodialer.engine.command.CommandResult;
import com.autodialer.engine.config.AutodialerProperties;
import com.autodialer.engine.dispatch.BatchResult;
import com.autodialer.engine.dispatch.CallDispatcher;
import com.autodialer.engine.model.BulkAddResult;
import com.autodialer.engine.model.CallRecord;
import com.autodialer.engine.model.CallStatistics;
import com.autodialer.engine.model.CallStatus;
import com.autodialer.engine.registry.PhoneNumberNormalizer;
import com.autodialer.engine.registry.PhoneRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api/autodialer")
@Slf4j
@RequiredArgsConstructor
public class AutodialerController {

    private final PhoneRegistry registry;
    private final CallDispatcher dispatcher;
    private final CallLog callLog;
    private final CommandInterpreter interpreter;
    private final AutodialerProperties properties;

    @PostMapping("/numbers")
    public BulkAddResult uploadNumbers(@Valid @RequestBody UploadNumbersRequest request) {
        log.info("Uploading {} phone numbers", request.getPhoneNumbers().size());
        return registry.addAll(request.getPhoneNumbers());
    }

    /**
     * txt / csv，每行一个号码。
     */
    @PostMapping(value = "/numbers/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public BulkAddResult uploadNumbersFile(@RequestPart("file") MultipartFile file) throws Exception {
        log.info("Received number file: name={}, size={}", file.getOriginalFilename(), file.getSize());
        try (InputStream in = file.getInputStream()) {
            return registry.addFromStream(in);
        }
    }

    @GetMapping("/numbers")
    public PhoneNumbersResponse listNumbers() {
        List<String> numbers = registry.list();
        return new PhoneNumbersResponse(numbers.size(), numbers);
    }

    /**
     * 默认保留该号码的呼叫历史，purgeHistory=true 时一并删除。
     */
    @DeleteMapping("/numbers/{phoneNumber}")
    public RemoveNumberResponse deleteNumber(@PathVariable String phoneNumber,
                                             @RequestParam(defaultValue = "false") boolean purgeHistory) {
        int remaining = registry.remove(phoneNumber);
        int purged = 0;
        if (purgeHistory) {
            purged = callLog.deleteAllFor(PhoneNumberNormalizer.normalize(phoneNumber));
        }
        return new RemoveNumberResponse(true, "Phone number " + phoneNumber + " removed", remaining, purged);
    }

    @DeleteMapping("/numbers")
    public PhoneNumbersResponse clearNumbers() {
        registry.clear();
        return new PhoneNumbersResponse(0, List.of());
    }

    @PostMapping("/calls/all")
    public BatchResult callAll() {
        return dispatcher.callAll();
    }

    @PostMapping("/calls/{phoneNumber}")
    public CallRecord callNumber(@PathVariable String phoneNumber) {
        return dispatcher.callOne(phoneNumber);
    }

    @PostMapping("/commands")
    public CommandResult executeCommand(@Valid @RequestBody CommandRequest request) {
        log.info("Processing command: {}", request.getCommand());
        return interpreter.execute(request.getCommand(), request.getApiKey());
    }

    @GetMapping("/calls/logs")
    public List<CallRecord> callLogs(@RequestParam(required = false) Integer limit,
                                     @RequestParam(required = false) String status) {
        int effectiveLimit = limit != null ? limit : properties.getCallLog().getDefaultLimit();
        return callLog.list(effectiveLimit, CallStatus.fromCode(status));
    }

    @GetMapping("/calls/stats")
    public CallStatistics statistics() {
        return callLog.stats();
    }

    @DeleteMapping("/calls/logs")
    public CallStatistics clearLogs() {
        callLog.clear();
        return callLog.stats();
    }
}
