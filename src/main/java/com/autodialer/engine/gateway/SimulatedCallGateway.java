package com.autodialer.engine.gateway;

import com.autodialer.engine.config.AutodialerProperties;
import com.autodialer.engine.model.CallOutcome;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * 没有可用电话凭据时使用的模拟网关。
 *
 * 结果分布固定：60% answered（时长在 [minDuration, maxDuration) 均匀分布），
 * 20% queued，20% failed（随机一个失败原因）。
 *
 * 随机数的消耗顺序：延迟（仅 maxLatency > minLatency 时）-> 结果 -> 时长或失败原因。
 * 测试可以注入固定种子或脚本化的 {@link Random} 来断言准确序列。
 */
@Slf4j
public class SimulatedCallGateway implements CallGateway {

    public static final double ANSWERED_WEIGHT = 0.6;
    public static final double QUEUED_WEIGHT = 0.2;

    static final List<String> FAILURE_REASONS = List.of(
            "No answer",
            "Line busy",
            "Invalid number",
            "Network error"
    );

    private final Random random;
    private final AutodialerProperties.Simulation settings;

    public SimulatedCallGateway(Random random, AutodialerProperties.Simulation settings) {
        this.random = random;
        this.settings = settings;
    }

    @Override
    public String name() {
        return "simulated";
    }

    @Override
    public CallOutcome placeCall(String phoneNumber) {
        try {
            simulateLatency();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallOutcome.failed("Call interrupted");
        }

        double r = random.nextDouble();
        CallOutcome outcome;
        if (r < ANSWERED_WEIGHT) {
            double span = settings.getMaxDuration() - settings.getMinDuration();
            double duration = settings.getMinDuration() + random.nextDouble() * span;
            outcome = CallOutcome.answered(duration, "Call answered and completed successfully");
        } else if (r < ANSWERED_WEIGHT + QUEUED_WEIGHT) {
            outcome = CallOutcome.queued("Call is queued - line busy or ringing");
        } else {
            String reason = FAILURE_REASONS.get(random.nextInt(FAILURE_REASONS.size()));
            outcome = CallOutcome.failed(reason);
        }
        log.debug("Simulated call to {} -> {}", phoneNumber, outcome.getStatus());
        return outcome;
    }

    private void simulateLatency() throws InterruptedException {
        long min = settings.getMinLatency().toMillis();
        long max = settings.getMaxLatency().toMillis();
        if (max <= 0) {
            return;
        }
        long sleep = max <= min ? min : min + (long) (random.nextDouble() * (max - min));
        if (sleep > 0) {
            Thread.sleep(sleep);
        }
    }
}
