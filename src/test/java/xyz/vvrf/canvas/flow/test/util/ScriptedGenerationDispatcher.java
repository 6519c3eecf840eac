package xyz.vvrf.canvas.flow.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.GenerationDispatcher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * 可按块编号配置行为的 GenerationDispatcher 测试实现。
 * 未配置的块返回 "out:{编号}"。记录每次调用时收到的提示词与并发峰值。
 */
public class ScriptedGenerationDispatcher implements GenerationDispatcher {

    private final Map<String, BiFunction<String, Integer, Mono<String>>> scripts = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final List<String> invocationOrder = new CopyOnWriteArrayList<>();
    private final Map<String, String> promptsByNumber = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    public static String defaultOutput(String number) {
        return "out:" + number;
    }

    /**
     * 配置某个块的行为。函数参数为 (解析后的提示词, 第几次尝试，从 1 开始)。
     */
    public ScriptedGenerationDispatcher script(String number, BiFunction<String, Integer, Mono<String>> behaviour) {
        scripts.put(number, behaviour);
        return this;
    }

    public ScriptedGenerationDispatcher failing(String number, String message) {
        return script(number, (prompt, attempt) -> Mono.error(new IllegalStateException(message)));
    }

    public ScriptedGenerationDispatcher failingTimes(String number, int failures, String message) {
        return script(number, (prompt, attempt) -> attempt <= failures
                ? Mono.<String>error(new IllegalStateException(message + " #" + attempt))
                : Mono.just(defaultOutput(number)));
    }

    @Override
    public Mono<String> generate(Block block, String resolvedPrompt, ExecutionOptions options) {
        return Mono.defer(() -> {
            String number = block.getNumber();
            int attempt = attempts.computeIfAbsent(number, k -> new AtomicInteger()).incrementAndGet();
            invocationOrder.add(number);
            promptsByNumber.put(number, resolvedPrompt);
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            BiFunction<String, Integer, Mono<String>> behaviour = scripts.get(number);
            Mono<String> output = behaviour != null
                    ? behaviour.apply(resolvedPrompt, attempt)
                    : Mono.just(defaultOutput(number));
            return output
                    .doOnTerminate(inFlight::decrementAndGet)
                    .doOnCancel(inFlight::decrementAndGet);
        });
    }

    public List<String> getInvocationOrder() {
        return invocationOrder;
    }

    public String promptOf(String number) {
        return promptsByNumber.get(number);
    }

    public int attemptsOf(String number) {
        AtomicInteger count = attempts.get(number);
        return count != null ? count.get() : 0;
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }
}
