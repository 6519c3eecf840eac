package xyz.vvrf.canvas.flow.dispatch;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockKind;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;
import xyz.vvrf.canvas.flow.core.GenerationDispatcher;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 按块类型将生成请求路由到对应的 {@link ContentGenerator}。
 * 同一类型注册多个生成器视为配置错误。
 */
@Slf4j
public class RoutingGenerationDispatcher implements GenerationDispatcher {

    private final Map<BlockKind, ContentGenerator> generators = new EnumMap<>(BlockKind.class);

    public RoutingGenerationDispatcher(List<ContentGenerator> generators) {
        Objects.requireNonNull(generators, "Generators cannot be null");
        for (ContentGenerator generator : generators) {
            ContentGenerator existing = this.generators.putIfAbsent(generator.kind(), generator);
            if (existing != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate ContentGenerator for block type %s: %s and %s",
                        generator.kind(), existing.getClass().getName(), generator.getClass().getName()));
            }
        }
        log.info("RoutingGenerationDispatcher initialized with generators for {}", this.generators.keySet());
    }

    @Override
    public Mono<String> generate(Block block, String resolvedPrompt, ExecutionOptions options) {
        ContentGenerator generator = generators.get(block.getKind());
        if (generator == null) {
            return Mono.error(new UnsupportedBlockKindException(block.getKind()));
        }
        return Mono.defer(() -> generator.generate(block, resolvedPrompt, options));
    }

    public Set<BlockKind> supportedKinds() {
        return Collections.unmodifiableSet(generators.keySet());
    }
}
