package xyz.vvrf.canvas.flow.dispatch;

import reactor.core.publisher.Mono;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockKind;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;

/**
 * 某一种块类型的内容生成实现，例如接入文本模型或图像模型的适配器。
 * 在 Spring 环境中声明为 Bean 即可被 {@link RoutingGenerationDispatcher} 自动收集。
 */
public interface ContentGenerator {

    /**
     * @return 此生成器负责的块类型
     */
    BlockKind kind();

    /**
     * @return 生成的文本，或图像/视频资源的 URL
     */
    Mono<String> generate(Block block, String resolvedPrompt, ExecutionOptions options);
}
