package xyz.vvrf.canvas.flow.core;

import reactor.core.publisher.Mono;

/**
 * 按块类型执行实际的内容生成。
 */
public interface GenerationDispatcher {

    /**
     * 执行一次生成。
     * 失败必须以错误信号表示，不能以空输出表示。
     *
     * @param block          正在执行的块
     * @param resolvedPrompt 已解析变量的提示词
     * @param options        本次运行的选项
     * @return 输出文本或资源 URL
     */
    Mono<String> generate(Block block, String resolvedPrompt, ExecutionOptions options);
}
